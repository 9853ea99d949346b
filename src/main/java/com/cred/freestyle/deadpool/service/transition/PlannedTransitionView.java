package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.service.SeasonSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The incoming season as a dry run would have written it: the store's existing picks for
 * the target year overlaid with the planned carry-forward.
 *
 * @author Deadpool Team
 */
class PlannedTransitionView implements TransitionView {

    private final List<DraftOrderEntry> order;
    private final Map<String, List<Pick>> picks;
    private final Map<String, DraftCapacityRecord> capacities;
    private final SeasonSnapshot outgoing;
    private final CandidateRepository candidateRepository;

    PlannedTransitionView(List<DraftOrderEntry> order,
                          Map<String, List<Pick>> picks,
                          Map<String, DraftCapacityRecord> capacities,
                          SeasonSnapshot outgoing,
                          CandidateRepository candidateRepository) {
        this.order = order;
        this.picks = picks;
        this.capacities = capacities;
        this.outgoing = outgoing;
        this.candidateRepository = candidateRepository;
    }

    @Override
    public List<DraftOrderEntry> getDraftOrder() {
        return order;
    }

    @Override
    public List<Pick> getPicks(String playerId) {
        return picks.getOrDefault(playerId, List.of());
    }

    @Override
    public Optional<DraftCapacityRecord> getCapacity(String playerId) {
        return Optional.ofNullable(capacities.get(playerId));
    }

    @Override
    public Map<String, Candidate> getCandidates(Collection<String> candidateIds) {
        Map<String, Candidate> found = new HashMap<>();
        List<String> drafted = new ArrayList<>();
        for (String candidateId : candidateIds) {
            Candidate candidate = outgoing.getCandidate(candidateId);
            if (candidate != null) {
                found.put(candidateId, candidate);
            } else {
                drafted.add(candidateId);
            }
        }
        // picks already made in the target year may name candidates the outgoing season never saw
        if (!drafted.isEmpty()) {
            found.putAll(candidateRepository.findAllById(drafted));
        }
        return found;
    }
}
