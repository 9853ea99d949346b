package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.DraftCapacityRepository;
import com.cred.freestyle.deadpool.repository.DraftOrderRepository;
import com.cred.freestyle.deadpool.repository.PickRepository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the incoming season back from the store.
 *
 * @author Deadpool Team
 */
class StoreTransitionView implements TransitionView {

    private final int year;
    private final DraftOrderRepository draftOrderRepository;
    private final PickRepository pickRepository;
    private final DraftCapacityRepository capacityRepository;
    private final CandidateRepository candidateRepository;

    StoreTransitionView(int year,
                        DraftOrderRepository draftOrderRepository,
                        PickRepository pickRepository,
                        DraftCapacityRepository capacityRepository,
                        CandidateRepository candidateRepository) {
        this.year = year;
        this.draftOrderRepository = draftOrderRepository;
        this.pickRepository = pickRepository;
        this.capacityRepository = capacityRepository;
        this.candidateRepository = candidateRepository;
    }

    @Override
    public List<DraftOrderEntry> getDraftOrder() {
        return draftOrderRepository.findByYear(year);
    }

    @Override
    public List<Pick> getPicks(String playerId) {
        return pickRepository.findByPlayerAndYear(playerId, year);
    }

    @Override
    public Optional<DraftCapacityRecord> getCapacity(String playerId) {
        return capacityRepository.find(playerId, year);
    }

    @Override
    public Map<String, Candidate> getCandidates(Collection<String> candidateIds) {
        return candidateRepository.findAllById(candidateIds);
    }
}
