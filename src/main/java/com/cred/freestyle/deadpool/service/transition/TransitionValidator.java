package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the incoming season against the invariants a transition must establish.
 * Read-only; issues are returned, never thrown.
 *
 * @author Deadpool Team
 */
@Component
public class TransitionValidator {

    private static final Logger logger = LoggerFactory.getLogger(TransitionValidator.class);

    /**
     * @param fromYear Outgoing year
     * @param view Incoming season state
     * @param participants Players expected in the new order
     * @param expectedPickCounts Active outgoing picks per player
     * @param maxPicks Expected max picks on every capacity record
     * @return Issues found, empty if the season is consistent
     */
    public List<ValidationIssue> validate(int fromYear,
                                          TransitionView view,
                                          List<String> participants,
                                          Map<String, Integer> expectedPickCounts,
                                          int maxPicks) {
        List<ValidationIssue> issues = new ArrayList<>(checkDraftOrder(view.getDraftOrder(), participants));

        Map<String, List<String>> holders = new HashMap<>();
        for (String playerId : participants) {
            List<Pick> picks = view.getPicks(playerId);
            int expected = expectedPickCounts.getOrDefault(playerId, 0);

            if (picks.size() != expected) {
                issues.add(new ValidationIssue(playerId, ValidationIssue.Check.PICK_COUNT,
                        String.format("Expected %d picks, found %d", expected, picks.size())));
            }

            Set<String> candidateIds = new LinkedHashSet<>();
            for (Pick pick : picks) {
                if (!candidateIds.add(pick.getCandidateId())) {
                    issues.add(new ValidationIssue(playerId, ValidationIssue.Check.DUPLICATE_PICK,
                            "Candidate " + pick.getCandidateId() + " picked more than once"));
                }
                holders.computeIfAbsent(pick.getCandidateId(), id -> new ArrayList<>()).add(playerId);
            }

            Map<String, Candidate> candidates = view.getCandidates(candidateIds);
            for (String candidateId : candidateIds) {
                Candidate candidate = candidates.get(candidateId);
                if (candidate != null && candidate.diedIn(fromYear)) {
                    issues.add(new ValidationIssue(playerId, ValidationIssue.Check.DECEASED_CARRIED,
                            String.format("%s died in %d but was carried forward", candidate.getName(), fromYear)));
                }
            }

            checkCapacity(playerId, view.getCapacity(playerId), picks.size(), maxPicks).ifPresent(issues::add);
        }

        for (Map.Entry<String, List<String>> entry : holders.entrySet()) {
            Set<String> distinct = new LinkedHashSet<>(entry.getValue());
            if (distinct.size() > 1) {
                issues.add(new ValidationIssue(null, ValidationIssue.Check.DUPLICATE_PICK,
                        "Candidate " + entry.getKey() + " held by players " + distinct));
            }
        }

        if (!issues.isEmpty()) {
            logger.warn("Transition from {} failed {} validation checks", fromYear, issues.size());
        }
        return issues;
    }

    private List<ValidationIssue> checkDraftOrder(List<DraftOrderEntry> order, List<String> participants) {
        List<ValidationIssue> issues = new ArrayList<>();

        Set<Integer> positions = new HashSet<>();
        Set<String> players = new HashSet<>();
        for (DraftOrderEntry entry : order) {
            if (!positions.add(entry.getPosition())) {
                issues.add(new ValidationIssue(entry.getPlayerId(), ValidationIssue.Check.DRAFT_ORDER,
                        "Position " + entry.getPosition() + " assigned more than once"));
            }
            if (!players.add(entry.getPlayerId())) {
                issues.add(new ValidationIssue(entry.getPlayerId(), ValidationIssue.Check.DRAFT_ORDER,
                        "Player appears more than once in the draft order"));
            }
        }

        for (int position = 1; position <= participants.size(); position++) {
            if (!positions.contains(position)) {
                issues.add(new ValidationIssue(null, ValidationIssue.Check.DRAFT_ORDER,
                        "Position " + position + " is missing"));
            }
        }
        for (Integer position : positions) {
            if (position < 1 || position > participants.size()) {
                issues.add(new ValidationIssue(null, ValidationIssue.Check.DRAFT_ORDER,
                        "Position " + position + " is outside 1.." + participants.size()));
            }
        }
        for (String playerId : participants) {
            if (!players.contains(playerId)) {
                issues.add(new ValidationIssue(playerId, ValidationIssue.Check.DRAFT_ORDER,
                        "Player missing from the draft order"));
            }
        }
        for (String playerId : players) {
            if (!participants.contains(playerId)) {
                issues.add(new ValidationIssue(playerId, ValidationIssue.Check.DRAFT_ORDER,
                        "Player in the draft order did not participate in the outgoing season"));
            }
        }
        return issues;
    }

    private Optional<ValidationIssue> checkCapacity(String playerId, Optional<DraftCapacityRecord> record,
                                                    int picks, int maxPicks) {
        if (record.isEmpty()) {
            return Optional.of(new ValidationIssue(playerId, ValidationIssue.Check.CAPACITY_RECORD,
                    "Capacity record missing"));
        }
        DraftCapacityRecord capacity = record.get();
        int available = Math.max(0, maxPicks - picks);
        if (capacity.getMaxPicks() != maxPicks
                || capacity.getActivePickCount() != picks
                || capacity.getAvailableSlots() != available) {
            return Optional.of(new ValidationIssue(playerId, ValidationIssue.Check.CAPACITY_RECORD,
                    String.format("Expected max=%d active=%d available=%d, found max=%d active=%d available=%d",
                            maxPicks, picks, available,
                            capacity.getMaxPicks(), capacity.getActivePickCount(), capacity.getAvailableSlots())));
        }
        return Optional.empty();
    }
}
