package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The incoming season as seen by {@link TransitionValidator}: either the stored state
 * after a real run, or the planned state of a dry run.
 *
 * @author Deadpool Team
 */
public interface TransitionView {

    List<DraftOrderEntry> getDraftOrder();

    List<Pick> getPicks(String playerId);

    Optional<DraftCapacityRecord> getCapacity(String playerId);

    Map<String, Candidate> getCandidates(Collection<String> candidateIds);
}
