package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a committed pick.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftResult {

    private String playerId;
    private int year;
    private String candidateId;
    private String candidateName;

    /**
     * True if this draft created the candidate record.
     */
    private boolean newCandidate;

    private Instant timestamp;
    private int activePicks;
    private int availableSlots;
}
