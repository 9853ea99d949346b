package com.cred.freestyle.deadpool.service.transition;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the carry-forward did for one player.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerTransitionResult {

    private String playerId;

    /**
     * Candidates kept for the new season.
     */
    @Builder.Default
    private List<String> carriedCandidateIds = new ArrayList<>();

    /**
     * Candidates dropped because they died in the outgoing year (or no longer exist).
     */
    @Builder.Default
    private List<String> removedCandidateIds = new ArrayList<>();

    /**
     * New-season picks written by this run; the rest already existed.
     */
    private int picksCreated;

    private int activePickCount;
    private int availableSlots;
}
