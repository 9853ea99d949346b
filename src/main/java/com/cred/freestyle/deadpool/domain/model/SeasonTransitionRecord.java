package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit and idempotency marker for a (fromYear, toYear) rollover.
 * Rewritten on every attempt; {@code attempts} counts them.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonTransitionRecord {

    public static final String STRATEGY_ACTIVE_PICKS_ONLY = "ACTIVE_PICKS_ONLY";

    private int fromYear;
    private int toYear;

    @Builder.Default
    private String strategy = STRATEGY_ACTIVE_PICKS_ONLY;

    private TransitionStatus status;

    @Builder.Default
    private int attempts = 1;

    private int playersProcessed;
    private int picksCarried;
    private int picksRemoved;
    private int validationIssues;

    @Builder.Default
    private List<String> failedPlayers = new ArrayList<>();

    private Instant startedAt;
    private Instant completedAt;

    public enum TransitionStatus {
        IN_PROGRESS,
        COMPLETED,
        COMPLETED_WITH_ERRORS
    }
}
