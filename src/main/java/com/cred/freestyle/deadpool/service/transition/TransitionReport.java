package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.LeaderboardEntry;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full result of a season transition run. A dry run produces the report a real run would.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionReport {

    private int fromYear;
    private int toYear;
    private boolean dryRun;
    private SeasonTransitionRecord.TransitionStatus status;
    private int attempt;

    @Builder.Default
    private List<LeaderboardEntry> outgoingLeaderboard = new ArrayList<>();

    @Builder.Default
    private List<DraftOrderEntry> newDraftOrder = new ArrayList<>();

    @Builder.Default
    private List<PlayerTransitionResult> players = new ArrayList<>();

    @Builder.Default
    private List<StageResult> stages = new ArrayList<>();

    @Builder.Default
    private List<ValidationIssue> validationIssues = new ArrayList<>();

    @Builder.Default
    private List<TransitionFailure> failures = new ArrayList<>();

    private int picksCarried;
    private int picksRemoved;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isSuccessful() {
        return validationIssues.isEmpty() && failures.isEmpty();
    }
}
