package com.cred.freestyle.deadpool.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * CloudWatch metrics service for the draft and season-transition engines.
 * Publishes custom metrics to AWS CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Draft commit success/failure by reason, and commit latency
 * - Candidates created vs reused during name resolution
 * - Entity store retries
 * - Transition stage durations and validation issue counts
 *
 * @author Deadpool Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "deadpool.";
    private static final String DRAFT_PREFIX = METRIC_PREFIX + "draft.";
    private static final String CANDIDATE_PREFIX = METRIC_PREFIX + "candidate.";
    private static final String STORE_PREFIX = METRIC_PREFIX + "store.";
    private static final String TRANSITION_PREFIX = METRIC_PREFIX + "transition.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a committed pick.
     *
     * @param year Draft year
     */
    public void recordDraftSuccess(int year) {
        Counter.builder(DRAFT_PREFIX + "success")
                .tag("year", String.valueOf(year))
                .description("Committed draft picks")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded draft success for year {}", year);
    }

    /**
     * Record a rejected draft attempt.
     *
     * @param year Draft year
     * @param reason Failure reason (e.g., "ALREADY_DRAFTED", "CAPACITY_EXCEEDED")
     */
    public void recordDraftFailure(int year, String reason) {
        Counter.builder(DRAFT_PREFIX + "failure")
                .tag("year", String.valueOf(year))
                .tag("reason", reason)
                .description("Rejected draft attempts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded draft failure for year {}, reason: {}", year, reason);
    }

    /**
     * Record draft commit latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordDraftLatency(long durationMs) {
        Timer.builder(DRAFT_PREFIX + "latency")
                .description("Draft commit latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record how a drafted name was resolved to a candidate.
     *
     * @param outcome "created", "exact" or "fuzzy"
     */
    public void recordCandidateResolution(String outcome) {
        Counter.builder(CANDIDATE_PREFIX + "resolution")
                .tag("outcome", outcome)
                .description("Candidate name resolutions")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a retried store operation.
     *
     * @param operation Logical operation name
     */
    public void recordStoreRetry(String operation) {
        Counter.builder(STORE_PREFIX + "retry")
                .tag("operation", operation)
                .description("Entity store retries after transient failures")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record the duration of one transition stage.
     *
     * @param stage Stage name
     * @param durationMs Duration in milliseconds
     */
    public void recordTransitionStage(String stage, long durationMs) {
        Timer.builder(TRANSITION_PREFIX + "stage.duration")
                .tag("stage", stage)
                .description("Season transition stage duration")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded transition stage {} in {}ms", stage, durationMs);
    }

    /**
     * Record validation issues found by a transition run.
     *
     * @param issues Number of issues
     * @param dryRun Whether the run was a dry run
     */
    public void recordTransitionValidationIssues(int issues, boolean dryRun) {
        Counter.builder(TRANSITION_PREFIX + "validation.issues")
                .tag("dry_run", String.valueOf(dryRun))
                .description("Season transition validation issues")
                .register(meterRegistry)
                .increment(issues);
    }
}
