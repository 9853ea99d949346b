package com.cred.freestyle.deadpool.service.transition;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.LeaderboardEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord.TransitionStatus;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.exception.TransientStoreException;
import com.cred.freestyle.deadpool.infrastructure.messaging.DraftEventPublisher;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.SeasonTransitionEvent;
import com.cred.freestyle.deadpool.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.DraftCapacityRepository;
import com.cred.freestyle.deadpool.repository.DraftOrderRepository;
import com.cred.freestyle.deadpool.repository.PickRepository;
import com.cred.freestyle.deadpool.repository.SeasonTransitionRepository;
import com.cred.freestyle.deadpool.service.ScoringService;
import com.cred.freestyle.deadpool.service.SeasonSnapshot;
import com.cred.freestyle.deadpool.service.SeasonSnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Season transition engine: rolls a finished season over into the next one.
 *
 * Stages:
 * 1. COMPUTE_OUTGOING_LEADERBOARD - score the outgoing season
 * 2. BUILD_DRAFT_ORDER - new order is the leaderboard reversed (lowest score drafts first)
 * 3. CARRY_FORWARD_PICKS - copy every pick whose candidate did not die in the outgoing year
 * 4. RECORD_CAPACITY - write each player's capacity record from their new-season picks
 * 5. VALIDATE - check counts, deceased candidates, duplicates, capacity records and the order
 * 6. FINALIZE - write the transition record and publish the completion event
 *
 * Every write is keyed and conditional on current state, so rerunning after a partial
 * failure converges on the same end state. Stages 3 and 4 run per player on a bounded
 * pool created for the run; a failure for one player is collected and does not stop the others.
 *
 * A dry run computes every stage but writes nothing, and validates the planned state.
 *
 * Must not run concurrently with live drafting for the incoming year; this is an
 * operational precondition and is not enforced here.
 *
 * @author Deadpool Team
 */
@Service
public class SeasonTransitionService {

    private static final Logger logger = LoggerFactory.getLogger(SeasonTransitionService.class);

    private final SeasonSnapshotLoader snapshotLoader;
    private final ScoringService scoringService;
    private final DraftOrderRepository draftOrderRepository;
    private final PickRepository pickRepository;
    private final DraftCapacityRepository capacityRepository;
    private final CandidateRepository candidateRepository;
    private final SeasonTransitionRepository transitionRepository;
    private final TransitionValidator validator;
    private final DraftEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;
    private final DeadpoolProperties properties;
    private final Clock clock;

    public SeasonTransitionService(SeasonSnapshotLoader snapshotLoader,
                                   ScoringService scoringService,
                                   DraftOrderRepository draftOrderRepository,
                                   PickRepository pickRepository,
                                   DraftCapacityRepository capacityRepository,
                                   CandidateRepository candidateRepository,
                                   SeasonTransitionRepository transitionRepository,
                                   TransitionValidator validator,
                                   DraftEventPublisher eventPublisher,
                                   CloudWatchMetricsService metricsService,
                                   DeadpoolProperties properties,
                                   Clock clock) {
        this.snapshotLoader = snapshotLoader;
        this.scoringService = scoringService;
        this.draftOrderRepository = draftOrderRepository;
        this.pickRepository = pickRepository;
        this.capacityRepository = capacityRepository;
        this.candidateRepository = candidateRepository;
        this.transitionRepository = transitionRepository;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run the transition from {@code fromYear} to {@code toYear}.
     *
     * @param fromYear Outgoing season
     * @param toYear Incoming season, after fromYear
     * @param dryRun Compute and validate without writing
     * @param verbose Log per-player detail at info instead of debug
     * @return Report of every stage, per-player results, validation issues and failures
     * @throws IllegalArgumentException if toYear is not after fromYear
     * @throws ResourceNotFoundException if the outgoing season has no draft order
     */
    public TransitionReport runTransition(int fromYear, int toYear, boolean dryRun, boolean verbose) {
        if (toYear <= fromYear) {
            throw new IllegalArgumentException("Target year " + toYear + " must be after " + fromYear);
        }
        Run run = new Run(fromYear, toYear, dryRun, verbose);
        logger.info("Starting season transition {} -> {}{}", fromYear, toYear, dryRun ? " (dry run)" : "");

        // Stage 1
        long stageStart = System.currentTimeMillis();
        SeasonSnapshot outgoing = snapshotLoader.load(fromYear);
        if (outgoing.getOrder().isEmpty()) {
            throw new ResourceNotFoundException("Draft order", String.valueOf(fromYear));
        }
        List<LeaderboardEntry> leaderboard = scoringService.computeLeaderboard(outgoing);
        run.report.setOutgoingLeaderboard(leaderboard);
        run.stage(TransitionStage.COMPUTE_OUTGOING_LEADERBOARD, stageStart, leaderboard.size(), false);

        int attempt = transitionRepository.find(fromYear, toYear)
                .map(previous -> previous.getAttempts() + 1)
                .orElse(1);
        run.report.setAttempt(attempt);
        if (!dryRun) {
            transitionRepository.save(SeasonTransitionRecord.builder()
                    .fromYear(fromYear)
                    .toYear(toYear)
                    .status(TransitionStatus.IN_PROGRESS)
                    .attempts(attempt)
                    .startedAt(run.report.getStartedAt())
                    .build());
        }

        // Stage 2
        stageStart = System.currentTimeMillis();
        List<DraftOrderEntry> newOrder = buildDraftOrder(toYear, leaderboard);
        if (!dryRun) {
            draftOrderRepository.replaceOrder(toYear, newOrder);
        }
        run.report.setNewDraftOrder(newOrder);
        run.stage(TransitionStage.BUILD_DRAFT_ORDER, stageStart, newOrder.size(), dryRun);

        List<String> participants = new ArrayList<>(newOrder.size());
        for (DraftOrderEntry entry : newOrder) {
            participants.add(entry.getPlayerId());
        }

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, properties.getTransition().getParallelism()), threadFactory(fromYear, toYear));
        Map<String, DraftCapacityRecord> plannedCapacities = new ConcurrentHashMap<>();
        Map<String, PlayerTransitionResult> results;
        try {
            // Stage 3
            stageStart = System.currentTimeMillis();
            Instant seasonStart = LocalDate.of(toYear, 1, 1)
                    .atStartOfDay(properties.getTransition().getSeasonStartZone())
                    .toInstant();
            results = forEachPlayer(pool, participants, TransitionStage.CARRY_FORWARD_PICKS, run,
                    playerId -> carryForward(run, outgoing, playerId, seasonStart));
            run.stage(TransitionStage.CARRY_FORWARD_PICKS, stageStart, results.size(), dryRun);

            // Stage 4
            stageStart = System.currentTimeMillis();
            Map<String, DraftCapacityRecord> capacities = forEachPlayer(pool, participants,
                    TransitionStage.RECORD_CAPACITY, run,
                    playerId -> recordCapacity(run, results.get(playerId), playerId));
            plannedCapacities.putAll(capacities);
            run.stage(TransitionStage.RECORD_CAPACITY, stageStart, capacities.size(), dryRun);
        } finally {
            pool.shutdown();
        }

        for (String playerId : participants) {
            PlayerTransitionResult result = results.get(playerId);
            if (result != null) {
                DraftCapacityRecord capacity = plannedCapacities.get(playerId);
                if (capacity != null) {
                    result.setActivePickCount(capacity.getActivePickCount());
                    result.setAvailableSlots(capacity.getAvailableSlots());
                }
                run.report.getPlayers().add(result);
                run.report.setPicksCarried(run.report.getPicksCarried() + result.getCarriedCandidateIds().size());
                run.report.setPicksRemoved(run.report.getPicksRemoved() + result.getRemovedCandidateIds().size());
            }
        }

        // Stage 5
        stageStart = System.currentTimeMillis();
        TransitionView view = dryRun
                ? new PlannedTransitionView(newOrder, run.plannedPicks, plannedCapacities, outgoing,
                        candidateRepository)
                : new StoreTransitionView(toYear, draftOrderRepository, pickRepository, capacityRepository,
                        candidateRepository);
        Map<String, Integer> expectedCounts = new HashMap<>();
        for (String playerId : participants) {
            expectedCounts.put(playerId, countActiveOutgoing(outgoing, playerId));
        }
        List<ValidationIssue> issues = validator.validate(fromYear, view, participants, expectedCounts,
                properties.getDraft().getMaxPicks());
        run.report.setValidationIssues(issues);
        for (ValidationIssue issue : issues) {
            logger.warn("Validation [{}] player {}: {}", issue.getCheck(), issue.getPlayerId(), issue.getMessage());
        }
        metricsService.recordTransitionValidationIssues(issues.size(), dryRun);
        run.stage(TransitionStage.VALIDATE, stageStart, participants.size(), false);

        // Stage 6
        stageStart = System.currentTimeMillis();
        run.report.setFailures(new ArrayList<>(run.failures));
        run.report.setStatus(run.report.isSuccessful()
                ? TransitionStatus.COMPLETED
                : TransitionStatus.COMPLETED_WITH_ERRORS);
        run.report.setCompletedAt(clock.instant());
        if (!dryRun) {
            finalizeRecord(run.report, participants.size());
        }
        run.stage(TransitionStage.FINALIZE, stageStart, 1, dryRun);

        logger.info("Season transition {} -> {} {}: {} players, {} picks carried, {} removed, {} issues, {} failures",
                fromYear, toYear, run.report.getStatus(), participants.size(), run.report.getPicksCarried(),
                run.report.getPicksRemoved(), issues.size(), run.report.getFailures().size());
        return run.report;
    }

    /**
     * @throws ResourceNotFoundException if no transition was ever run for the pair
     */
    public SeasonTransitionRecord getTransitionRecord(int fromYear, int toYear) {
        return transitionRepository.find(fromYear, toYear)
                .orElseThrow(() -> new ResourceNotFoundException("Season transition", fromYear + "_TO_" + toYear));
    }

    private List<DraftOrderEntry> buildDraftOrder(int toYear, List<LeaderboardEntry> leaderboard) {
        List<LeaderboardEntry> reversed = new ArrayList<>(leaderboard);
        Collections.reverse(reversed);
        List<DraftOrderEntry> order = new ArrayList<>(reversed.size());
        for (int i = 0; i < reversed.size(); i++) {
            order.add(DraftOrderEntry.builder()
                    .year(toYear)
                    .position(i + 1)
                    .playerId(reversed.get(i).getPlayerId())
                    .build());
        }
        return order;
    }

    private PlayerTransitionResult carryForward(Run run, SeasonSnapshot outgoing, String playerId, Instant seasonStart) {
        PlayerTransitionResult result = PlayerTransitionResult.builder().playerId(playerId).build();

        for (Pick pick : outgoing.getPicks(playerId)) {
            Candidate candidate = outgoing.getCandidate(pick.getCandidateId());
            if (candidate == null) {
                logger.warn("Candidate {} picked by {} no longer exists; not carried", pick.getCandidateId(), playerId);
                result.getRemovedCandidateIds().add(pick.getCandidateId());
                continue;
            }
            if (candidate.diedIn(run.fromYear)) {
                run.detail("Player {}: dropping {} (died {})", playerId, candidate.getName(), candidate.getDeathDate());
                result.getRemovedCandidateIds().add(candidate.getId());
                continue;
            }

            Pick carried = Pick.builder()
                    .playerId(playerId)
                    .year(run.toYear)
                    .candidateId(candidate.getId())
                    .timestamp(seasonStart)
                    .build();
            if (run.dryRun) {
                String holder = pickRepository.findClaim(run.toYear, candidate.getId())
                        .map(Pick::getPlayerId)
                        .orElse(playerId);
                if (!playerId.equals(holder)) {
                    run.fail(playerId, TransitionStage.CARRY_FORWARD_PICKS, claimHeld(candidate, holder, run.toYear));
                    continue;
                }
            } else {
                if (!pickRepository.claim(carried)) {
                    String holder = pickRepository.findClaim(run.toYear, candidate.getId())
                            .map(Pick::getPlayerId)
                            .orElse(null);
                    if (!playerId.equals(holder)) {
                        run.fail(playerId, TransitionStage.CARRY_FORWARD_PICKS,
                                claimHeld(candidate, holder, run.toYear));
                        continue;
                    }
                }
                if (pickRepository.createPlayerPick(carried)) {
                    result.setPicksCreated(result.getPicksCreated() + 1);
                }
            }
            result.getCarriedCandidateIds().add(candidate.getId());
            run.detail("Player {}: carrying {}", playerId, candidate.getName());
        }

        run.detail("Player {}: {} carried, {} removed", playerId,
                result.getCarriedCandidateIds().size(), result.getRemovedCandidateIds().size());
        return result;
    }

    private static String claimHeld(Candidate candidate, String holder, int year) {
        return String.format("%s is already held by %s in %d", candidate.getName(), holder, year);
    }

    private DraftCapacityRecord recordCapacity(Run run, PlayerTransitionResult carried, String playerId) {
        int active;
        if (run.dryRun) {
            List<Pick> planned = plannedPicks(run, playerId, carried);
            run.plannedPicks.put(playerId, planned);
            active = planned.size();
        } else {
            active = pickRepository.findByPlayerAndYear(playerId, run.toYear).size();
        }
        DraftCapacityRecord record = DraftCapacityRecord.of(playerId, run.toYear,
                properties.getDraft().getMaxPicks(), active, clock.instant());
        if (!run.dryRun) {
            capacityRepository.save(record);
        }
        run.detail("Player {}: {} active, {} slots available in {}", playerId, active,
                record.getAvailableSlots(), run.toYear);
        return record;
    }

    private void finalizeRecord(TransitionReport report, int playersProcessed) {
        Set<String> failedPlayers = new LinkedHashSet<>();
        for (TransitionFailure failure : report.getFailures()) {
            failedPlayers.add(failure.getPlayerId());
        }
        for (ValidationIssue issue : report.getValidationIssues()) {
            if (issue.getPlayerId() != null) {
                failedPlayers.add(issue.getPlayerId());
            }
        }
        transitionRepository.save(SeasonTransitionRecord.builder()
                .fromYear(report.getFromYear())
                .toYear(report.getToYear())
                .status(report.getStatus())
                .attempts(report.getAttempt())
                .playersProcessed(playersProcessed)
                .picksCarried(report.getPicksCarried())
                .picksRemoved(report.getPicksRemoved())
                .validationIssues(report.getValidationIssues().size())
                .failedPlayers(new ArrayList<>(failedPlayers))
                .startedAt(report.getStartedAt())
                .completedAt(report.getCompletedAt())
                .build());

        eventPublisher.publishSeasonTransition(new SeasonTransitionEvent(report.getFromYear(), report.getToYear(),
                report.getStatus().name(), playersProcessed, report.getPicksCarried(), report.getPicksRemoved(),
                report.getValidationIssues().size(), report.getCompletedAt()));
    }

    private <T> Map<String, T> forEachPlayer(ExecutorService pool, List<String> playerIds, TransitionStage stage,
                                             Run run, Function<String, T> task) {
        Map<String, Future<T>> futures = new LinkedHashMap<>();
        for (String playerId : playerIds) {
            futures.put(playerId, pool.submit(() -> task.apply(playerId)));
        }

        Map<String, T> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                logger.error("{} failed for player {}", stage, entry.getKey(), cause);
                run.fail(entry.getKey(), stage, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientStoreException("Interrupted during " + stage, e);
            }
        }
        return results;
    }

    /**
     * Picks the player would hold in the target year: those already in the store plus
     * the ones this run would carry.
     */
    private List<Pick> plannedPicks(Run run, String playerId, PlayerTransitionResult carried) {
        Map<String, Pick> picks = new LinkedHashMap<>();
        for (Pick existing : pickRepository.findByPlayerAndYear(playerId, run.toYear)) {
            picks.put(existing.getCandidateId(), existing);
        }
        if (carried != null) {
            for (String candidateId : carried.getCarriedCandidateIds()) {
                picks.putIfAbsent(candidateId,
                        Pick.builder().playerId(playerId).year(run.toYear).candidateId(candidateId).build());
            }
        }
        return new ArrayList<>(picks.values());
    }

    private static int countActiveOutgoing(SeasonSnapshot outgoing, String playerId) {
        int active = 0;
        for (Pick pick : outgoing.getPicks(playerId)) {
            Candidate candidate = outgoing.getCandidate(pick.getCandidateId());
            if (candidate != null && !candidate.diedIn(outgoing.getYear())) {
                active++;
            }
        }
        return active;
    }

    private static ThreadFactory threadFactory(int fromYear, int toYear) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "season-transition-" + fromYear + "-" + toYear + "-"
                    + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * State of one invocation.
     */
    private final class Run {
        private final int fromYear;
        private final int toYear;
        private final boolean dryRun;
        private final boolean verbose;
        private final List<TransitionFailure> failures = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, List<Pick>> plannedPicks = new ConcurrentHashMap<>();
        private final TransitionReport report;

        private Run(int fromYear, int toYear, boolean dryRun, boolean verbose) {
            this.fromYear = fromYear;
            this.toYear = toYear;
            this.dryRun = dryRun;
            this.verbose = verbose;
            this.report = TransitionReport.builder()
                    .fromYear(fromYear)
                    .toYear(toYear)
                    .dryRun(dryRun)
                    .startedAt(clock.instant())
                    .build();
        }

        private void stage(TransitionStage stage, long startMillis, int items, boolean writesSkipped) {
            long duration = System.currentTimeMillis() - startMillis;
            report.getStages().add(new StageResult(stage, duration, items, writesSkipped));
            metricsService.recordTransitionStage(stage.name(), duration);
            detail("Stage {} done in {}ms ({} items)", stage, duration, items);
        }

        private void fail(String playerId, TransitionStage stage, String message) {
            logger.warn("{} failed for player {}: {}", stage, playerId, message);
            failures.add(new TransitionFailure(playerId, stage, message));
        }

        private void detail(String format, Object... args) {
            if (verbose) {
                logger.info(format, args);
            } else {
                logger.debug(format, args);
            }
        }
    }
}
