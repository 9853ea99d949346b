package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.DraftResult;
import com.cred.freestyle.deadpool.domain.model.NextDrafter;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.domain.model.PickCount;
import com.cred.freestyle.deadpool.domain.model.PickDetail;
import com.cred.freestyle.deadpool.domain.model.Player;
import com.cred.freestyle.deadpool.exception.AlreadyDraftedException;
import com.cred.freestyle.deadpool.exception.CapacityExceededException;
import com.cred.freestyle.deadpool.exception.DraftConflictException;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.exception.TransientStoreException;
import com.cred.freestyle.deadpool.infrastructure.messaging.DraftEventPublisher;
import com.cred.freestyle.deadpool.infrastructure.messaging.events.DraftEvent;
import com.cred.freestyle.deadpool.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.DraftCapacityRepository;
import com.cred.freestyle.deadpool.repository.KeySchema;
import com.cred.freestyle.deadpool.repository.PickRepository;
import com.cred.freestyle.deadpool.repository.PlayerRepository;
import com.cred.freestyle.deadpool.repository.StoreLeaseLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Draft engine: who drafts next, and committing picks.
 *
 * Commit flow:
 * 1. Resolve the player (NotFound) and look up an existing candidate (dedup by normalized name)
 * 2. Take the player's draft lease so capacity checks and writes for one player are serialized
 * 3. Reject if the candidate is already claimed this year, or the player is at capacity
 * 4. Renew the lease (a lost lease is transient), record a new candidate if needed, then claim
 *    (year, candidate) with a create-if-absent write; losing the claim means AlreadyDrafted
 * 5. Write the player's pick row and capacity record; on failure release the claim again
 *
 * The claim in step 4 is the only global ordering point: of any number of concurrent commits
 * for the same candidate and year, exactly one claim succeeds.
 *
 * @author Deadpool Team
 */
@Service
public class DraftService {

    private static final Logger logger = LoggerFactory.getLogger(DraftService.class);

    private final PlayerRepository playerRepository;
    private final CandidateRepository candidateRepository;
    private final PickRepository pickRepository;
    private final DraftCapacityRepository capacityRepository;
    private final SeasonSnapshotLoader snapshotLoader;
    private final CandidateResolver candidateResolver;
    private final StoreLeaseLock leaseLock;
    private final DraftEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;
    private final DeadpoolProperties.Draft config;
    private final Clock clock;

    public DraftService(PlayerRepository playerRepository,
                        CandidateRepository candidateRepository,
                        PickRepository pickRepository,
                        DraftCapacityRepository capacityRepository,
                        SeasonSnapshotLoader snapshotLoader,
                        CandidateResolver candidateResolver,
                        StoreLeaseLock leaseLock,
                        DraftEventPublisher eventPublisher,
                        CloudWatchMetricsService metricsService,
                        DeadpoolProperties properties,
                        Clock clock) {
        this.playerRepository = playerRepository;
        this.candidateRepository = candidateRepository;
        this.pickRepository = pickRepository;
        this.capacityRepository = capacityRepository;
        this.snapshotLoader = snapshotLoader;
        this.candidateResolver = candidateResolver;
        this.leaseLock = leaseLock;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.config = properties.getDraft();
        this.clock = clock;
    }

    /**
     * The eligible player with the fewest picks this year, ties broken by draft position.
     * A player is eligible while their active picks are below their max.
     *
     * @param year Draft year
     * @return Next drafter, or empty when every player is full (or the year has no order)
     */
    public Optional<NextDrafter> getNextDrafter(int year) {
        SeasonSnapshot season = snapshotLoader.load(year);

        Optional<NextDrafter> next = season.getOrder().stream()
                .map(entry -> toNextDrafter(season, entry))
                .filter(candidate -> candidate.getActivePicks() < candidate.getMaxPicks())
                .min(Comparator.comparingInt(NextDrafter::getTotalPicks)
                        .thenComparingInt(NextDrafter::getDraftPosition));

        if (next.isEmpty()) {
            logger.info("No eligible drafter for {}; draft phase complete", year);
        }
        return next;
    }

    /**
     * Commit a pick.
     *
     * @param playerId Drafting player
     * @param candidateName Candidate name as typed
     * @param year Draft year
     * @return The committed pick
     * @throws ResourceNotFoundException if the player is unknown
     * @throws AlreadyDraftedException if any player already holds the candidate this year
     * @throws CapacityExceededException if the player has no free slot
     * @throws TransientStoreException if the store or the player's draft lease is unavailable
     */
    public DraftResult commitDraft(String playerId, String candidateName, int year) {
        long startTime = System.currentTimeMillis();
        try {
            DraftResult result = doCommit(playerId, candidateName, year);
            metricsService.recordDraftSuccess(year);
            eventPublisher.publishPickCommitted(new DraftEvent(result.getPlayerId(), year,
                    result.getCandidateId(), result.getCandidateName(), result.isNewCandidate(), result.getTimestamp()));
            return result;
        } catch (DraftConflictException e) {
            logger.warn("Draft rejected for player {} in {}: {}", playerId, year, e.getMessage());
            metricsService.recordDraftFailure(year, e.getReason());
            throw e;
        } catch (TransientStoreException e) {
            metricsService.recordDraftFailure(year, "TRANSIENT");
            throw e;
        } finally {
            metricsService.recordDraftLatency(System.currentTimeMillis() - startTime);
        }
    }

    private DraftResult doCommit(String playerId, String candidateName, int year) {
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));

        Optional<Candidate> existing = candidateResolver.findExisting(candidateName);

        StoreKey lockKey = KeySchema.draftLock(playerId, year);
        String lockToken = leaseLock.acquireLockWithRetry(lockKey, config.getLockLease(),
                config.getLockWait(), config.getLockRetryBackoff());
        if (lockToken == null) {
            throw new TransientStoreException("Another draft for player " + playerId + " is in progress");
        }

        try {
            if (existing.isPresent()) {
                Optional<Pick> holder = pickRepository.findClaim(year, existing.get().getId());
                if (holder.isPresent()) {
                    throw new AlreadyDraftedException(existing.get().getId(), existing.get().getName(), year,
                            holder.get().getPlayerId());
                }
            }

            int maxPicks = capacityRepository.find(playerId, year)
                    .map(DraftCapacityRecord::getMaxPicks)
                    .orElse(config.getMaxPicks());
            int activePicks = countActivePicks(pickRepository.findByPlayerAndYear(playerId, year));
            if (activePicks >= maxPicks) {
                throw new CapacityExceededException(playerId, year, activePicks, maxPicks);
            }

            // store retries above may have outlasted the lease
            if (!leaseLock.renewLock(lockKey, lockToken, config.getLockLease())) {
                throw new TransientStoreException("Draft lease for player " + playerId + " expired before the pick");
            }

            // a new name is only recorded once the pick is allowed
            CandidateResolver.CandidateResolution resolution = existing
                    .map(candidate -> new CandidateResolver.CandidateResolution(candidate, false))
                    .orElseGet(() -> candidateResolver.create(candidateName));
            Candidate candidate = resolution.getCandidate();

            Instant now = clock.instant();
            Pick pick = Pick.builder()
                    .playerId(playerId)
                    .year(year)
                    .candidateId(candidate.getId())
                    .timestamp(now)
                    .build();

            if (!pickRepository.claim(pick)) {
                String holderId = pickRepository.findClaim(year, candidate.getId())
                        .map(Pick::getPlayerId)
                        .orElse(null);
                throw new AlreadyDraftedException(candidate.getId(), candidate.getName(), year, holderId);
            }

            DraftCapacityRecord capacity = DraftCapacityRecord.of(playerId, year, maxPicks, activePicks + 1, now);
            try {
                pickRepository.createPlayerPick(pick);
                capacityRepository.save(capacity);
            } catch (RuntimeException e) {
                compensate(pick, e);
                throw e;
            }

            logger.info("Player {} ({}) drafted {} for {} [{} of {} active]",
                    playerId, player.getDisplayName(), candidate.getName(), year, activePicks + 1, maxPicks);

            return DraftResult.builder()
                    .playerId(playerId)
                    .year(year)
                    .candidateId(candidate.getId())
                    .candidateName(candidate.getName())
                    .newCandidate(resolution.isCreated())
                    .timestamp(now)
                    .activePicks(capacity.getActivePickCount())
                    .availableSlots(capacity.getAvailableSlots())
                    .build();
        } finally {
            leaseLock.releaseLock(lockKey, lockToken);
        }
    }

    /**
     * Pick totals for every player in the year's draft order, by draft position.
     */
    public List<PickCount> getPickCounts(int year) {
        SeasonSnapshot season = snapshotLoader.load(year);
        List<PickCount> counts = new ArrayList<>();
        for (DraftOrderEntry entry : season.getOrder()) {
            String playerId = entry.getPlayerId();
            int max = season.getMaxPicks(playerId, config.getMaxPicks());
            int active = season.getActivePickCount(playerId);
            counts.add(PickCount.builder()
                    .playerId(playerId)
                    .playerName(season.getPlayerName(playerId))
                    .draftPosition(entry.getPosition())
                    .totalPicks(season.getPicks(playerId).size())
                    .activePicks(active)
                    .maxPicks(max)
                    .availableSlots(Math.max(0, max - active))
                    .build());
        }
        return counts;
    }

    /**
     * A player's picks for the year, newest first.
     *
     * @throws ResourceNotFoundException if the player is unknown
     */
    public List<PickDetail> getPlayerPicks(String playerId, int year) {
        if (!playerRepository.existsById(playerId)) {
            throw new ResourceNotFoundException("Player", playerId);
        }
        List<Pick> picks = pickRepository.findByPlayerAndYear(playerId, year);
        Map<String, Candidate> candidates = candidateRepository.findAllById(
                picks.stream().map(Pick::getCandidateId).collect(Collectors.toList()));

        List<PickDetail> details = new ArrayList<>(picks.size());
        for (Pick pick : picks) {
            Candidate candidate = candidates.get(pick.getCandidateId());
            details.add(PickDetail.builder()
                    .candidateId(pick.getCandidateId())
                    .candidateName(candidate == null ? null : candidate.getName())
                    .age(candidate == null ? null : candidate.getAge())
                    .deathDate(candidate == null ? null : candidate.getDeathDate())
                    .deceased(candidate != null && candidate.isDeceased())
                    .timestamp(pick.getTimestamp())
                    .build());
        }
        details.sort(Comparator.comparing(PickDetail::getTimestamp).reversed());
        return details;
    }

    private int countActivePicks(List<Pick> picks) {
        Map<String, Candidate> candidates = candidateRepository.findAllById(
                picks.stream().map(Pick::getCandidateId).collect(Collectors.toList()));
        int active = 0;
        for (Pick pick : picks) {
            Candidate candidate = candidates.get(pick.getCandidateId());
            if (candidate == null || !candidate.isDeceased()) {
                active++;
            }
        }
        return active;
    }

    private void compensate(Pick pick, RuntimeException cause) {
        logger.error("Failed to complete pick of {} by {} for {}; releasing claim",
                pick.getCandidateId(), pick.getPlayerId(), pick.getYear(), cause);
        try {
            pickRepository.deletePlayerPick(pick);
            pickRepository.releaseClaim(pick.getYear(), pick.getCandidateId(), pick.getPlayerId());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            logger.error("Compensation failed for claim {}/{}; claim may need manual release",
                    pick.getYear(), pick.getCandidateId(), e);
        }
    }

    private NextDrafter toNextDrafter(SeasonSnapshot season, DraftOrderEntry entry) {
        String playerId = entry.getPlayerId();
        return NextDrafter.builder()
                .playerId(playerId)
                .playerName(season.getPlayerName(playerId))
                .draftPosition(entry.getPosition())
                .totalPicks(season.getPicks(playerId).size())
                .activePicks(season.getActivePickCount(playerId))
                .maxPicks(season.getMaxPicks(playerId, config.getMaxPicks()))
                .build();
    }
}
