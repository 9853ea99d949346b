package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.deadpool.matching.NameMatchResult;
import com.cred.freestyle.deadpool.matching.NameMatcher;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.KeySchema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps a drafted name to a candidate, reusing an existing record when the name is
 * a duplicate of one already known.
 *
 * Resolution order:
 * 1. exact normalized-name lookup
 * 2. best fuzzy match within the name's first-character bucket (bounded scan)
 * 3. create-if-absent on the normalized name, done by the caller only once the pick is
 *    known to be allowed
 *
 * @author Deadpool Team
 */
@Service
public class CandidateResolver {

    private static final Logger logger = LoggerFactory.getLogger(CandidateResolver.class);

    private final CandidateRepository candidateRepository;
    private final NameMatcher nameMatcher;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;
    private final int matchScanLimit;

    public CandidateResolver(CandidateRepository candidateRepository,
                             NameMatcher nameMatcher,
                             CloudWatchMetricsService metricsService,
                             DeadpoolProperties properties,
                             Clock clock) {
        this.candidateRepository = candidateRepository;
        this.nameMatcher = nameMatcher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.matchScanLimit = properties.getDraft().getMatchScanLimit();
    }

    /**
     * Look up a candidate the name already refers to. Nothing is written.
     *
     * @param candidateName Name as typed by the drafter
     * @return The exact or best fuzzy match, if any
     * @throws IllegalArgumentException if the name normalizes to nothing
     */
    public Optional<Candidate> findExisting(String candidateName) {
        String normalized = normalize(candidateName);

        Optional<Candidate> exact = candidateRepository.findByNormalizedName(normalized);
        if (exact.isPresent()) {
            metricsService.recordCandidateResolution("exact");
            return exact;
        }

        Optional<Candidate> fuzzy = findFuzzyMatch(normalized);
        if (fuzzy.isPresent()) {
            metricsService.recordCandidateResolution("fuzzy");
        }
        return fuzzy;
    }

    /**
     * Create the candidate unless a concurrent caller created the same normalized name first,
     * in which case that record is returned with {@code created=false}.
     *
     * @param candidateName Name as typed by the drafter
     * @return The candidate and whether it was created by this call
     */
    public CandidateResolution create(String candidateName) {
        String normalized = normalize(candidateName);
        Candidate prepared = Candidate.builder()
                .id(UUID.randomUUID().toString())
                .name(candidateName.trim())
                .normalizedName(normalized)
                .createdAt(clock.instant())
                .build();
        CandidateRepository.CandidateCreation creation = candidateRepository.createCandidateIfAbsent(normalized, prepared);
        metricsService.recordCandidateResolution(creation.isCreated() ? "created" : "exact");
        return new CandidateResolution(creation.getCandidate(), creation.isCreated());
    }

    private String normalize(String candidateName) {
        String normalized = nameMatcher.normalize(candidateName);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Candidate name must contain letters or digits");
        }
        return normalized;
    }

    private Optional<Candidate> findFuzzyMatch(String normalized) {
        String bestId = null;
        NameMatchResult best = null;
        for (CandidateRepository.NameIndexEntry entry :
                candidateRepository.findIndexEntries(KeySchema.bucketOf(normalized), matchScanLimit)) {
            NameMatchResult result = nameMatcher.match(normalized, entry.getNormalizedName());
            if (result.isMatch() && (best == null || result.getScore() > best.getScore())) {
                best = result;
                bestId = entry.getCandidateId();
            }
        }
        if (bestId == null) {
            return Optional.empty();
        }
        logger.info("Name '{}' matched existing candidate '{}' with score {}",
                normalized, best.getNormalizedB(), String.format("%.3f", best.getScore()));
        return candidateRepository.findById(bestId);
    }

    /**
     * A resolved candidate.
     */
    @Getter
    @AllArgsConstructor
    public static class CandidateResolution {
        private final Candidate candidate;
        private final boolean created;
    }
}
