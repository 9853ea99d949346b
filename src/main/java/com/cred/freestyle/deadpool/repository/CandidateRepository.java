package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.exception.ConditionalWriteConflictException;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.cred.freestyle.deadpool.repository.PlayerRepository.putIfNotNull;

/**
 * Repository for {@link Candidate} records and the normalized-name index.
 *
 * Each candidate owns exactly one name claim {@code CANDIDATE_INDEX#{c} / NAME#{normalized}}.
 * Creating a candidate claims its name first, so concurrent drafters proposing the same
 * normalized name converge on a single record.
 *
 * @author Deadpool Team
 */
@Repository
public class CandidateRepository {

    private static final Logger logger = LoggerFactory.getLogger(CandidateRepository.class);

    private final StoreOperations store;

    public CandidateRepository(StoreOperations store) {
        this.store = store;
    }

    public Optional<Candidate> findById(String candidateId) {
        return store.get(KeySchema.candidate(candidateId)).map(CandidateRepository::toCandidate);
    }

    /**
     * Candidates by id; unknown ids are omitted.
     */
    public Map<String, Candidate> findAllById(Collection<String> candidateIds) {
        List<StoreKey> keys = new ArrayList<>(candidateIds.size());
        for (String candidateId : candidateIds) {
            keys.add(KeySchema.candidate(candidateId));
        }
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (StoreItem item : store.batchGet(keys)) {
            Candidate candidate = toCandidate(item);
            candidates.put(candidate.getId(), candidate);
        }
        return candidates;
    }

    public Optional<Candidate> findByNormalizedName(String normalizedName) {
        return store.get(KeySchema.candidateName(normalizedName))
                .map(claim -> claim.getString("candidateId"))
                .flatMap(this::findById);
    }

    /**
     * Name index entries of one first-character bucket, in name order.
     *
     * @param bucket First character of the normalized name
     * @param limit Maximum number of entries returned
     */
    public List<NameIndexEntry> findIndexEntries(char bucket, int limit) {
        List<StoreItem> items = store.queryByPrefix(KeySchema.candidateIndexPartition(bucket),
                KeySchema.candidateNamePrefix());
        List<NameIndexEntry> entries = new ArrayList<>(Math.min(items.size(), limit));
        for (StoreItem item : items) {
            if (entries.size() >= limit) {
                logger.debug("Name bucket '{}' truncated at {} entries", bucket, limit);
                break;
            }
            entries.add(new NameIndexEntry(item.getString("normalizedName"), item.getString("candidateId")));
        }
        return entries;
    }

    /**
     * Create the candidate unless one with the same normalized name exists.
     *
     * The name claim is the single conditional write that decides the race. A caller that
     * loses it adopts the winner's record, writing the details itself if the winner has not
     * yet done so.
     *
     * @param normalizedName Normalized name, the dedup key
     * @param prepared Candidate to create if the name is free (its id is used only if it wins)
     * @return The resolved candidate and whether this call created it
     */
    public CandidateCreation createCandidateIfAbsent(String normalizedName, Candidate prepared) {
        StoreKey claimKey = KeySchema.candidateName(normalizedName);
        Map<String, Object> claim = new LinkedHashMap<>();
        claim.put("candidateId", prepared.getId());
        claim.put("normalizedName", normalizedName);

        if (store.putIfAbsent(claimKey, claim)) {
            store.putIfAbsent(KeySchema.candidate(prepared.getId()), toAttributes(prepared));
            Candidate stored = findById(prepared.getId()).orElse(prepared);
            logger.info("Created candidate {} ({})", stored.getId(), stored.getName());
            return new CandidateCreation(stored, stored.getId().equals(prepared.getId()));
        }

        String winnerId = store.get(claimKey)
                .map(item -> item.getString("candidateId"))
                .orElseThrow(() -> new ConditionalWriteConflictException(claimKey.toString(),
                        "Name claim for '" + normalizedName + "' vanished after a failed create"));

        Optional<Candidate> existing = findById(winnerId);
        if (existing.isPresent()) {
            return new CandidateCreation(existing.get(), false);
        }

        // winner claimed the name but has not written details yet
        Candidate repaired = Candidate.builder()
                .id(winnerId)
                .name(prepared.getName())
                .normalizedName(normalizedName)
                .age(prepared.getAge())
                .birthDate(prepared.getBirthDate())
                .createdAt(prepared.getCreatedAt())
                .build();
        store.putIfAbsent(KeySchema.candidate(winnerId), toAttributes(repaired));
        logger.debug("Wrote missing details for candidate {} claimed by a concurrent drafter", winnerId);
        return new CandidateCreation(findById(winnerId).orElse(repaired), false);
    }

    /**
     * Overwrite candidate details. The name index is not touched.
     */
    public Candidate save(Candidate candidate) {
        store.put(KeySchema.candidate(candidate.getId()), toAttributes(candidate));
        return candidate;
    }

    private static Map<String, Object> toAttributes(Candidate candidate) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("candidateId", candidate.getId());
        attributes.put("name", candidate.getName());
        attributes.put("normalizedName", candidate.getNormalizedName());
        putIfNotNull(attributes, "age", candidate.getAge());
        putIfNotNull(attributes, "birthDate", candidate.getBirthDate() == null ? null : candidate.getBirthDate().toString());
        putIfNotNull(attributes, "deathDate", candidate.getDeathDate() == null ? null : candidate.getDeathDate().toString());
        putIfNotNull(attributes, "createdAt", candidate.getCreatedAt() == null ? null : candidate.getCreatedAt().toString());
        return attributes;
    }

    private static Candidate toCandidate(StoreItem item) {
        String birthDate = item.getString("birthDate");
        String deathDate = item.getString("deathDate");
        String createdAt = item.getString("createdAt");
        return Candidate.builder()
                .id(item.getString("candidateId"))
                .name(item.getString("name"))
                .normalizedName(item.getString("normalizedName"))
                .age(item.getInteger("age"))
                .birthDate(birthDate == null ? null : LocalDate.parse(birthDate))
                .deathDate(deathDate == null ? null : LocalDate.parse(deathDate))
                .createdAt(createdAt == null ? null : Instant.parse(createdAt))
                .build();
    }

    /**
     * A normalized name and the candidate that owns it.
     */
    @Getter
    @AllArgsConstructor
    public static class NameIndexEntry {
        private final String normalizedName;
        private final String candidateId;
    }

    /**
     * Result of {@link #createCandidateIfAbsent}.
     */
    @Getter
    @AllArgsConstructor
    public static class CandidateCreation {
        private final Candidate candidate;
        private final boolean created;
    }
}
