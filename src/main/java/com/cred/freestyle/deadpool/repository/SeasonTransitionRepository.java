package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.SeasonTransitionRecord;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.cred.freestyle.deadpool.repository.PlayerRepository.putIfNotNull;

/**
 * Repository for {@link SeasonTransitionRecord}s.
 *
 * @author Deadpool Team
 */
@Repository
public class SeasonTransitionRepository {

    private final StoreOperations store;

    public SeasonTransitionRepository(StoreOperations store) {
        this.store = store;
    }

    public Optional<SeasonTransitionRecord> find(int fromYear, int toYear) {
        return store.get(KeySchema.seasonTransition(fromYear, toYear)).map(SeasonTransitionRepository::toRecord);
    }

    public SeasonTransitionRecord save(SeasonTransitionRecord record) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("fromYear", record.getFromYear());
        attributes.put("toYear", record.getToYear());
        attributes.put("strategy", record.getStrategy());
        attributes.put("status", record.getStatus().name());
        attributes.put("attempts", record.getAttempts());
        attributes.put("playersProcessed", record.getPlayersProcessed());
        attributes.put("picksCarried", record.getPicksCarried());
        attributes.put("picksRemoved", record.getPicksRemoved());
        attributes.put("validationIssues", record.getValidationIssues());
        attributes.put("failedPlayers", String.join(",", record.getFailedPlayers()));
        putIfNotNull(attributes, "startedAt", record.getStartedAt() == null ? null : record.getStartedAt().toString());
        putIfNotNull(attributes, "completedAt", record.getCompletedAt() == null ? null : record.getCompletedAt().toString());
        store.put(KeySchema.seasonTransition(record.getFromYear(), record.getToYear()), attributes);
        return record;
    }

    private static SeasonTransitionRecord toRecord(StoreItem item) {
        String failed = item.getString("failedPlayers");
        List<String> failedPlayers = failed == null || failed.isEmpty()
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(failed.split(",")));
        String startedAt = item.getString("startedAt");
        String completedAt = item.getString("completedAt");
        return SeasonTransitionRecord.builder()
                .fromYear(item.getInteger("fromYear"))
                .toYear(item.getInteger("toYear"))
                .strategy(item.getString("strategy"))
                .status(SeasonTransitionRecord.TransitionStatus.valueOf(item.getString("status")))
                .attempts(item.getInteger("attempts"))
                .playersProcessed(item.getInteger("playersProcessed"))
                .picksCarried(item.getInteger("picksCarried"))
                .picksRemoved(item.getInteger("picksRemoved"))
                .validationIssues(item.getInteger("validationIssues"))
                .failedPlayers(failedPlayers)
                .startedAt(startedAt == null ? null : Instant.parse(startedAt))
                .completedAt(completedAt == null ? null : Instant.parse(completedAt))
                .build();
    }
}
