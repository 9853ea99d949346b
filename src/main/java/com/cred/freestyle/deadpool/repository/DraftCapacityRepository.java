package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for {@link DraftCapacityRecord}s ({@code PLAYER#{id} / DRAFT_SLOTS#{year}}).
 *
 * @author Deadpool Team
 */
@Repository
public class DraftCapacityRepository {

    private final StoreOperations store;

    public DraftCapacityRepository(StoreOperations store) {
        this.store = store;
    }

    public Optional<DraftCapacityRecord> find(String playerId, int year) {
        return store.get(KeySchema.draftCapacity(playerId, year)).map(DraftCapacityRepository::toRecord);
    }

    /**
     * Records for a year keyed by player id; players without one are omitted.
     */
    public Map<String, DraftCapacityRecord> findAll(Collection<String> playerIds, int year) {
        List<StoreKey> keys = new ArrayList<>(playerIds.size());
        for (String playerId : playerIds) {
            keys.add(KeySchema.draftCapacity(playerId, year));
        }
        Map<String, DraftCapacityRecord> records = new HashMap<>();
        for (StoreItem item : store.batchGet(keys)) {
            DraftCapacityRecord record = toRecord(item);
            records.put(record.getPlayerId(), record);
        }
        return records;
    }

    public DraftCapacityRecord save(DraftCapacityRecord record) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("playerId", record.getPlayerId());
        attributes.put("year", record.getYear());
        attributes.put("maxPicks", record.getMaxPicks());
        attributes.put("currentPicks", record.getActivePickCount());
        attributes.put("availableSlots", record.getAvailableSlots());
        attributes.put("lastUpdated", record.getLastUpdated().toString());
        store.put(KeySchema.draftCapacity(record.getPlayerId(), record.getYear()), attributes);
        return record;
    }

    private static DraftCapacityRecord toRecord(StoreItem item) {
        return DraftCapacityRecord.builder()
                .playerId(item.getString("playerId"))
                .year(item.getInteger("year"))
                .maxPicks(item.getInteger("maxPicks"))
                .activePickCount(item.getInteger("currentPicks"))
                .availableSlots(item.getInteger("availableSlots"))
                .lastUpdated(Instant.parse(item.getString("lastUpdated")))
                .build();
    }
}
