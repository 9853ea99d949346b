package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.exception.ConditionalWriteConflictException;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for {@link DraftOrderEntry} items of the {@code YEAR#{y}} partitions.
 *
 * @author Deadpool Team
 */
@Repository
public class DraftOrderRepository {

    private static final Logger logger = LoggerFactory.getLogger(DraftOrderRepository.class);

    private final StoreOperations store;

    public DraftOrderRepository(StoreOperations store) {
        this.store = store;
    }

    /**
     * Order of a year, ascending by position. Empty if the year has no order.
     */
    public List<DraftOrderEntry> findByYear(int year) {
        List<DraftOrderEntry> entries = new ArrayList<>();
        for (StoreItem item : store.queryByPrefix(KeySchema.yearPartition(year), KeySchema.draftOrderPrefix())) {
            entries.add(DraftOrderEntry.builder()
                    .year(year)
                    .position(item.getInteger("position"))
                    .playerId(item.getString("playerId"))
                    .build());
        }
        entries.sort(Comparator.comparingInt(DraftOrderEntry::getPosition));
        return entries;
    }

    /**
     * Write a year's order, making it exactly the given entries.
     *
     * Each entry is a conditional write that succeeds when the slot is empty or already holds
     * the same assignment, so rerunning with the same order is a no-op. Entries of the year
     * that are not part of the new order are then removed.
     *
     * @return Number of entries written or confirmed
     */
    public int replaceOrder(int year, List<DraftOrderEntry> entries) {
        Set<StoreKey> wanted = new HashSet<>();
        for (DraftOrderEntry entry : entries) {
            StoreKey key = KeySchema.draftOrderEntry(year, entry.getPosition(), entry.getPlayerId());
            wanted.add(key);
            Map<String, Object> attributes = toAttributes(year, entry);
            boolean written = store.putConditional(key, attributes,
                    current -> current.map(item -> sameAssignment(item, entry)).orElse(true));
            if (!written) {
                throw new ConditionalWriteConflictException(key.toString(),
                        "Draft order slot " + entry.getPosition() + " for " + year + " changed concurrently");
            }
        }

        int removed = 0;
        for (StoreItem stale : store.queryByPrefix(KeySchema.yearPartition(year), KeySchema.draftOrderPrefix())) {
            if (!wanted.contains(stale.getKey()) && store.deleteConditional(stale.getKey(), Optional::isPresent)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Removed {} stale draft order entries for {}", removed, year);
        }
        return entries.size();
    }

    /**
     * Create a year's order only where slots are empty.
     *
     * @return true if every entry was created by this call
     */
    public boolean createOrder(int year, List<DraftOrderEntry> entries) {
        boolean allCreated = true;
        for (DraftOrderEntry entry : entries) {
            allCreated &= store.putIfAbsent(KeySchema.draftOrderEntry(year, entry.getPosition(), entry.getPlayerId()),
                    toAttributes(year, entry));
        }
        return allCreated;
    }

    private static boolean sameAssignment(StoreItem item, DraftOrderEntry entry) {
        return entry.getPlayerId().equals(item.getString("playerId"))
                && Integer.valueOf(entry.getPosition()).equals(item.getInteger("position"));
    }

    private static Map<String, Object> toAttributes(int year, DraftOrderEntry entry) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("year", year);
        attributes.put("position", entry.getPosition());
        attributes.put("playerId", entry.getPlayerId());
        return attributes;
    }
}
