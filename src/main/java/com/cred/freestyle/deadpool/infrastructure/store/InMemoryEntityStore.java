package com.cred.freestyle.deadpool.infrastructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

/**
 * Entity store backed by a {@link ConcurrentSkipListMap}.
 * Used by the local profile and by engine tests.
 *
 * Conditional writes map onto the atomic {@code putIfAbsent}, {@code replace(k, old, new)}
 * and {@code remove(k, old)} operations of the map; items are immutable, so replacing
 * against the observed instance is a compare-and-swap on its version.
 *
 * @author Deadpool Team
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final ConcurrentSkipListMap<StoreKey, StoreItem> items = new ConcurrentSkipListMap<>();

    @Override
    public Optional<StoreItem> get(StoreKey key) {
        return Optional.ofNullable(items.get(key));
    }

    @Override
    public boolean putIfAbsent(StoreKey key, Map<String, Object> attributes) {
        boolean created = items.putIfAbsent(key, new StoreItem(key, attributes, 1L)) == null;
        logger.trace("putIfAbsent {} -> {}", key, created);
        return created;
    }

    @Override
    public boolean putConditional(StoreKey key, Map<String, Object> attributes,
                                  Predicate<Optional<StoreItem>> condition) {
        StoreItem current = items.get(key);
        if (!condition.test(Optional.ofNullable(current))) {
            return false;
        }
        if (current == null) {
            return items.putIfAbsent(key, new StoreItem(key, attributes, 1L)) == null;
        }
        return items.replace(key, current, new StoreItem(key, attributes, current.getVersion() + 1));
    }

    @Override
    public void put(StoreKey key, Map<String, Object> attributes) {
        items.compute(key, (k, current) ->
                new StoreItem(k, attributes, current == null ? 1L : current.getVersion() + 1));
    }

    @Override
    public boolean deleteConditional(StoreKey key, Predicate<Optional<StoreItem>> condition) {
        StoreItem current = items.get(key);
        if (current == null || !condition.test(Optional.of(current))) {
            return false;
        }
        return items.remove(key, current);
    }

    @Override
    public List<StoreItem> queryByPrefix(String partitionKey, String sortKeyPrefix) {
        StoreKey from = StoreKey.of(partitionKey, sortKeyPrefix);
        StoreKey to = StoreKey.of(partitionKey, sortKeyPrefix + Character.MAX_VALUE);
        return new ArrayList<>(items.subMap(from, true, to, true).values());
    }

    @Override
    public List<StoreItem> batchGet(Collection<StoreKey> keys) {
        List<StoreItem> found = new ArrayList<>(keys.size());
        for (StoreKey key : keys) {
            StoreItem item = items.get(key);
            if (item != null) {
                found.add(item);
            }
        }
        return found;
    }

    /**
     * Number of items currently held.
     */
    public int size() {
        return items.size();
    }
}
