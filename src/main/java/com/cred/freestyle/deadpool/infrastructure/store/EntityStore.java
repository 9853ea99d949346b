package com.cred.freestyle.deadpool.infrastructure.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered key-value store addressed by a composite (partition, sort) key.
 *
 * All draft invariants rest on the conditional operations below: an implementation must
 * guarantee that {@link #putIfAbsent} and {@link #putConditional} succeed for at most one
 * of any set of concurrent callers that observed the same prior state.
 *
 * Implementations throw {@link com.cred.freestyle.deadpool.exception.TransientStoreException}
 * for retryable I/O failures.
 *
 * @author Deadpool Team
 */
public interface EntityStore {

    /**
     * Point read.
     *
     * @param key Item key
     * @return The item, if present
     */
    Optional<StoreItem> get(StoreKey key);

    /**
     * Create the item only if nothing exists at the key.
     *
     * @param key Item key
     * @param attributes Item attributes
     * @return true if this call created the item
     */
    boolean putIfAbsent(StoreKey key, Map<String, Object> attributes);

    /**
     * Write the item only if the predicate holds on the current state of the key.
     * The write is applied as a compare-and-swap on the observed version, so a
     * concurrent change between evaluating the predicate and writing fails the put.
     *
     * @param key Item key
     * @param attributes New item attributes
     * @param condition Predicate over the current item (empty if absent)
     * @return true if the write was applied
     */
    boolean putConditional(StoreKey key, Map<String, Object> attributes, Predicate<Optional<StoreItem>> condition);

    /**
     * Unconditional overwrite.
     *
     * @param key Item key
     * @param attributes Item attributes
     */
    void put(StoreKey key, Map<String, Object> attributes);

    /**
     * Delete the item only if the predicate holds on its current state.
     *
     * @param key Item key
     * @param condition Predicate over the current item (empty if absent)
     * @return true if an item was deleted
     */
    boolean deleteConditional(StoreKey key, Predicate<Optional<StoreItem>> condition);

    /**
     * Items of one partition whose sort key starts with the prefix, ascending by sort key.
     *
     * @param partitionKey Partition key
     * @param sortKeyPrefix Sort key prefix (empty string for the whole partition)
     * @return Matching items
     */
    List<StoreItem> queryByPrefix(String partitionKey, String sortKeyPrefix);

    /**
     * Read several items at once. Missing keys are omitted from the result.
     *
     * @param keys Item keys
     * @return Items found
     */
    List<StoreItem> batchGet(Collection<StoreKey> keys);
}
