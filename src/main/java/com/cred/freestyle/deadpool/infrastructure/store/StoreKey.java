package com.cred.freestyle.deadpool.infrastructure.store;

import java.util.Objects;

/**
 * Composite (partition, sort) key addressing a single item in the entity store.
 * Keys order by partition first, then sort key, which is the order prefix queries return.
 *
 * @author Deadpool Team
 */
public final class StoreKey implements Comparable<StoreKey> {

    private final String partitionKey;
    private final String sortKey;

    public StoreKey(String partitionKey, String sortKey) {
        this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
        this.sortKey = Objects.requireNonNull(sortKey, "sortKey");
    }

    public static StoreKey of(String partitionKey, String sortKey) {
        return new StoreKey(partitionKey, sortKey);
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public String getSortKey() {
        return sortKey;
    }

    @Override
    public int compareTo(StoreKey other) {
        int byPartition = partitionKey.compareTo(other.partitionKey);
        return byPartition != 0 ? byPartition : sortKey.compareTo(other.sortKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreKey)) {
            return false;
        }
        StoreKey that = (StoreKey) o;
        return partitionKey.equals(that.partitionKey) && sortKey.equals(that.sortKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionKey, sortKey);
    }

    @Override
    public String toString() {
        return partitionKey + "|" + sortKey;
    }
}
