package com.cred.freestyle.deadpool.infrastructure.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data repository for {@link StoreItemEntity}.
 * The modifying queries are the conditional-write primitives of {@link JpaEntityStore};
 * each returns the number of rows affected (0 or 1).
 *
 * @author Deadpool Team
 */
@Repository
public interface StoreItemJpaRepository extends JpaRepository<StoreItemEntity, StoreItemEntity.StoreItemId> {

    /**
     * Items of a partition whose sort key starts with the prefix.
     */
    List<StoreItemEntity> findByPartitionKeyAndSortKeyStartingWithOrderBySortKeyAsc(
            String partitionKey, String sortKeyPrefix);

    /**
     * Insert a new row unless the key already exists.
     *
     * @return 1 if inserted, 0 if the key was taken
     */
    @Modifying
    @Query(value = "INSERT INTO entity_items (partition_key, sort_key, payload, version, updated_at) " +
                   "VALUES (:partitionKey, :sortKey, :payload, 1, :now) " +
                   "ON CONFLICT (partition_key, sort_key) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("partitionKey") String partitionKey,
                       @Param("sortKey") String sortKey,
                       @Param("payload") String payload,
                       @Param("now") Instant now);

    /**
     * Insert or overwrite a row, bumping its version.
     */
    @Modifying
    @Query(value = "INSERT INTO entity_items (partition_key, sort_key, payload, version, updated_at) " +
                   "VALUES (:partitionKey, :sortKey, :payload, 1, :now) " +
                   "ON CONFLICT (partition_key, sort_key) DO UPDATE SET " +
                   "payload = EXCLUDED.payload, version = entity_items.version + 1, updated_at = EXCLUDED.updated_at",
           nativeQuery = true)
    int upsert(@Param("partitionKey") String partitionKey,
               @Param("sortKey") String sortKey,
               @Param("payload") String payload,
               @Param("now") Instant now);

    /**
     * Overwrite a row only if it is still at the expected version.
     *
     * @return 1 if updated, 0 if the row changed or disappeared
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE StoreItemEntity e SET " +
           "e.payload = :payload, " +
           "e.version = e.version + 1, " +
           "e.updatedAt = :now " +
           "WHERE e.partitionKey = :partitionKey AND e.sortKey = :sortKey AND e.version = :expectedVersion")
    int updateIfVersion(@Param("partitionKey") String partitionKey,
                        @Param("sortKey") String sortKey,
                        @Param("payload") String payload,
                        @Param("expectedVersion") Long expectedVersion,
                        @Param("now") Instant now);

    /**
     * Delete a row only if it is still at the expected version.
     *
     * @return 1 if deleted, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM StoreItemEntity e " +
           "WHERE e.partitionKey = :partitionKey AND e.sortKey = :sortKey AND e.version = :expectedVersion")
    int deleteIfVersion(@Param("partitionKey") String partitionKey,
                        @Param("sortKey") String sortKey,
                        @Param("expectedVersion") Long expectedVersion);
}
