package com.cred.freestyle.deadpool.infrastructure.store;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Row of the {@code entity_items} table backing {@link JpaEntityStore}.
 * One row per store item; attributes are held as a JSON document in {@code payload}.
 *
 * @author Deadpool Team
 */
@Entity
@Table(name = "entity_items")
@IdClass(StoreItemEntity.StoreItemId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreItemEntity {

    @Id
    @Column(name = "partition_key", nullable = false, length = 200)
    private String partitionKey;

    @Id
    @Column(name = "sort_key", nullable = false, length = 400)
    private String sortKey;

    /**
     * JSON-serialized attribute map.
     */
    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    /**
     * Incremented on every write; conditional updates compare against it.
     */
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Composite primary key.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoreItemId implements Serializable {
        private String partitionKey;
        private String sortKey;
    }
}
