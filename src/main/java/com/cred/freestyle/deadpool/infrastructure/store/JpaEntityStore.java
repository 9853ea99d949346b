package com.cred.freestyle.deadpool.infrastructure.store;

import com.cred.freestyle.deadpool.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed entity store.
 *
 * Each item is a row of {@code entity_items}. Conditional writes are single-statement:
 * {@code INSERT ... ON CONFLICT DO NOTHING} for creation and a version-guarded
 * {@code UPDATE}/{@code DELETE} for compare-and-swap, so two concurrent callers that
 * observed the same version can never both succeed.
 *
 * Transactions are opened programmatically inside {@link #translate} so that a failure to
 * begin one (database down, pool exhausted) is reported as {@link TransientStoreException}
 * like any other transient fault.
 *
 * @author Deadpool Team
 */
@Component
@ConditionalOnProperty(name = "deadpool.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaEntityStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final StoreItemJpaRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public JpaEntityStore(StoreItemJpaRepository repository, ObjectMapper objectMapper, Clock clock,
                          PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public Optional<StoreItem> get(StoreKey key) {
        return translate(readTransaction, () -> repository.findById(idOf(key)).map(this::toItem));
    }

    @Override
    public boolean putIfAbsent(StoreKey key, Map<String, Object> attributes) {
        String payload = serialize(attributes);
        return translate(writeTransaction, () ->
                repository.insertIfAbsent(key.getPartitionKey(), key.getSortKey(), payload, Instant.now(clock)) == 1);
    }

    @Override
    public boolean putConditional(StoreKey key, Map<String, Object> attributes,
                                  Predicate<Optional<StoreItem>> condition) {
        String payload = serialize(attributes);
        return translate(writeTransaction, () -> {
            Optional<StoreItem> current = repository.findById(idOf(key)).map(this::toItem);
            if (!condition.test(current)) {
                return false;
            }
            Instant now = Instant.now(clock);
            if (current.isEmpty()) {
                return repository.insertIfAbsent(key.getPartitionKey(), key.getSortKey(), payload, now) == 1;
            }
            int updated = repository.updateIfVersion(key.getPartitionKey(), key.getSortKey(), payload,
                    current.get().getVersion(), now);
            if (updated == 0) {
                logger.debug("Conditional put lost race on {} at version {}", key, current.get().getVersion());
            }
            return updated == 1;
        });
    }

    @Override
    public void put(StoreKey key, Map<String, Object> attributes) {
        String payload = serialize(attributes);
        translate(writeTransaction, () ->
                repository.upsert(key.getPartitionKey(), key.getSortKey(), payload, Instant.now(clock)));
    }

    @Override
    public boolean deleteConditional(StoreKey key, Predicate<Optional<StoreItem>> condition) {
        return translate(writeTransaction, () -> {
            Optional<StoreItem> current = repository.findById(idOf(key)).map(this::toItem);
            if (current.isEmpty() || !condition.test(current)) {
                return false;
            }
            return repository.deleteIfVersion(key.getPartitionKey(), key.getSortKey(),
                    current.get().getVersion()) == 1;
        });
    }

    @Override
    public List<StoreItem> queryByPrefix(String partitionKey, String sortKeyPrefix) {
        return translate(readTransaction, () -> {
            List<StoreItem> items = new ArrayList<>();
            for (StoreItemEntity entity :
                    repository.findByPartitionKeyAndSortKeyStartingWithOrderBySortKeyAsc(partitionKey, sortKeyPrefix)) {
                items.add(toItem(entity));
            }
            return items;
        });
    }

    @Override
    public List<StoreItem> batchGet(Collection<StoreKey> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<StoreItemEntity.StoreItemId> ids = new ArrayList<>(keys.size());
        for (StoreKey key : keys) {
            ids.add(idOf(key));
        }
        return translate(readTransaction, () -> {
            List<StoreItem> items = new ArrayList<>();
            for (StoreItemEntity entity : repository.findAllById(ids)) {
                items.add(toItem(entity));
            }
            return items;
        });
    }

    private <T> T translate(TransactionTemplate transaction, Supplier<T> call) {
        try {
            return transaction.execute(status -> call.get());
        } catch (TransientDataAccessException | RecoverableDataAccessException | CannotCreateTransactionException e) {
            logger.warn("Transient store failure: {}", e.getMessage());
            throw new TransientStoreException("Entity store temporarily unavailable", e);
        }
    }

    private StoreItem toItem(StoreItemEntity entity) {
        try {
            Map<String, Object> attributes = objectMapper.readValue(entity.getPayload(), ATTRIBUTES_TYPE);
            return new StoreItem(StoreKey.of(entity.getPartitionKey(), entity.getSortKey()),
                    attributes, entity.getVersion());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload for " + entity.getPartitionKey() + "|"
                    + entity.getSortKey(), e);
        }
    }

    private String serialize(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Attributes are not serializable", e);
        }
    }

    private static StoreItemEntity.StoreItemId idOf(StoreKey key) {
        return new StoreItemEntity.StoreItemId(key.getPartitionKey(), key.getSortKey());
    }
}
