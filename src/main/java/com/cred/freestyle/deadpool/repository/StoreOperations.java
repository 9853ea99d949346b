package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import com.cred.freestyle.deadpool.exception.TransientStoreException;
import com.cred.freestyle.deadpool.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.deadpool.infrastructure.store.EntityStore;
import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Gateway through which repositories reach the {@link EntityStore}.
 *
 * Every call is retried on {@link TransientStoreException} with bounded exponential
 * backoff. When attempts are exhausted the last exception propagates unchanged.
 * Business outcomes (a conditional write returning false) are never retried.
 *
 * @author Deadpool Team
 */
@Component
public class StoreOperations {

    private static final Logger logger = LoggerFactory.getLogger(StoreOperations.class);

    private final EntityStore store;
    private final CloudWatchMetricsService metricsService;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;

    public StoreOperations(EntityStore store, DeadpoolProperties properties, CloudWatchMetricsService metricsService) {
        this.store = store;
        this.metricsService = metricsService;
        DeadpoolProperties.Retry retry = properties.getStore().getRetry();
        this.maxAttempts = Math.max(1, retry.getMaxAttempts());
        this.initialBackoffMillis = retry.getInitialBackoff().toMillis();
        this.maxBackoffMillis = retry.getMaxBackoff().toMillis();
    }

    public Optional<StoreItem> get(StoreKey key) {
        return withRetry("get", () -> store.get(key));
    }

    public boolean putIfAbsent(StoreKey key, Map<String, Object> attributes) {
        return withRetry("putIfAbsent", () -> store.putIfAbsent(key, attributes));
    }

    public boolean putConditional(StoreKey key, Map<String, Object> attributes,
                                  Predicate<Optional<StoreItem>> condition) {
        return withRetry("putConditional", () -> store.putConditional(key, attributes, condition));
    }

    public void put(StoreKey key, Map<String, Object> attributes) {
        withRetry("put", () -> {
            store.put(key, attributes);
            return null;
        });
    }

    public boolean deleteConditional(StoreKey key, Predicate<Optional<StoreItem>> condition) {
        return withRetry("deleteConditional", () -> store.deleteConditional(key, condition));
    }

    public List<StoreItem> queryByPrefix(String partitionKey, String sortKeyPrefix) {
        return withRetry("queryByPrefix", () -> store.queryByPrefix(partitionKey, sortKeyPrefix));
    }

    public List<StoreItem> batchGet(Collection<StoreKey> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        return withRetry("batchGet", () -> store.batchGet(keys));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        long backoff = initialBackoffMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientStoreException e) {
                if (attempt >= maxAttempts) {
                    logger.error("Store operation {} failed after {} attempts", operation, attempt);
                    throw e;
                }
                logger.warn("Transient failure on {} (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                metricsService.recordStoreRetry(operation);
                sleep(backoff, e);
                backoff = Math.min(backoff * 2, maxBackoffMillis);
            }
        }
    }

    private static void sleep(long millis, TransientStoreException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while backing off", cause);
        }
    }
}
