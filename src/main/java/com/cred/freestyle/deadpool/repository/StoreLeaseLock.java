package com.cred.freestyle.deadpool.repository;

import com.cred.freestyle.deadpool.infrastructure.store.StoreItem;
import com.cred.freestyle.deadpool.infrastructure.store.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Lease lock held as an item in the entity store.
 *
 * Lock Pattern:
 * - Acquire is a conditional put that succeeds when no lock item exists or the existing lease has expired
 * - Each acquisition carries a unique token so only the owner can release it
 * - The lease expiry prevents deadlocks if the holder crashes mid-operation
 *
 * Usage:
 * String token = lock.acquireLockWithRetry(KeySchema.draftLock(playerId, year), lease, wait, backoff);
 * if (token != null) {
 *     try {
 *         // critical section
 *     } finally {
 *         lock.releaseLock(key, token);
 *     }
 * }
 *
 * @author Deadpool Team
 */
@Component
public class StoreLeaseLock {

    private static final Logger logger = LoggerFactory.getLogger(StoreLeaseLock.class);

    private static final String TOKEN = "token";
    private static final String EXPIRES_AT = "expiresAt";

    private final StoreOperations store;
    private final Clock clock;

    public StoreLeaseLock(StoreOperations store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Attempt to acquire the lock once.
     *
     * @param lockKey Lock item key
     * @param lease Lease duration (auto-release if the holder crashes)
     * @return Lock token if acquired, null if the lock is held
     */
    public String acquireLock(StoreKey lockKey, Duration lease) {
        String lockToken = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Map<String, Object> attributes = Map.of(
                TOKEN, lockToken,
                EXPIRES_AT, now.plus(lease).toString());

        boolean acquired = store.putConditional(lockKey, attributes, current -> isFree(current, now));
        if (acquired) {
            logger.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
            return lockToken;
        }
        logger.debug("Failed to acquire lock (already held): {}", lockKey);
        return null;
    }

    /**
     * Extend the lease if the lock is still owned by the given token.
     * Fails once another caller has taken over an expired lease.
     *
     * @param lockKey Lock item key
     * @param lockToken Token returned from acquire
     * @param lease New lease duration, counted from now
     * @return true if the lease was extended
     */
    public boolean renewLock(StoreKey lockKey, String lockToken, Duration lease) {
        if (lockToken == null) {
            return false;
        }
        Map<String, Object> attributes = Map.of(
                TOKEN, lockToken,
                EXPIRES_AT, clock.instant().plus(lease).toString());

        boolean renewed = store.putConditional(lockKey, attributes,
                current -> current.map(item -> lockToken.equals(item.getString(TOKEN))).orElse(false));
        if (!renewed) {
            logger.warn("Lock {} could not be renewed; lease taken over", lockKey);
        }
        return renewed;
    }

    /**
     * Release the lock if it is still owned by the given token.
     *
     * @param lockKey Lock item key
     * @param lockToken Token returned from acquire
     * @return true if released
     */
    public boolean releaseLock(StoreKey lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        boolean released = store.deleteConditional(lockKey,
                current -> current.map(item -> lockToken.equals(item.getString(TOKEN))).orElse(false));
        if (released) {
            logger.debug("Released lock: {} with token: {}", lockKey, lockToken);
        } else {
            logger.warn("Lock {} was not released; lease expired or taken over", lockKey);
        }
        return released;
    }

    /**
     * Try to acquire the lock, retrying with exponential backoff until the wait elapses.
     *
     * @param lockKey Lock item key
     * @param lease Lease duration
     * @param maxWait Maximum time to keep trying
     * @param initialBackoff Initial backoff between attempts
     * @return Lock token if acquired, null on timeout or interrupt
     */
    public String acquireLockWithRetry(StoreKey lockKey, Duration lease, Duration maxWait, Duration initialBackoff) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        long backoffMillis = Math.max(1, initialBackoff.toMillis());
        int attempt = 0;

        while (true) {
            attempt++;
            String lockToken = acquireLock(lockKey, lease);
            if (lockToken != null) {
                if (attempt > 1) {
                    logger.debug("Acquired lock after {} attempts: {}", attempt, lockKey);
                }
                return lockToken;
            }
            if (System.nanoTime() >= deadline) {
                break;
            }

            long sleepTime = Math.min(backoffMillis * (1L << Math.min(attempt - 1, 10)), 1000);
            sleepTime += ThreadLocalRandom.current().nextLong(10);
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                return null;
            }
        }

        logger.warn("Failed to acquire lock after {}ms and {} attempts: {}", maxWait.toMillis(), attempt, lockKey);
        return null;
    }

    private static boolean isFree(Optional<StoreItem> current, Instant now) {
        if (current.isEmpty()) {
            return true;
        }
        String expiresAt = current.get().getString(EXPIRES_AT);
        return expiresAt == null || !Instant.parse(expiresAt).isAfter(now);
    }
}
