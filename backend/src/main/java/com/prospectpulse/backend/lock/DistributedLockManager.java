package com.prospectpulse.backend.lock;

import com.prospectpulse.backend.exception.LockBusyException;
import com.prospectpulse.backend.store.StoreClient;
import com.prospectpulse.backend.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Named, TTL-bound mutual exclusion on top of the shared store.
 * <p>
 * A lock is the key {@code locks:{resource}} holding a random owner token.
 * There is no waiter queue: a busy lock gets one bounded retry, after which
 * the caller receives {@link LockBusyException}. A holder that dies leaves its
 * lock to expire with the TTL.
 */
@Component
public class DistributedLockManager {

    private static final Logger log = LoggerFactory.getLogger(DistributedLockManager.class);

    private final StoreClient storeClient;
    private final Duration defaultTtl;
    private final Duration retryDelay;

    public DistributedLockManager(StoreClient storeClient,
            @Value("${prospectpulse.lock.ttl:10s}") Duration defaultTtl,
            @Value("${prospectpulse.lock.retry-delay:100ms}") Duration retryDelay) {
        this.storeClient = storeClient;
        this.defaultTtl = defaultTtl;
        this.retryDelay = retryDelay;
    }

    /**
     * Single attempt to take the lock.
     *
     * @return the owner token if the lock was free
     */
    public Optional<String> tryAcquire(String resource, Duration ttl) {
        String token = UUID.randomUUID().toString();
        if (storeClient.getSession().setIfAbsent(StoreKeys.lock(resource), token, ttl)) {
            log.debug("[LOCK] Acquired {} (ttl {})", resource, ttl);
            return Optional.of(token);
        }
        return Optional.empty();
    }

    public String acquire(String resource) {
        return acquire(resource, defaultTtl);
    }

    /**
     * Takes the lock, retrying exactly once after {@code retry-delay}.
     *
     * @return the owner token to pass to {@link #release(String, String)}
     * @throws LockBusyException if the lock is still held after the retry
     */
    public String acquire(String resource, Duration ttl) {
        Optional<String> token = tryAcquire(resource, ttl);
        if (token.isPresent()) {
            return token.get();
        }

        log.debug("[LOCK] {} busy, retrying in {}", resource, retryDelay);
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockBusyException(resource);
        }

        return tryAcquire(resource, ttl).orElseThrow(() -> {
            log.warn("[LOCK] Could not acquire {} after retry", resource);
            return new LockBusyException(resource);
        });
    }

    /**
     * Releases the lock only if {@code ownerToken} still holds it. Never throws;
     * a lock that cannot be released expires with its TTL.
     *
     * @return true if this call deleted the lock
     */
    public boolean release(String resource, String ownerToken) {
        try {
            boolean released = storeClient.getSession().compareAndDelete(StoreKeys.lock(resource), ownerToken);
            if (released) {
                log.debug("[LOCK] Released {}", resource);
            } else {
                log.warn("[LOCK] {} no longer held by this owner, leaving it to its current holder", resource);
            }
            return released;
        } catch (RuntimeException e) {
            log.warn("[LOCK] Failed to release {}, it will expire with its TTL: {}", resource, e.getMessage());
            return false;
        }
    }
}
