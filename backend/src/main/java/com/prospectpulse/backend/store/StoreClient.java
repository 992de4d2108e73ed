package com.prospectpulse.backend.store;

import com.prospectpulse.backend.exception.StoreUnavailableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands out the process-wide session to the shared store.
 * <p>
 * A cached Redis session is pinged before every reuse and replaced when the
 * ping fails. If no connection can be made, {@link StorePosture#DEVELOPMENT}
 * switches the process to an in-memory store for the rest of its life, while
 * {@link StorePosture#PRODUCTION} raises {@link StoreUnavailableException}.
 */
@Component
public class StoreClient {

    private static final Logger log = LoggerFactory.getLogger(StoreClient.class);

    private final RedisConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private final StorePosture posture;
    private final Duration reconnectBackoff;

    private volatile RedisStoreSession session;
    private volatile InMemoryStoreSession fallback;
    private volatile StoreUnavailableException lastFailure;
    private volatile long lastFailureNanos;

    @Autowired
    public StoreClient(RedisConnectionFactory connectionFactory,
            StringRedisTemplate redisTemplate,
            @Value("${prospectpulse.store.posture:development}") String posture,
            @Value("${prospectpulse.store.reconnect-backoff:1s}") Duration reconnectBackoff) {
        this(connectionFactory, redisTemplate, StorePosture.parse(posture), reconnectBackoff);
    }

    public StoreClient(RedisConnectionFactory connectionFactory,
            StringRedisTemplate redisTemplate,
            StorePosture posture) {
        this(connectionFactory, redisTemplate, posture, Duration.ofSeconds(1));
    }

    public StoreClient(RedisConnectionFactory connectionFactory,
            StringRedisTemplate redisTemplate,
            StorePosture posture,
            Duration reconnectBackoff) {
        this.connectionFactory = connectionFactory;
        this.redisTemplate = redisTemplate;
        this.posture = posture;
        this.reconnectBackoff = reconnectBackoff;
    }

    /**
     * Returns a live session, reconnecting or falling back as the posture allows.
     * <p>
     * The health ping of a cached session runs without holding the client's
     * monitor; only replacing the session is serialized. In production posture
     * a failed connection attempt is remembered for {@code reconnect-backoff},
     * and callers arriving in that window fail at once instead of queueing for
     * their own connect timeout.
     *
     * @throws StoreUnavailableException in production posture when the store cannot be reached
     */
    public StoreSession getSession() {
        InMemoryStoreSession memory = fallback;
        if (memory != null) {
            return memory;
        }

        RedisStoreSession current = session;
        if (current != null) {
            try {
                if (current.ping()) {
                    return current;
                }
            } catch (RuntimeException e) {
                log.warn("[STORE] Ping failed on cached session, reconnecting: {}", e.getMessage());
            }
        }
        return reconnect(current);
    }

    private synchronized StoreSession reconnect(RedisStoreSession stale) {
        if (fallback != null) {
            return fallback;
        }
        if (session != null && session != stale) {
            // replaced by another caller while this one waited
            return session;
        }
        if (session != null) {
            session.close();
            session = null;
        }

        StoreUnavailableException recent = lastFailure;
        if (recent != null && System.nanoTime() - lastFailureNanos < reconnectBackoff.toNanos()) {
            throw new StoreUnavailableException(recent.getMessage(), recent.getCause());
        }

        RedisStoreSession candidate = new RedisStoreSession(connectionFactory, redisTemplate);
        RuntimeException failure;
        try {
            if (candidate.ping()) {
                session = candidate;
                lastFailure = null;
                log.info("[STORE] Connection to shared store established");
                return candidate;
            }
            failure = new IllegalStateException("Unexpected ping reply");
        } catch (RuntimeException e) {
            failure = e;
        }
        candidate.close();

        if (posture == StorePosture.PRODUCTION) {
            log.error("[STORE] Shared store unreachable in production posture", failure);
            StoreUnavailableException unavailable = new StoreUnavailableException(
                    "Shared store connection required in production: " + failure.getMessage(), failure);
            lastFailure = unavailable;
            lastFailureNanos = System.nanoTime();
            throw unavailable;
        }

        log.warn("[STORE] Shared store unreachable ({}), falling back to in-memory store for development",
                failure.getMessage());
        InMemoryStoreSession memory = new InMemoryStoreSession();
        fallback = memory;
        return memory;
    }

    /**
     * Summary for health reporting. Does not throw.
     */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("posture", posture.name().toLowerCase());
        try {
            StoreSession current = getSession();
            info.put("backend", current.isInMemory() ? "in-memory" : "redis");
            info.put("reachable", true);
        } catch (StoreUnavailableException e) {
            info.put("backend", "redis");
            info.put("reachable", false);
            info.put("detail", e.getMessage());
        }
        return info;
    }

    @PreDestroy
    public synchronized void close() {
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
