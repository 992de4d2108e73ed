package com.prospectpulse.backend.store;

import com.prospectpulse.backend.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link StoreSession} backed by a Redis / Valkey server through Spring Data Redis.
 */
public class RedisStoreSession implements StoreSession, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisStoreSession.class);

    private static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final RedisConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private RedisMessageListenerContainer listenerContainer;

    public RedisStoreSession(RedisConnectionFactory connectionFactory, StringRedisTemplate redisTemplate) {
        this.connectionFactory = connectionFactory;
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean ping() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(reply);
    }

    @Override
    public String get(String key) {
        return call("GET", key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("SET NX", key, () -> Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        Long deleted = call("EVAL", key, () -> redisTemplate.execute(COMPARE_AND_DELETE, List.of(key), expected));
        return deleted != null && deleted == 1L;
    }

    @Override
    public boolean delete(String key) {
        return call("DEL", key, () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call("PEXPIRE", key, () -> Boolean.TRUE.equals(redisTemplate.expire(key, ttl)));
    }

    @Override
    public Map<String, String> hashGetAll(String key) {
        return call("HGETALL", key, () -> hashOps().entries(key));
    }

    @Override
    public void hashPutAll(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        run("HSET", key, () -> hashOps().putAll(key, fields));
    }

    @Override
    public void hashPut(String key, String field, String value) {
        run("HSET", key, () -> hashOps().put(key, field, value));
    }

    @Override
    public Set<String> scan(String pattern) {
        return call("SCAN", pattern, () -> {
            Set<String> keys = new LinkedHashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(500).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public void listPush(String key, String value) {
        run("RPUSH", key, () -> redisTemplate.opsForList().rightPush(key, value));
    }

    @Override
    public void listRemove(String key, String value) {
        run("LREM", key, () -> redisTemplate.opsForList().remove(key, 0, value));
    }

    @Override
    public List<String> listRange(String key) {
        List<String> values = call("LRANGE", key, () -> redisTemplate.opsForList().range(key, 0, -1));
        return values != null ? values : List.of();
    }

    @Override
    public void publish(String channel, String message) {
        run("PUBLISH", channel, () -> redisTemplate.convertAndSend(channel, message));
    }

    @Override
    public StoreSubscription subscribe(String channel, Consumer<String> listener) {
        MessageListener adapter = (message, pattern) ->
                listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
        ChannelTopic topic = new ChannelTopic(channel);
        RedisMessageListenerContainer container = call("SUBSCRIBE", channel, this::container);
        container.addMessageListener(adapter, topic);
        log.debug("[PUB/SUB] Subscribed to {}", channel);
        return () -> container.removeMessageListener(adapter, topic);
    }

    @Override
    public boolean isInMemory() {
        return false;
    }

    @Override
    public synchronized void close() {
        if (listenerContainer != null) {
            try {
                listenerContainer.destroy();
            } catch (Exception e) {
                log.warn("[PUB/SUB] Failed to stop listener container", e);
            }
            listenerContainer = null;
        }
    }

    private synchronized RedisMessageListenerContainer container() {
        if (listenerContainer == null) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.afterPropertiesSet();
            container.start();
            listenerContainer = container;
        }
        return listenerContainer;
    }

    /**
     * Runs one command, reporting lost connections and timeouts as
     * {@link StoreUnavailableException}. Other data access errors pass through.
     */
    private static <T> T call(String command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            throw new StoreUnavailableException("Shared store " + command + " " + key + " failed: " + e.getMessage(), e);
        }
    }

    private static void run(String command, String key, Runnable action) {
        call(command, key, () -> {
            action.run();
            return null;
        });
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }
}
