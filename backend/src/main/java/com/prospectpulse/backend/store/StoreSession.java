package com.prospectpulse.backend.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A live session against the shared key-value store.
 * <p>
 * Every process that coordinates through the store sees the same keys; the
 * only atomic primitives offered are single-key set-if-absent with expiry and
 * compare-and-delete.
 */
public interface StoreSession {

    boolean ping();

    String get(String key);

    /**
     * SET key value NX PX ttl.
     *
     * @return true if the key did not exist and now holds {@code value}
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Deletes {@code key} only if it currently holds {@code expected}, as one
     * atomic step.
     */
    boolean compareAndDelete(String key, String expected);

    boolean delete(String key);

    boolean expire(String key, Duration ttl);

    Map<String, String> hashGetAll(String key);

    void hashPutAll(String key, Map<String, String> fields);

    void hashPut(String key, String field, String value);

    /**
     * Keys matching a glob pattern ({@code *} and {@code ?}). Not a snapshot.
     */
    Set<String> scan(String pattern);

    void listPush(String key, String value);

    List<String> listRange(String key);

    /**
     * Removes every occurrence of {@code value} from the list.
     */
    void listRemove(String key, String value);

    void publish(String channel, String message);

    StoreSubscription subscribe(String channel, Consumer<String> listener);

    /**
     * True for the process-local stand-in used when the store is unreachable.
     */
    boolean isInMemory();
}
