package com.prospectpulse.backend.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Process-local stand-in for the shared store, used in development when the
 * real server cannot be reached and by tests.
 * <p>
 * Data operations serialize on the instance monitor, which makes
 * set-if-absent and compare-and-delete atomic within this process. Published
 * messages are delivered synchronously on the publishing thread.
 */
public class InMemoryStoreSession implements StoreSession {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStoreSession.class);

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();
    private final Map<String, List<Consumer<String>>> channels = new ConcurrentHashMap<>();

    public InMemoryStoreSession() {
        this(Clock.systemUTC());
    }

    public InMemoryStoreSession(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public synchronized String get(String key) {
        Entry entry = live(key);
        return entry != null ? entry.value : null;
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (live(key) != null) {
            return false;
        }
        Entry entry = new Entry();
        entry.value = value;
        entry.expiresAt = clock.instant().plus(ttl);
        entries.put(key, entry);
        return true;
    }

    @Override
    public synchronized boolean compareAndDelete(String key, String expected) {
        Entry entry = live(key);
        if (entry == null || entry.value == null || !entry.value.equals(expected)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        return live(key) != null && entries.remove(key) != null;
    }

    @Override
    public synchronized boolean expire(String key, Duration ttl) {
        Entry entry = live(key);
        if (entry == null) {
            return false;
        }
        entry.expiresAt = clock.instant().plus(ttl);
        return true;
    }

    @Override
    public synchronized Map<String, String> hashGetAll(String key) {
        Entry entry = live(key);
        if (entry == null || entry.hash == null) {
            return Map.of();
        }
        return new LinkedHashMap<>(entry.hash);
    }

    @Override
    public synchronized void hashPutAll(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        hashFor(key).putAll(fields);
    }

    @Override
    public synchronized void hashPut(String key, String field, String value) {
        hashFor(key).put(field, value);
    }

    @Override
    public synchronized Set<String> scan(String pattern) {
        Pattern regex = globToRegex(pattern);
        Set<String> keys = new LinkedHashSet<>();
        for (String key : new ArrayList<>(entries.keySet())) {
            if (live(key) != null && regex.matcher(key).matches()) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public synchronized void listPush(String key, String value) {
        Entry entry = live(key);
        if (entry == null) {
            entry = new Entry();
            entry.list = new ArrayList<>();
            entries.put(key, entry);
        } else if (entry.list == null) {
            throw new IllegalStateException("WRONGTYPE key does not hold a list: " + key);
        }
        entry.list.add(value);
    }

    @Override
    public synchronized void listRemove(String key, String value) {
        Entry entry = live(key);
        if (entry == null || entry.list == null) {
            return;
        }
        entry.list.removeIf(value::equals);
        if (entry.list.isEmpty()) {
            entries.remove(key);
        }
    }

    @Override
    public synchronized List<String> listRange(String key) {
        Entry entry = live(key);
        if (entry == null || entry.list == null) {
            return List.of();
        }
        return new ArrayList<>(entry.list);
    }

    @Override
    public void publish(String channel, String message) {
        List<Consumer<String>> listeners = channels.get(channel);
        if (listeners == null) {
            return;
        }
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.warn("[STORE] In-memory subscriber on {} failed", channel, e);
            }
        }
    }

    @Override
    public StoreSubscription subscribe(String channel, Consumer<String> listener) {
        channels.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> channels.computeIfPresent(channel, (c, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    @Override
    public boolean isInMemory() {
        return true;
    }

    /**
     * Drops every key. Subscriptions are kept.
     */
    public synchronized void flush() {
        entries.clear();
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private Map<String, String> hashFor(String key) {
        Entry entry = live(key);
        if (entry == null) {
            entry = new Entry();
            entry.hash = new LinkedHashMap<>();
            entries.put(key, entry);
        } else if (entry.hash == null) {
            throw new IllegalStateException("WRONGTYPE key does not hold a hash: " + key);
        }
        return entry.hash;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static final class Entry {
        private String value;
        private Map<String, String> hash;
        private List<String> list;
        private Instant expiresAt;
    }
}
