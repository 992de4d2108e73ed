package com.prospectpulse.backend.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoreSessionTest {

    private MutableClock clock;
    private InMemoryStoreSession session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        session = new InMemoryStoreSession(clock);
    }

    @Test
    void shouldSetIfAbsentOnlyOnce() {
        assertTrue(session.setIfAbsent("locks:a", "t1", Duration.ofSeconds(10)));
        assertFalse(session.setIfAbsent("locks:a", "t2", Duration.ofSeconds(10)));
        assertEquals("t1", session.get("locks:a"));
    }

    @Test
    void shouldExpireKeysAfterTtl() {
        session.setIfAbsent("locks:a", "t1", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));

        assertNull(session.get("locks:a"));
        assertTrue(session.setIfAbsent("locks:a", "t2", Duration.ofSeconds(10)));
    }

    @Test
    void shouldCompareAndDeleteOnlyMatchingValue() {
        session.setIfAbsent("locks:a", "t1", Duration.ofSeconds(10));

        assertFalse(session.compareAndDelete("locks:a", "other"));
        assertEquals("t1", session.get("locks:a"));

        assertTrue(session.compareAndDelete("locks:a", "t1"));
        assertNull(session.get("locks:a"));
        assertFalse(session.compareAndDelete("locks:a", "t1"));
    }

    @Test
    void shouldMergeHashFields() {
        session.hashPutAll("jobs:1", Map.of("status", "queued", "progress", "0.0"));
        session.hashPut("jobs:1", "status", "mining");

        Map<String, String> fields = session.hashGetAll("jobs:1");
        assertEquals("mining", fields.get("status"));
        assertEquals("0.0", fields.get("progress"));
        assertTrue(session.hashGetAll("jobs:missing").isEmpty());
    }

    @Test
    void shouldScanWithGlobPattern() {
        session.hashPutAll("workspaces:a:keys", Map.of("provider", "openai"));
        session.hashPutAll("workspaces:b:keys", Map.of("provider", "gemini"));
        session.hashPutAll("jobs:1", Map.of("status", "queued"));
        session.hashPutAll("workspaces:c:other", Map.of("x", "y"));

        Set<String> keys = session.scan("workspaces:*:keys");

        assertEquals(Set.of("workspaces:a:keys", "workspaces:b:keys"), keys);
    }

    @Test
    void shouldNotReturnExpiredKeysFromScan() {
        session.hashPutAll("operations:1", Map.of("status", "pending"));
        session.expire("operations:1", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(31));

        assertTrue(session.scan("operations:*").isEmpty());
    }

    @Test
    void shouldAppendToLists() {
        session.listPush("jobs:1:leads", "a");
        session.listPush("jobs:1:leads", "b");

        assertEquals(List.of("a", "b"), session.listRange("jobs:1:leads"));
    }

    @Test
    void shouldDeliverPublishedMessagesUntilUnsubscribed() {
        List<String> received = new ArrayList<>();
        StoreSubscription subscription = session.subscribe("jobs:1:events", received::add);

        session.publish("jobs:1:events", "first");
        session.publish("jobs:2:events", "other job");
        subscription.close();
        session.publish("jobs:1:events", "after close");

        assertEquals(List.of("first"), received);
    }

    @Test
    void shouldIsolateFailingSubscriber() {
        List<String> received = new ArrayList<>();
        session.subscribe("ch", message -> {
            throw new IllegalStateException("boom");
        });
        session.subscribe("ch", received::add);

        session.publish("ch", "hello");

        assertEquals(List.of("hello"), received);
    }
}
