package com.prospectpulse.backend.store;

import com.prospectpulse.backend.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Connection loss after a successful ping must surface as {@link StoreUnavailableException}.
 */
class RedisStoreSessionTest {

    private StringRedisTemplate redisTemplate;
    private HashOperations<String, Object, Object> hashOperations;
    private ValueOperations<String, String> valueOperations;
    private RedisStoreSession session;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        hashOperations = mock(HashOperations.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.execute(ArgumentMatchers.<RedisCallback<String>>any())).thenReturn("PONG");
        session = new RedisStoreSession(mock(RedisConnectionFactory.class), redisTemplate);
    }

    @Test
    void shouldReportLostConnectionAsUnavailable() {
        when(hashOperations.entries(anyString())).thenThrow(new RedisConnectionFailureException("Connection reset"));

        assertTrue(session.ping());
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> session.hashGetAll("workspaces:acme:keys"));

        assertEquals("STORE_UNAVAILABLE", e.getErrorCode());
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void shouldReportCommandTimeoutAsUnavailable() {
        when(valueOperations.get(anyString())).thenThrow(new QueryTimeoutException("Command timed out"));

        assertThrows(StoreUnavailableException.class, () -> session.get("locks:create:acme"));
    }

    @Test
    void shouldPassThroughOtherDataAccessErrors() {
        when(valueOperations.get(anyString())).thenThrow(new InvalidDataAccessApiUsageException("WRONGTYPE"));

        assertThrows(InvalidDataAccessApiUsageException.class, () -> session.get("jobs:1"));
    }

    @Test
    void shouldTranslateFailuresOfWrites() {
        doThrow(new RedisConnectionFailureException("Connection reset"))
                .when(redisTemplate).convertAndSend(anyString(), anyString());

        assertThrows(StoreUnavailableException.class, () -> session.publish("jobs:1:events", "{}"));
    }
}
