package com.flagship.vacation_ledger.observability;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalyticsCacheHealthIndicatorTest {

    @Test
    void disabledCacheIsUp() {
        Health health = new AnalyticsCacheHealthIndicator(Optional.empty(), true).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("disabled", health.getDetails().get("cache"));
    }

    @Test
    void pongIsUp() {
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        RedisConnection connection = mock(RedisConnection.class);
        when(factory.getConnection()).thenReturn(connection);
        when(connection.ping()).thenReturn("PONG");

        Health health = new AnalyticsCacheHealthIndicator(Optional.of(new StringRedisTemplate(factory)), true).health();

        assertEquals(Status.UP, health.getStatus());
    }

    @Test
    void unreachableRedisIsDegradedNotDown() {
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        when(factory.getConnection()).thenThrow(new RedisConnectionFailureException("Connection refused"));

        Health health = new AnalyticsCacheHealthIndicator(Optional.of(new StringRedisTemplate(factory)), true).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals("Connection refused", health.getDetails().get("error"));
    }
}
