package com.flagship.vacation_ledger.observability;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis connectivity for the analytics cache.
 *
 * Redis is optional: when it cannot be reached the status is DEGRADED rather
 * than DOWN, since analytics fall back to the database.
 */
@Component("analyticsCacheHealth")
public class AnalyticsCacheHealthIndicator implements HealthIndicator {

    private static final String FALLBACK_NOTE = "Analytics are computed from the database while Redis is unavailable";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean cacheEnabled;

    public AnalyticsCacheHealthIndicator(Optional<StringRedisTemplate> redisTemplate,
                                         @Value("${analytics.cache.enabled:true}") boolean cacheEnabled) {
        this.redisTemplate = redisTemplate;
        this.cacheEnabled = cacheEnabled;
    }

    @Override
    public Health health() {
        if (!cacheEnabled || redisTemplate.isEmpty()) {
            return Health.up()
                    .withDetail("cache", "disabled")
                    .build();
        }

        RedisConnectionFactory connectionFactory = redisTemplate.get().getConnectionFactory();
        if (connectionFactory == null) {
            return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }

        try (RedisConnection connection = connectionFactory.getConnection()) {
            String reply = connection.ping();
            if ("PONG".equals(reply)) {
                return Health.up()
                        .withDetail("response", reply)
                        .build();
            }
            return Health.status("DEGRADED")
                    .withDetail("response", reply != null ? reply : "null")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        } catch (Exception e) {
            return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }
    }
}
