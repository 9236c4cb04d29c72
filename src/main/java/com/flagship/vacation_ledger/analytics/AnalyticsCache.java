package com.flagship.vacation_ledger.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Best-effort Redis cache for the analytics summary.
 *
 * Strategy:
 * 1. Read Redis first; a miss or any Redis failure falls through to the database
 * 2. Store the freshly computed summary with a TTL
 * 3. Drop the cached copy whenever an account or request changes
 *
 * Redis being down never fails a request; the database stays the source of truth.
 */
@Component
@Slf4j
public class AnalyticsCache {

    static final String SUMMARY_KEY = "analytics:summary";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Duration ttl;

    public AnalyticsCache(Optional<StringRedisTemplate> redisTemplate,
                          ObjectMapper objectMapper,
                          @Value("${analytics.cache.enabled:true}") boolean enabled,
                          @Value("${analytics.cache.ttl:5m}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled && redisTemplate.isPresent();
        this.ttl = ttl;
    }

    public Optional<AnalyticsSummary> get() {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(SUMMARY_KEY);
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Analytics summary served from Redis");
            return Optional.of(objectMapper.readValue(json, AnalyticsSummary.class));
        } catch (Exception e) {
            log.warn("Redis read failed for {}. Falling back to database. Error: {}", SUMMARY_KEY, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(AnalyticsSummary summary) {
        if (!enabled) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(summary);
            redisTemplate.get().opsForValue().set(SUMMARY_KEY, json, ttl);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize analytics summary: {}", e.getMessage());
        } catch (Exception e) {
            log.warn("Redis write failed for {}: {}", SUMMARY_KEY, e.getMessage());
        }
    }

    /**
     * Drops the cached summary. Inside a transaction the eviction waits for the
     * commit, so a concurrent reader cannot re-cache pre-commit figures.
     */
    public void invalidate() {
        if (!enabled) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    evict();
                }
            });
        } else {
            evict();
        }
    }

    private void evict() {
        try {
            redisTemplate.get().delete(SUMMARY_KEY);
            log.debug("Evicted {}", SUMMARY_KEY);
        } catch (Exception e) {
            log.warn("Redis eviction failed for {}: {}", SUMMARY_KEY, e.getMessage());
        }
    }
}
