package com.flagship.vacation_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the vacation request workflow.
 *
 * Metrics exposed:
 * - vacation.requests.created: requests entering PENDING
 * - vacation.requests.decided{decision}: approvals and rejections
 * - vacation.requests.deleted: pending requests removed
 * - vacation.requests.refused{reason}: operations refused by a business rule
 * - vacation.ledger.days_applied: vacation days added to balances by approvals
 * - vacation.workflow.latency{operation}: time spent in each workflow operation
 */
@Component
public class WorkflowMetrics {

    private final MeterRegistry registry;

    private final Counter requestsCreated;
    private final Counter requestsDeleted;
    private final Counter daysApplied;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requestsCreated = Counter.builder("vacation.requests.created")
                .description("Number of vacation requests created")
                .register(registry);

        this.requestsDeleted = Counter.builder("vacation.requests.deleted")
                .description("Number of pending vacation requests deleted")
                .register(registry);

        this.daysApplied = Counter.builder("vacation.ledger.days_applied")
                .description("Vacation days consumed by approved requests")
                .register(registry);
    }

    public void recordCreated() {
        requestsCreated.increment();
    }

    public void recordDeleted() {
        requestsDeleted.increment();
    }

    public void recordDecision(String decision) {
        registry.counter("vacation.requests.decided", "decision", sanitizeTag(decision)).increment();
    }

    public void recordDaysApplied(int days) {
        daysApplied.increment(days);
    }

    /**
     * Records an operation refused by a workflow rule (overlap, balance, state, role).
     */
    public void recordRefused(String operation, String reason) {
        registry.counter("vacation.requests.refused",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("vacation.workflow.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values to a bounded character set and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
