package com.flagship.vacation_ledger.analytics;

import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.identity.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serves the manager dashboard, from Redis when a fresh copy is cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsService {

    private final AnalyticsAggregator aggregator;
    private final AnalyticsCache cache;

    // REPEATABLE_READ so every aggregate query sees the same snapshot
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AnalyticsSummary summary(Principal principal) {
        principal.requireRole(AccountRole.MANAGER, "view analytics");

        return cache.get().orElseGet(() -> {
            AnalyticsSummary summary = aggregator.aggregate();
            log.debug("Analytics computed: totalRequests={}", summary.getTotalRequests());
            cache.put(summary);
            return summary;
        });
    }
}
