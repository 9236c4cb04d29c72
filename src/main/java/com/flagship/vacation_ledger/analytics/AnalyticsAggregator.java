package com.flagship.vacation_ledger.analytics;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the manager dashboard from the aggregates {@link AnalyticsRepository}
 * computes in the database.
 *
 * What stays in Java is presentation: the twelve-month axis anchored on the
 * clock, and rounding of the average decision time.
 */
@Component
public class AnalyticsAggregator {

    static final int TRAILING_MONTHS = 12;

    private final AnalyticsRepository repository;
    private final Clock clock;
    private final int topRequestersLimit;

    public AnalyticsAggregator(AnalyticsRepository repository,
                               Clock clock,
                               @Value("${analytics.top-requesters-limit:10}") int topRequestersLimit) {
        this.repository = repository;
        this.clock = clock;
        this.topRequestersLimit = topRequestersLimit;
    }

    public AnalyticsSummary aggregate() {
        AnalyticsRepository.StatusCounts counts = repository.countByStatus();
        YearMonth firstMonth = firstMonth();

        return AnalyticsSummary.builder()
            .totalRequests(counts.getTotal())
            .pendingRequests(counts.getPending())
            .approvedRequests(counts.getApproved())
            .rejectedRequests(counts.getRejected())
            .averageApprovalHours(averageDecisionHours(repository.averageDecisionSeconds()))
            .requestsByMonth(monthlyCounts(repository.countBySubmissionMonth(
                monthStart(firstMonth), clock.getZone())))
            .topRequesters(repository.topRequesters(topRequestersLimit))
            .vacationUtilization(repository.utilization())
            .generatedAt(clock.instant())
            .build();
    }

    /**
     * Hours, one decimal. 0.0 when nothing has been decided.
     */
    double averageDecisionHours(Optional<Double> meanSeconds) {
        return meanSeconds
            .map(seconds -> Math.round(seconds / 3600.0 * 10) / 10.0)
            .orElse(0.0);
    }

    /**
     * Trailing twelve months ending with the current one, oldest first,
     * months without requests included. Months outside the window are ignored.
     */
    List<AnalyticsSummary.MonthlyCount> monthlyCounts(Map<YearMonth, Long> countsByMonth) {
        YearMonth first = firstMonth();
        List<AnalyticsSummary.MonthlyCount> result = new ArrayList<>(TRAILING_MONTHS);
        for (int i = 0; i < TRAILING_MONTHS; i++) {
            YearMonth month = first.plusMonths(i);
            result.add(AnalyticsSummary.MonthlyCount.builder()
                .month(month.toString())
                .count(countsByMonth.getOrDefault(month, 0L))
                .build());
        }
        return result;
    }

    Instant monthStart(YearMonth month) {
        return month.atDay(1).atStartOfDay(clock.getZone()).toInstant();
    }

    private YearMonth firstMonth() {
        return YearMonth.now(clock).minusMonths(TRAILING_MONTHS - 1);
    }
}
