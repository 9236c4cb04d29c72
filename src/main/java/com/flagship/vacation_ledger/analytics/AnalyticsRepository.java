package com.flagship.vacation_ledger.analytics;

import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Dashboard aggregates computed by PostgreSQL. Only aggregated rows leave the
 * database: one row of counts, one per month, one per employee.
 */
@Repository
public class AnalyticsRepository {

    private final JdbcTemplate jdbcTemplate;

    public AnalyticsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Value
    public static class StatusCounts {
        long total;
        long pending;
        long approved;
        long rejected;
    }

    public StatusCounts countByStatus() {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS total, " +
            "COUNT(*) FILTER (WHERE status = 'PENDING') AS pending, " +
            "COUNT(*) FILTER (WHERE status = 'APPROVED') AS approved, " +
            "COUNT(*) FILTER (WHERE status = 'REJECTED') AS rejected " +
            "FROM vacation_requests",
            (rs, rowNum) -> new StatusCounts(
                rs.getLong("total"), rs.getLong("pending"), rs.getLong("approved"), rs.getLong("rejected"))
        );
    }

    /**
     * Mean seconds from submission to decision over decided requests; empty
     * when nothing has been decided.
     */
    public Optional<Double> averageDecisionSeconds() {
        Double seconds = jdbcTemplate.queryForObject(
            "SELECT AVG(EXTRACT(EPOCH FROM (decided_at - submitted_at))) FROM vacation_requests " +
            "WHERE status IN ('APPROVED', 'REJECTED') AND decided_at IS NOT NULL",
            Double.class
        );
        return Optional.ofNullable(seconds);
    }

    /**
     * Requests per submission month, months taken in {@code zone}. Months
     * without requests are absent.
     */
    public Map<YearMonth, Long> countBySubmissionMonth(Instant since, ZoneId zone) {
        Map<YearMonth, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT TO_CHAR(submitted_at AT TIME ZONE ?, 'YYYY-MM') AS month, COUNT(*) AS request_count " +
            "FROM vacation_requests WHERE submitted_at >= ? " +
            "GROUP BY 1 ORDER BY 1",
            rs -> {
                counts.put(YearMonth.parse(rs.getString("month")), rs.getLong("request_count"));
            },
            TimeZone.getTimeZone(zone).getID(),
            Timestamp.from(since)
        );
        return counts;
    }

    /**
     * Employees ranked by number of requests, ties broken by ascending account id.
     */
    public List<AnalyticsSummary.RequesterCount> topRequesters(int limit) {
        return jdbcTemplate.query(
            "SELECT a.id, a.name, COUNT(r.id) AS request_count " +
            "FROM accounts a LEFT JOIN vacation_requests r ON r.account_id = a.id " +
            "WHERE a.role = 'EMPLOYEE' " +
            "GROUP BY a.id, a.name " +
            "ORDER BY request_count DESC, a.id " +
            "LIMIT ?",
            (rs, rowNum) -> AnalyticsSummary.RequesterCount.builder()
                .accountId(rs.getLong("id"))
                .name(rs.getString("name"))
                .requestCount(rs.getLong("request_count"))
                .build(),
            limit
        );
    }

    /**
     * used / total per employee, highest first. An employee with no
     * entitlement reports 0.
     */
    public List<AnalyticsSummary.Utilization> utilization() {
        return jdbcTemplate.query(
            "SELECT id, name, vacation_days_used, vacation_days_total, " +
            "COALESCE(ROUND(vacation_days_used::numeric / NULLIF(vacation_days_total, 0), 4), 0) AS utilization_ratio, " +
            "COALESCE(ROUND(vacation_days_used * 100.0 / NULLIF(vacation_days_total, 0), 2), 0) AS utilization_percent " +
            "FROM accounts WHERE role = 'EMPLOYEE' " +
            "ORDER BY utilization_ratio DESC, id",
            (rs, rowNum) -> AnalyticsSummary.Utilization.builder()
                .accountId(rs.getLong("id"))
                .name(rs.getString("name"))
                .daysUsed(rs.getInt("vacation_days_used"))
                .daysTotal(rs.getInt("vacation_days_total"))
                .utilizationRatio(rs.getDouble("utilization_ratio"))
                .utilizationPercent(rs.getDouble("utilization_percent"))
                .build()
        );
    }
}
