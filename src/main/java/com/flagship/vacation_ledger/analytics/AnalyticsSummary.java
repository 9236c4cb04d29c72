package com.flagship.vacation_ledger.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Manager dashboard figures aggregated from one snapshot of accounts and requests.
 *
 * Jacksonized so a cached copy can be read back from Redis.
 */
@Value
@Builder
@Jacksonized
public class AnalyticsSummary {

    @JsonProperty("total_requests")
    long totalRequests;

    @JsonProperty("pending_requests")
    long pendingRequests;

    @JsonProperty("approved_requests")
    long approvedRequests;

    @JsonProperty("rejected_requests")
    long rejectedRequests;

    /**
     * Mean hours from submission to decision over decided requests, one decimal.
     */
    @JsonProperty("average_approval_hours")
    double averageApprovalHours;

    /**
     * Trailing twelve months, oldest first, including months without requests.
     */
    @JsonProperty("requests_by_month")
    List<MonthlyCount> requestsByMonth;

    @JsonProperty("top_requesters")
    List<RequesterCount> topRequesters;

    @JsonProperty("vacation_utilization")
    List<Utilization> vacationUtilization;

    @JsonProperty("generated_at")
    Instant generatedAt;

    @Value
    @Builder
    @Jacksonized
    public static class MonthlyCount {
        /** {@code YYYY-MM} */
        @JsonProperty("month")
        String month;

        @JsonProperty("count")
        long count;
    }

    @Value
    @Builder
    @Jacksonized
    public static class RequesterCount {
        @JsonProperty("account_id")
        Long accountId;

        @JsonProperty("name")
        String name;

        @JsonProperty("request_count")
        long requestCount;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Utilization {
        @JsonProperty("account_id")
        Long accountId;

        @JsonProperty("name")
        String name;

        @JsonProperty("days_used")
        int daysUsed;

        @JsonProperty("days_total")
        int daysTotal;

        /** used / total, 0 when total is 0 */
        @JsonProperty("utilization_ratio")
        double utilizationRatio;

        @JsonProperty("utilization_percent")
        double utilizationPercent;
    }
}
