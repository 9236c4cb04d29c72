package com.flagship.vacation_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vacation_ledger.request.RequestStatus;
import com.flagship.vacation_ledger.request.VacationRequest;
import com.flagship.vacation_ledger.request.VacationRequestView;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for vacation requests. Owner name and email are only present
 * on read endpoints.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VacationRequestResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("account_email")
    String accountEmail;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("duration_days")
    int durationDays;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("status")
    RequestStatus status;

    @JsonProperty("decided_by")
    Long decidedBy;

    @JsonProperty("decided_at")
    Instant decidedAt;

    @JsonProperty("manager_notes")
    String managerNotes;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static VacationRequestResponse from(VacationRequest request) {
        return base(request).build();
    }

    public static VacationRequestResponse from(VacationRequestView view) {
        return base(view.getRequest())
            .accountName(view.getAccountName())
            .accountEmail(view.getAccountEmail())
            .build();
    }

    private static VacationRequestResponseBuilder base(VacationRequest request) {
        return VacationRequestResponse.builder()
            .id(request.getId())
            .accountId(request.getAccountId())
            .startDate(request.getRange().getStart())
            .endDate(request.getRange().getEnd())
            .durationDays(request.getDurationDays())
            .reason(request.getReason())
            .status(request.getStatus())
            .decidedBy(request.getDecidedBy())
            .decidedAt(request.getDecidedAt())
            .managerNotes(request.getManagerNotes())
            .submittedAt(request.getSubmittedAt())
            .updatedAt(request.getUpdatedAt());
    }
}
