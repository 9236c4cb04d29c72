package com.flagship.vacation_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vacation_ledger.account.Account;
import com.flagship.vacation_ledger.account.AccountRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for accounts. The password hash is never exposed.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("employee_code")
    String employeeCode;

    @JsonProperty("role")
    AccountRole role;

    @JsonProperty("vacation_days_total")
    int vacationDaysTotal;

    @JsonProperty("vacation_days_used")
    int vacationDaysUsed;

    @JsonProperty("vacation_days_remaining")
    int vacationDaysRemaining;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .email(account.getEmail())
            .employeeCode(account.getEmployeeCode())
            .role(account.getRole())
            .vacationDaysTotal(account.getVacationDaysTotal())
            .vacationDaysUsed(account.getVacationDaysUsed())
            .vacationDaysRemaining(account.getRemainingDays())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
