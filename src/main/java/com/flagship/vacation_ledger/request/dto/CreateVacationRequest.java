package com.flagship.vacation_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of {@code POST /api/requests}. Dates are ISO {@code YYYY-MM-DD}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateVacationRequest {

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    private LocalDate endDate;

    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    private String reason;
}
