package com.flagship.vacation_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of {@code PUT /api/requests/{id}}. Omitted fields keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateVacationRequest {

    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("end_date")
    private LocalDate endDate;

    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    private String reason;
}
