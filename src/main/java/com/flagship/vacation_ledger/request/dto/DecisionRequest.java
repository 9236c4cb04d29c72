package com.flagship.vacation_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of the approve and reject endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {

    @Size(max = 1000, message = "Manager notes must be at most 1000 characters")
    @JsonProperty("manager_notes")
    private String managerNotes;
}
