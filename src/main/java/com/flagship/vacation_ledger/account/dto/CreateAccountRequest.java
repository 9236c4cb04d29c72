package com.flagship.vacation_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vacation_ledger.account.AccountRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/users}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    @JsonProperty("name")
    private String name;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email address")
    @JsonProperty("email")
    private String email;

    @NotBlank(message = "Employee code is required")
    @Pattern(regexp = "^\\d{7}$", message = "Employee code must be exactly 7 digits")
    @JsonProperty("employee_code")
    private String employeeCode;

    @NotBlank(message = "Password is required")
    @Size(min = 8, message = "Password must be at least 8 characters")
    @JsonProperty("password")
    private String password;

    /** Defaults to employee. */
    @JsonProperty("role")
    private AccountRole role;

    /** Defaults to the configured entitlement. */
    @Min(value = 0, message = "Vacation days total must not be negative")
    @Max(value = 366, message = "Vacation days total must be at most 366")
    @JsonProperty("vacation_days_total")
    private Integer vacationDaysTotal;
}
