package com.flagship.vacation_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PUT /api/users/{id}}. Omitted fields are left unchanged.
 * Role, employee code and entitlement cannot be changed here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAccountRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    @JsonProperty("name")
    private String name;

    @Email(message = "Invalid email address")
    @JsonProperty("email")
    private String email;

    @Size(min = 8, message = "Password must be at least 8 characters")
    @JsonProperty("password")
    private String password;
}
