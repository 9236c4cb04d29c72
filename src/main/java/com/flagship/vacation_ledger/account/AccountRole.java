package com.flagship.vacation_ledger.account;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role of an account, fixed at creation.
 */
public enum AccountRole {
    /**
     * Decides requests and manages accounts.
     */
    MANAGER,

    /**
     * Owns vacation requests and a vacation balance.
     */
    EMPLOYEE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccountRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        return AccountRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
