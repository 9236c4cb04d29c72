package com.flagship.vacation_ledger.account;

import lombok.Value;

import java.time.Instant;

/**
 * Account domain object: a person with a role and a vacation balance.
 *
 * Invariant: {@code 0 <= vacationDaysUsed <= vacationDaysTotal}. The stored
 * counter is only moved by the balance ledger, never through this object.
 */
@Value
public class Account {
    Long id;
    String name;
    String email;
    String employeeCode;
    AccountRole role;
    int vacationDaysTotal;
    int vacationDaysUsed;
    Instant createdAt;
    Instant updatedAt;

    public int getRemainingDays() {
        return vacationDaysTotal - vacationDaysUsed;
    }
}
