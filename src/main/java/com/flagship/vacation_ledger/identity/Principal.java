package com.flagship.vacation_ledger.identity;

import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.exception.AuthorizationException;
import lombok.Value;

/**
 * Authenticated caller of a workflow operation.
 *
 * Supplied by the identity layer and trusted as-is; the workflow only checks
 * role and ownership against it.
 */
@Value
public class Principal {
    Long accountId;
    AccountRole role;

    public static Principal of(Long accountId, AccountRole role) {
        return new Principal(accountId, role);
    }

    public boolean isManager() {
        return role == AccountRole.MANAGER;
    }

    public boolean owns(Long ownerAccountId) {
        return accountId != null && accountId.equals(ownerAccountId);
    }

    public void requireRole(AccountRole required, String operation) {
        if (role != required) {
            throw new AuthorizationException(
                String.format("Only %s accounts may %s", required.toValue(), operation));
        }
    }

    public void requireManagerOrSelf(Long targetAccountId) {
        if (!isManager() && !owns(targetAccountId)) {
            throw new AuthorizationException("Access denied to account " + targetAccountId);
        }
    }
}
