package com.flagship.vacation_ledger.identity;

import com.flagship.vacation_ledger.account.AccountEntity;
import com.flagship.vacation_ledger.account.AccountRepository;
import com.flagship.vacation_ledger.exception.AuthorizationException;
import com.flagship.vacation_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the account id supplied by the identity layer into a {@link Principal}.
 *
 * The role is read from the stored account rather than from the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrincipalResolver {

    public static final String ACCOUNT_ID_HEADER = "X-Account-Id";

    private final AccountRepository accountRepository;

    @Transactional(readOnly = true)
    public Principal resolve(Long accountId) {
        if (accountId == null) {
            throw new AuthorizationException("Authentication required");
        }
        AccountEntity account = accountRepository.findById(accountId)
            .orElseThrow(() -> {
                log.warn("Unknown principal account: {}", accountId);
                return new AuthorizationException("Unknown account " + accountId);
            });

        MDC.put(CorrelationContext.PRINCIPAL_ID_MDC_KEY, accountId.toString());
        return Principal.of(account.getId(), account.getRole());
    }
}
