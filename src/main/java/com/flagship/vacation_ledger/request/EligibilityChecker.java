package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.account.Account;
import com.flagship.vacation_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a date range may be requested by an account.
 *
 * Both checks are reads. Callers run them inside the transaction that holds
 * the account row lock, so the answer stays true until their write commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EligibilityChecker {

    private final VacationRequestPersistenceService persistenceService;

    /**
     * @param excludeRequestId the request being edited, or null on create
     * @return true when the range intersects no PENDING or APPROVED request of the account
     */
    public boolean checkOverlap(Long accountId, DateRange range, Long excludeRequestId) {
        return !persistenceService.hasOverlap(accountId, range, excludeRequestId);
    }

    /**
     * @return true when {@code daysNeeded} fits in the account's remaining days
     */
    public boolean checkBalance(Account account, int daysNeeded) {
        return daysNeeded <= account.getRemainingDays();
    }

    /**
     * Runs the overlap check, then the balance check.
     *
     * @throws ValidationException with reason OVERLAP or INSUFFICIENT_BALANCE
     */
    public void requireEligible(Account account, DateRange range, Long excludeRequestId) {
        if (!checkOverlap(account.getId(), range, excludeRequestId)) {
            log.info("Range {} overlaps an existing request of account {}", range, account.getId());
            throw new ValidationException(ValidationException.Reason.OVERLAP,
                "The requested dates overlap an existing pending or approved request");
        }
        int daysNeeded = range.getDurationDays();
        if (!checkBalance(account, daysNeeded)) {
            log.info("Account {} has {} days left, {} requested",
                account.getId(), account.getRemainingDays(), daysNeeded);
            throw new ValidationException(ValidationException.Reason.INSUFFICIENT_BALANCE,
                String.format("Insufficient vacation days: %d requested, %d remaining",
                    daysNeeded, account.getRemainingDays()));
        }
    }
}
