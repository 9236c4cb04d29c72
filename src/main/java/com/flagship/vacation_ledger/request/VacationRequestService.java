package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.account.Account;
import com.flagship.vacation_ledger.account.AccountEntity;
import com.flagship.vacation_ledger.account.AccountRepository;
import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.analytics.AnalyticsCache;
import com.flagship.vacation_ledger.exception.AuthorizationException;
import com.flagship.vacation_ledger.exception.NotFoundException;
import com.flagship.vacation_ledger.exception.ValidationException;
import com.flagship.vacation_ledger.exception.WorkflowException;
import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.ledger.BalanceLedgerService;
import com.flagship.vacation_ledger.observability.CorrelationContext;
import com.flagship.vacation_ledger.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Vacation request workflow.
 *
 * Enforces, before anything is written:
 * - role and ownership of the caller
 * - the state machine ({@link RequestStatus#apply(RequestAction)})
 * - date range validity, non-overlap and remaining balance ({@link EligibilityChecker})
 *
 * Every check-then-write runs in one transaction that starts by locking the
 * owning account row, so writers for the same account are serialized. An
 * existing request is only read after that lock is held. Approval moves the
 * request and the account's used-days counter in that same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VacationRequestService {

    private final AccountRepository accountRepository;
    private final VacationRequestPersistenceService persistenceService;
    private final VacationRequestSearchRepository searchRepository;
    private final EligibilityChecker eligibilityChecker;
    private final BalanceLedgerService ledgerService;
    private final AnalyticsCache analyticsCache;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    /**
     * Submits a new request for the calling employee.
     *
     * @throws AuthorizationException if the caller is not an employee
     * @throws ValidationException    for a reversed range, an overlap or an insufficient balance
     */
    @Transactional
    public VacationRequest create(Principal principal, LocalDate startDate, LocalDate endDate, String reason) {
        return measured("create", () -> {
            principal.requireRole(AccountRole.EMPLOYEE, "submit vacation requests");
            DateRange range = DateRange.of(startDate, endDate);

            Account account = lockAccount(principal.getAccountId());
            eligibilityChecker.requireEligible(account, range, null);

            VacationRequest created = persistenceService.insert(
                VacationRequest.submit(account.getId(), range, normalize(reason), clock.instant()));

            MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, created.getId().toString());
            log.info("Vacation request submitted: range={}, days={}", range, range.getDurationDays());
            metrics.recordCreated();
            analyticsCache.invalidate();
            return created;
        });
    }

    /**
     * Changes dates and/or reason of the caller's own pending request. Null
     * arguments keep the current value. The merged range is checked again,
     * ignoring the request itself.
     *
     * @throws NotFoundException      if the request does not exist
     * @throws AuthorizationException if the caller does not own it
     * @throws com.flagship.vacation_ledger.exception.ConflictException if it is no longer pending
     * @throws ValidationException    if the merged range is not admissible
     */
    @Transactional
    public VacationRequest edit(Principal principal, Long requestId,
                                LocalDate startDate, LocalDate endDate, String reason) {
        return measured("edit", () -> {
            Long ownerId = loadOwnerId(requestId);
            if (!principal.owns(ownerId)) {
                throw new AuthorizationException("Only the owner may modify request " + requestId);
            }

            Account account = lockAccount(ownerId);
            VacationRequest existing = loadRequestForUpdate(requestId);

            DateRange merged = DateRange.of(
                startDate != null ? startDate : existing.getRange().getStart(),
                endDate != null ? endDate : existing.getRange().getEnd());
            String mergedReason = reason != null ? normalize(reason) : existing.getReason();

            VacationRequest updated = existing.reschedule(merged, mergedReason, clock.instant());
            eligibilityChecker.requireEligible(account, merged, existing.getId());
            persistenceService.updateSchedule(updated);

            log.info("Vacation request modified: {} -> {}", existing.getRange(), merged);
            analyticsCache.invalidate();
            return updated;
        });
    }

    /**
     * Approves a pending request and adds its duration to the owner's used days.
     *
     * The balance is not re-checked here; the {@code valid_vacation_days}
     * constraint turns an overdraw into a ConflictException and rolls back.
     */
    @Transactional
    public VacationRequest approve(Principal principal, Long requestId, String notes) {
        return measured("approve", () -> {
            principal.requireRole(AccountRole.MANAGER, "approve vacation requests");
            lockAccount(loadOwnerId(requestId));
            VacationRequest existing = loadRequestForUpdate(requestId);

            VacationRequest approved = existing.approve(principal.getAccountId(), normalize(notes), clock.instant());
            persistenceService.updateDecision(approved);
            ledgerService.applyApproval(approved.getAccountId(), approved.getDurationDays());

            log.info("Vacation request approved: days={}, manager={}",
                approved.getDurationDays(), principal.getAccountId());
            metrics.recordDecision(approved.getStatus().toValue());
            metrics.recordDaysApplied(approved.getDurationDays());
            analyticsCache.invalidate();
            return approved;
        });
    }

    @Transactional
    public VacationRequest reject(Principal principal, Long requestId, String notes) {
        return measured("reject", () -> {
            principal.requireRole(AccountRole.MANAGER, "reject vacation requests");
            lockAccount(loadOwnerId(requestId));
            VacationRequest existing = loadRequestForUpdate(requestId);

            VacationRequest rejected = existing.reject(principal.getAccountId(), normalize(notes), clock.instant());
            persistenceService.updateDecision(rejected);

            log.info("Vacation request rejected: manager={}", principal.getAccountId());
            metrics.recordDecision(rejected.getStatus().toValue());
            analyticsCache.invalidate();
            return rejected;
        });
    }

    /**
     * Removes a pending request. Allowed for its owner and for managers.
     */
    @Transactional
    public void delete(Principal principal, Long requestId) {
        measured("delete", () -> {
            Long ownerId = loadOwnerId(requestId);
            if (!principal.isManager() && !principal.owns(ownerId)) {
                throw new AuthorizationException("Access denied to request " + requestId);
            }
            lockAccount(ownerId);
            VacationRequest existing = loadRequestForUpdate(requestId);
            existing.requireDeletable();
            persistenceService.deletePending(requestId);

            log.info("Vacation request deleted by {}", principal.getAccountId());
            metrics.recordDeleted();
            analyticsCache.invalidate();
            return null;
        });
    }

    @Transactional(readOnly = true)
    public VacationRequestView get(Principal principal, Long requestId) {
        VacationRequestView view = searchRepository.findById(requestId)
            .orElseThrow(() -> NotFoundException.request(requestId));
        if (!principal.isManager() && !view.getRequest().isOwnedBy(principal.getAccountId())) {
            throw new AuthorizationException("Access denied to request " + requestId);
        }
        return view;
    }

    /**
     * Lists requests visible to the caller. Employees only ever see their own,
     * whatever account filter they pass.
     */
    @Transactional(readOnly = true)
    public List<VacationRequestView> list(Principal principal, RequestFilter filter) {
        RequestFilter effective = filter != null ? filter : RequestFilter.none();
        if (!principal.isManager()) {
            effective = effective.scopedTo(principal.getAccountId());
        }
        if (effective.getFrom() != null && effective.getTo() != null && effective.getTo().isBefore(effective.getFrom())) {
            throw new ValidationException(ValidationException.Reason.INVALID_DATE_RANGE,
                "'to' must not be before 'from'");
        }
        return searchRepository.findByFilter(effective);
    }

    private Long loadOwnerId(Long requestId) {
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, String.valueOf(requestId));
        return persistenceService.findOwnerId(requestId)
            .orElseThrow(() -> NotFoundException.request(requestId));
    }

    // Deleted while we waited for the account lock: same answer as never found.
    private VacationRequest loadRequestForUpdate(Long requestId) {
        return persistenceService.findForUpdate(requestId)
            .orElseThrow(() -> NotFoundException.request(requestId));
    }

    private Account lockAccount(Long accountId) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));
        return accountRepository.findByIdForUpdate(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.account(accountId));
    }

    private <T> T measured(String operation, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        try {
            return body.get();
        } catch (WorkflowException e) {
            metrics.recordRefused(operation, refusalReason(e));
            log.warn("Vacation request {} refused: kind={}, message={}", operation, e.getKind(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private static String refusalReason(WorkflowException e) {
        if (e instanceof ValidationException validation) {
            return validation.getReason().name().toLowerCase(Locale.ROOT);
        }
        return e.getKind().name().toLowerCase(Locale.ROOT);
    }

    private static String normalize(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
