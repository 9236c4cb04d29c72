package com.flagship.vacation_ledger.request;

import lombok.Value;

import java.time.Instant;

/**
 * Vacation request domain object.
 *
 * Key principles:
 * - Status transitions go through {@link RequestStatus#apply(RequestAction)}
 * - Decision metadata is only ever set when leaving PENDING
 * - State changes are immutable (each transition returns a new instance)
 */
@Value
public class VacationRequest {
    Long id;
    Long accountId;
    DateRange range;
    String reason;
    RequestStatus status;
    Long decidedBy;
    Instant decidedAt;
    String managerNotes;
    Instant submittedAt;
    Instant updatedAt;

    /**
     * Creates a new, not yet persisted request in PENDING status.
     */
    public static VacationRequest submit(Long accountId, DateRange range, String reason, Instant submittedAt) {
        return new VacationRequest(
            null,
            accountId,
            range,
            reason,
            RequestStatus.PENDING,
            null,
            null,
            null,
            submittedAt,
            submittedAt
        );
    }

    public int getDurationDays() {
        return range.getDurationDays();
    }

    /**
     * Returns the request with new dates and reason. Only valid while PENDING.
     *
     * @throws com.flagship.vacation_ledger.exception.ConflictException if not pending
     */
    public VacationRequest reschedule(DateRange newRange, String newReason, Instant editTime) {
        RequestStatus next = status.apply(RequestAction.EDIT);
        return new VacationRequest(
            id,
            accountId,
            newRange,
            newReason,
            next,
            decidedBy,
            decidedAt,
            managerNotes,
            submittedAt,
            editTime
        );
    }

    /**
     * Transitions to APPROVED, recording the deciding manager.
     *
     * @throws com.flagship.vacation_ledger.exception.ConflictException if not pending
     */
    public VacationRequest approve(Long managerId, String notes, Instant decisionTime) {
        return decide(RequestAction.APPROVE, managerId, notes, decisionTime);
    }

    /**
     * Transitions to REJECTED, recording the deciding manager.
     *
     * @throws com.flagship.vacation_ledger.exception.ConflictException if not pending
     */
    public VacationRequest reject(Long managerId, String notes, Instant decisionTime) {
        return decide(RequestAction.REJECT, managerId, notes, decisionTime);
    }

    /**
     * @throws com.flagship.vacation_ledger.exception.ConflictException if not pending
     */
    public void requireDeletable() {
        status.apply(RequestAction.DELETE);
    }

    public boolean isOwnedBy(Long candidateAccountId) {
        return accountId != null && accountId.equals(candidateAccountId);
    }

    private VacationRequest decide(RequestAction action, Long managerId, String notes, Instant decisionTime) {
        RequestStatus next = status.apply(action);
        return new VacationRequest(
            id,
            accountId,
            range,
            reason,
            next,
            managerId,
            decisionTime,
            notes,
            submittedAt,
            decisionTime
        );
    }
}
