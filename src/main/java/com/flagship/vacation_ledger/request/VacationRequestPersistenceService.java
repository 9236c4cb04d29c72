package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Bridges the {@link VacationRequest} domain object and {@link VacationRequestEntity}.
 *
 * Transitions of an existing request are written as conditional updates that
 * only match a PENDING row. A zero-row result means another transaction got
 * there first and is reported as a {@link ConflictException}.
 *
 * Writes join the caller's transaction; they are never meant to run on their own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VacationRequestPersistenceService {

    static final Set<RequestStatus> CALENDAR_BLOCKING = calendarBlocking();

    private final VacationRequestRepository repository;

    @Transactional(propagation = Propagation.MANDATORY)
    public VacationRequest insert(VacationRequest request) {
        VacationRequestEntity saved = repository.saveAndFlush(VacationRequestEntity.fromDomain(request));
        log.debug("Inserted vacation request {} for account {}", saved.getId(), saved.getAccountId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Long> findOwnerId(Long id) {
        return repository.findAccountIdById(id);
    }

    /**
     * Reads the current row under a write lock. Callers lock the owning
     * account first, so the row seen here already reflects any edit that
     * committed while they waited.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<VacationRequest> findForUpdate(Long id) {
        return repository.findByIdForUpdate(id).map(VacationRequestEntity::toDomain);
    }

    /**
     * Whether the account already holds a PENDING or APPROVED request whose
     * dates intersect {@code range}.
     *
     * @param excludeRequestId request to leave out of the check, or null
     */
    @Transactional(readOnly = true)
    public boolean hasOverlap(Long accountId, DateRange range, Long excludeRequestId) {
        if (excludeRequestId == null) {
            return repository.existsOverlapping(
                accountId, range.getStart(), range.getEnd(), CALENDAR_BLOCKING);
        }
        return repository.existsOverlappingExcluding(
            accountId, range.getStart(), range.getEnd(), CALENDAR_BLOCKING, excludeRequestId);
    }

    /**
     * Writes new dates and reason; {@code updated} must still be PENDING.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void updateSchedule(VacationRequest updated) {
        int rows = repository.updateSchedule(
            updated.getId(),
            RequestStatus.PENDING,
            updated.getRange().getStart(),
            updated.getRange().getEnd(),
            updated.getReason(),
            updated.getUpdatedAt()
        );
        requireSingleRow(rows, updated.getId(), RequestAction.EDIT);
    }

    /**
     * Writes an approval or rejection; the stored row must still be PENDING.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void updateDecision(VacationRequest decided) {
        if (decided.getStatus() == RequestStatus.PENDING) {
            throw new IllegalArgumentException("A decision must leave PENDING");
        }
        int rows = repository.updateDecision(
            decided.getId(),
            RequestStatus.PENDING,
            decided.getStatus(),
            decided.getDecidedBy(),
            decided.getDecidedAt(),
            decided.getManagerNotes()
        );
        RequestAction action = decided.getStatus() == RequestStatus.APPROVED
            ? RequestAction.APPROVE
            : RequestAction.REJECT;
        requireSingleRow(rows, decided.getId(), action);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void deletePending(Long id) {
        int rows = repository.deleteInStatus(id, RequestStatus.PENDING);
        requireSingleRow(rows, id, RequestAction.DELETE);
    }

    private static Set<RequestStatus> calendarBlocking() {
        Set<RequestStatus> statuses = EnumSet.noneOf(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            if (status.blocksCalendar()) {
                statuses.add(status);
            }
        }
        return statuses;
    }

    private void requireSingleRow(int rows, Long id, RequestAction action) {
        if (rows == 0) {
            log.warn("Conditional write matched no pending row: requestId={}, action={}", id, action);
            throw new ConflictException(String.format(
                "Request %d is no longer pending and cannot be %s", id, action.getPastTense()));
        }
        log.debug("Request {} {}", id, action.getPastTense());
    }
}
