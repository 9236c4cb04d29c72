package com.flagship.vacation_ledger.request;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository for vacation requests.
 *
 * Every mutation of an existing request is a conditional write: it names the
 * status the row must still have, and reports how many rows matched.
 */
@Repository
public interface VacationRequestRepository extends JpaRepository<VacationRequestEntity, Long> {

    /**
     * Owner of a request, read as a scalar so no entity lands in the
     * persistence context before the owner's account row is locked.
     */
    @Query("SELECT r.accountId FROM VacationRequestEntity r WHERE r.id = :id")
    Optional<Long> findAccountIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM VacationRequestEntity r WHERE r.id = :id")
    Optional<VacationRequestEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * Inclusive overlap test: {@code [s1,e1]} and {@code [s2,e2]} overlap iff
     * {@code s1 <= e2 AND s2 <= e1}.
     */
    @Query("""
        SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
        FROM VacationRequestEntity r
        WHERE r.accountId = :accountId
          AND r.status IN :statuses
          AND r.startDate <= :endDate
          AND r.endDate >= :startDate
        """)
    boolean existsOverlapping(@Param("accountId") Long accountId,
                              @Param("startDate") LocalDate startDate,
                              @Param("endDate") LocalDate endDate,
                              @Param("statuses") Collection<RequestStatus> statuses);

    /**
     * Same as {@link #existsOverlapping} but ignores one request (the one being edited).
     */
    @Query("""
        SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
        FROM VacationRequestEntity r
        WHERE r.accountId = :accountId
          AND r.status IN :statuses
          AND r.startDate <= :endDate
          AND r.endDate >= :startDate
          AND r.id <> :excludeId
        """)
    boolean existsOverlappingExcluding(@Param("accountId") Long accountId,
                                       @Param("startDate") LocalDate startDate,
                                       @Param("endDate") LocalDate endDate,
                                       @Param("statuses") Collection<RequestStatus> statuses,
                                       @Param("excludeId") Long excludeId);

    /**
     * Moves a request out of {@code expected} and records the decision.
     *
     * @return 1 if the row was still in {@code expected}, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE VacationRequestEntity r
        SET r.status = :newStatus,
            r.decidedBy = :decidedBy,
            r.decidedAt = :decidedAt,
            r.managerNotes = :managerNotes,
            r.updatedAt = :decidedAt
        WHERE r.id = :id AND r.status = :expected
        """)
    int updateDecision(@Param("id") Long id,
                       @Param("expected") RequestStatus expected,
                       @Param("newStatus") RequestStatus newStatus,
                       @Param("decidedBy") Long decidedBy,
                       @Param("decidedAt") Instant decidedAt,
                       @Param("managerNotes") String managerNotes);

    /**
     * Replaces dates and reason of a request that is still in {@code expected}.
     *
     * @return 1 if the row was updated, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE VacationRequestEntity r
        SET r.startDate = :startDate,
            r.endDate = :endDate,
            r.reason = :reason,
            r.updatedAt = :updatedAt
        WHERE r.id = :id AND r.status = :expected
        """)
    int updateSchedule(@Param("id") Long id,
                       @Param("expected") RequestStatus expected,
                       @Param("startDate") LocalDate startDate,
                       @Param("endDate") LocalDate endDate,
                       @Param("reason") String reason,
                       @Param("updatedAt") Instant updatedAt);

    /**
     * @return 1 if a row in {@code expected} was deleted, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM VacationRequestEntity r WHERE r.id = :id AND r.status = :expected")
    int deleteInStatus(@Param("id") Long id, @Param("expected") RequestStatus expected);
}
