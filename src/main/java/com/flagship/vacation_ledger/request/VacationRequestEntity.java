package com.flagship.vacation_ledger.request;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for vacation requests.
 *
 * No setters: state changes after creation go through the conditional update
 * queries in {@link VacationRequestRepository}, which only match rows that are
 * still PENDING.
 */
@Entity
@Table(
    name = "vacation_requests",
    indexes = {
        @Index(name = "idx_vacation_requests_account_id", columnList = "account_id"),
        @Index(name = "idx_vacation_requests_status", columnList = "status"),
        @Index(name = "idx_vacation_requests_dates", columnList = "start_date, end_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VacationRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(length = 1000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RequestStatus status;

    @Column(name = "decided_by")
    private Long decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "manager_notes", length = 1000)
    private String managerNotes;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.submittedAt == null) {
            this.submittedAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.submittedAt;
        }
    }

    /**
     * Controlled factory for new PENDING requests.
     */
    static VacationRequestEntity fromDomain(VacationRequest request) {
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new IllegalArgumentException("New requests must be PENDING, got " + request.getStatus());
        }
        return new VacationRequestEntity(
            null,
            request.getAccountId(),
            request.getRange().getStart(),
            request.getRange().getEnd(),
            request.getReason(),
            RequestStatus.PENDING,
            null,
            null,
            null,
            request.getSubmittedAt(),
            request.getUpdatedAt()
        );
    }

    public VacationRequest toDomain() {
        return new VacationRequest(
            id,
            accountId,
            DateRange.of(startDate, endDate),
            reason,
            status,
            decidedBy,
            decidedAt,
            managerNotes,
            submittedAt,
            updatedAt
        );
    }
}
