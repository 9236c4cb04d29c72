package com.flagship.vacation_ledger.account;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for accounts.
 *
 * No setters: the role and employee code never change after creation, and
 * {@code vacationDaysUsed} is read-only here because only
 * {@link com.flagship.vacation_ledger.ledger.BalanceLedgerService} writes it.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "employee_code", nullable = false, unique = true, updatable = false, length = 7)
    private String employeeCode;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private AccountRole role;

    @Column(name = "vacation_days_total", nullable = false)
    private int vacationDaysTotal;

    @Column(name = "vacation_days_used", nullable = false, insertable = false, updatable = false)
    private int vacationDaysUsed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity create(String name, String email, String employeeCode, String passwordHash,
                                AccountRole role, int vacationDaysTotal) {
        return new AccountEntity(
            null,
            name,
            email,
            employeeCode,
            passwordHash,
            role,
            vacationDaysTotal,
            0,
            null, // set by @PrePersist
            null
        );
    }

    /**
     * Applies a profile change. Null arguments leave the field untouched.
     */
    void updateProfile(String name, String email, String passwordHash) {
        if (name != null) {
            this.name = name;
        }
        if (email != null) {
            this.email = email;
        }
        if (passwordHash != null) {
            this.passwordHash = passwordHash;
        }
    }

    public Account toDomain() {
        return new Account(
            id,
            name,
            email,
            employeeCode,
            role,
            vacationDaysTotal,
            vacationDaysUsed,
            createdAt,
            updatedAt
        );
    }
}
