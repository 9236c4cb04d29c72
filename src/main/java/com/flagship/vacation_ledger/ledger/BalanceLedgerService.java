package com.flagship.vacation_ledger.ledger;

import com.flagship.vacation_ledger.exception.ConflictException;
import com.flagship.vacation_ledger.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Owns the consumed-days counter of every account.
 *
 * Invariants:
 * 1. {@code vacation_days_used} equals the summed duration of the account's APPROVED requests
 * 2. The counter only grows during request processing; nothing decrements it
 * 3. {@code 0 <= used <= total} is enforced by the {@code valid_vacation_days} CHECK constraint
 *
 * Plain JDBC: the increment is a single atomic UPDATE, not a read-modify-write.
 */
@Service
@Slf4j
public class BalanceLedgerService {

    private static final String APPROVED_DAYS_SUBQUERY =
        "SELECT COALESCE(SUM(r.end_date - r.start_date + 1), 0) " +
        "FROM vacation_requests r WHERE r.account_id = a.id AND r.status = 'APPROVED'";

    private final JdbcTemplate jdbcTemplate;

    public BalanceLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Adds the days of a newly approved request to the account's counter.
     *
     * Must run in the transaction that moved the request to APPROVED, so both
     * commit or neither does.
     *
     * @throws ConflictException if the counter would exceed the entitlement
     * @throws NotFoundException if the account no longer exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyApproval(Long accountId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Approved duration must be positive, got " + days);
        }

        int rows;
        try {
            rows = jdbcTemplate.update(
                "UPDATE accounts SET vacation_days_used = vacation_days_used + ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ?",
                days,
                accountId
            );
        } catch (DataIntegrityViolationException e) {
            log.warn("Approval of {} days would overdraw account {}", days, accountId);
            throw new ConflictException(
                "Approving this request would exceed the account's vacation entitlement", e);
        }

        if (rows == 0) {
            throw NotFoundException.account(accountId);
        }
        log.info("Applied {} approved days to account {}", days, accountId);
    }

    /**
     * Repair tool: resets the counter of one account to the sum of its APPROVED
     * durations. Never called while processing requests.
     *
     * @return the correction applied, or null when the counter was already right
     * @throws ConflictException if the approved days exceed the entitlement
     */
    @Transactional
    public BalanceCorrection recompute(Long accountId) {
        List<BalanceCorrection> drift = jdbcTemplate.query(
            "SELECT a.id, a.vacation_days_used, (" + APPROVED_DAYS_SUBQUERY + ") AS approved_days " +
            "FROM accounts a WHERE a.id = ? FOR UPDATE",
            (rs, rowNum) -> new BalanceCorrection(
                rs.getLong("id"), rs.getInt("vacation_days_used"), rs.getInt("approved_days")),
            accountId
        );
        if (drift.isEmpty()) {
            throw NotFoundException.account(accountId);
        }
        BalanceCorrection correction = drift.get(0);
        if (!correction.isDrifted()) {
            return null;
        }
        writeCorrection(correction);
        return correction;
    }

    /**
     * Repair tool: recomputes every account whose counter disagrees with its
     * APPROVED requests.
     */
    @Transactional
    public ReconciliationResult reconcileAll() {
        // Row locks keep approvals out until the corrections commit.
        List<BalanceCorrection> snapshots = jdbcTemplate.query(
            "SELECT a.id, a.vacation_days_used, (" + APPROVED_DAYS_SUBQUERY + ") AS approved_days " +
            "FROM accounts a ORDER BY a.id FOR UPDATE",
            (rs, rowNum) -> new BalanceCorrection(
                rs.getLong("id"), rs.getInt("vacation_days_used"), rs.getInt("approved_days"))
        );
        int checked = snapshots.size();
        List<BalanceCorrection> drifted = snapshots.stream()
            .filter(BalanceCorrection::isDrifted)
            .toList();

        drifted.forEach(this::writeCorrection);

        if (drifted.isEmpty()) {
            log.info("Ledger reconciliation found no drift across {} accounts", checked);
        } else {
            log.warn("Ledger reconciliation corrected {} of {} accounts", drifted.size(), checked);
        }
        return new ReconciliationResult(checked, drifted);
    }

    private void writeCorrection(BalanceCorrection correction) {
        try {
            jdbcTemplate.update(
                "UPDATE accounts SET vacation_days_used = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                correction.getRecomputedDays(),
                correction.getAccountId()
            );
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(String.format(
                "Account %d has %d approved days, more than its entitlement",
                correction.getAccountId(), correction.getRecomputedDays()), e);
        }
        log.warn("Corrected vacation_days_used of account {}: {} -> {}",
            correction.getAccountId(), correction.getPreviousDays(), correction.getRecomputedDays());
    }
}
