package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.exception.ConflictException;
import com.flagship.vacation_ledger.exception.ValidationException;
import com.flagship.vacation_ledger.identity.Principal;
import com.flagship.vacation_ledger.ledger.BalanceLedgerService;
import com.flagship.vacation_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.sql.Timestamp;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end workflow against PostgreSQL: requests move through their states
 * and the used-days counter follows approvals exactly.
 */
class VacationWorkflowIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    private VacationRequestService requestService;

    @Autowired
    private BalanceLedgerService ledgerService;

    private Long employeeId;
    private Principal employee;
    private Principal manager;

    @BeforeEach
    void setUp() {
        employeeId = insertEmployee("Ana Employee", 20);
        employee = Principal.of(employeeId, AccountRole.EMPLOYEE);
        manager = Principal.of(insertManager("Mia Manager"), AccountRole.MANAGER);
    }

    private static LocalDate date(String iso) {
        return LocalDate.parse(iso);
    }

    @Test
    @DisplayName("Approval consumes balance; overlapping and oversized requests are refused")
    void approvalThenOverlapThenInsufficientBalance() {
        printTestHeader("Approve, then overlap, then insufficient balance");

        VacationRequest created = requestService.create(employee, date("2025-01-10"), date("2025-01-14"), "Ski trip");
        printInput("Created request", created);
        assertEquals(RequestStatus.PENDING, created.getStatus());
        assertEquals(5, created.getDurationDays());
        assertEquals(0, usedDays(employeeId), "Pending requests do not consume balance");

        VacationRequest approved = requestService.approve(manager, created.getId(), "Enjoy");
        printOutput("Approved request", approved);
        assertEquals(RequestStatus.APPROVED, approved.getStatus());
        assertEquals(manager.getAccountId(), approved.getDecidedBy());
        assertNotNull(approved.getDecidedAt());
        assertEquals(5, usedDays(employeeId));

        ValidationException overlap = assertThrows(ValidationException.class,
            () -> requestService.create(employee, date("2025-01-12"), date("2025-01-13"), null));
        printExpectedException("ValidationException", overlap.getMessage());
        assertEquals(ValidationException.Reason.OVERLAP, overlap.getReason());

        ValidationException balance = assertThrows(ValidationException.class,
            () -> requestService.create(employee, date("2025-02-01"), date("2025-02-20"), null));
        printExpectedException("ValidationException", balance.getMessage());
        assertEquals(ValidationException.Reason.INSUFFICIENT_BALANCE, balance.getReason());

        assertEquals(5, usedDays(employeeId));
        assertEquals(approvedDaysSum(employeeId), usedDays(employeeId));
        printSuccess("Balance moved only on approval");
    }

    @Test
    @DisplayName("Edit keeps the request id; rejection leaves the balance alone")
    void editThenReject() {
        printTestHeader("Edit then reject");

        Long approvedId = requestService.create(employee, date("2025-01-10"), date("2025-01-14"), null).getId();
        requestService.approve(manager, approvedId, null);

        VacationRequest created = requestService.create(employee, date("2025-03-01"), date("2025-03-05"), "Family");
        VacationRequest edited = requestService.edit(employee, created.getId(), null, date("2025-03-10"), null);
        printOutput("Edited request", edited);

        assertEquals(created.getId(), edited.getId());
        assertEquals(10, edited.getDurationDays());
        assertEquals("Family", edited.getReason());

        VacationRequest rejected = requestService.reject(manager, created.getId(), "Release week");
        assertEquals(RequestStatus.REJECTED, rejected.getStatus());
        assertEquals("REJECTED", statusOf(created.getId()));
        assertNotNull(jdbcTemplate.queryForObject(
            "SELECT decided_at FROM vacation_requests WHERE id = ?", Timestamp.class, created.getId()));
        assertEquals(5, usedDays(employeeId));
        printSuccess("Rejected request did not touch the balance");
    }

    @Test
    @DisplayName("A request can be decided only once")
    void doubleDecisionConflicts() {
        printTestHeader("Double decision");

        Long requestId = requestService.create(employee, date("2025-04-07"), date("2025-04-09"), null).getId();
        requestService.approve(manager, requestId, null);

        assertThrows(ConflictException.class, () -> requestService.approve(manager, requestId, null));
        assertThrows(ConflictException.class, () -> requestService.reject(manager, requestId, null));
        assertThrows(ConflictException.class,
            () -> requestService.edit(employee, requestId, null, date("2025-04-10"), null));

        assertEquals(3, usedDays(employeeId), "Second approval must not apply days twice");
        printSuccess("Terminal states are frozen");
    }

    @Test
    @DisplayName("A request for exactly the remaining balance is accepted, one day more is not")
    void boundaryBalance() {
        printTestHeader("Boundary balance");

        Long smallId = insertEmployee("Small Balance", 3);
        Principal small = Principal.of(smallId, AccountRole.EMPLOYEE);

        ValidationException tooLong = assertThrows(ValidationException.class,
            () -> requestService.create(small, date("2025-05-05"), date("2025-05-08"), null));
        assertEquals(ValidationException.Reason.INSUFFICIENT_BALANCE, tooLong.getReason());

        VacationRequest exact = requestService.create(small, date("2025-05-05"), date("2025-05-07"), null);
        requestService.approve(manager, exact.getId(), null);

        assertEquals(3, usedDays(smallId));
        ValidationException exhausted = assertThrows(ValidationException.class,
            () -> requestService.create(small, date("2025-06-02"), date("2025-06-02"), null));
        assertEquals(ValidationException.Reason.INSUFFICIENT_BALANCE, exhausted.getReason());
        printSuccess("Remaining balance is an inclusive bound");
    }

    @Test
    @DisplayName("Rejected requests no longer block the calendar")
    void rejectedRangeCanBeRequestedAgain() {
        Long requestId = requestService.create(employee, date("2025-07-14"), date("2025-07-18"), null).getId();
        requestService.reject(manager, requestId, null);

        VacationRequest again = requestService.create(employee, date("2025-07-14"), date("2025-07-18"), null);

        assertNotEquals(requestId, again.getId());
        assertEquals(RequestStatus.PENDING, again.getStatus());
    }

    @Test
    @DisplayName("Pending requests can be deleted, decided ones cannot")
    void deletePendingOnly() {
        printTestHeader("Delete pending only");

        Long pendingId = requestService.create(employee, date("2025-08-04"), date("2025-08-06"), null).getId();
        Long approvedId = requestService.create(employee, date("2025-09-01"), date("2025-09-02"), null).getId();
        requestService.approve(manager, approvedId, null);

        requestService.delete(employee, pendingId);
        Integer remaining = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vacation_requests WHERE id = ?", Integer.class, pendingId);
        assertEquals(0, remaining);

        assertThrows(ConflictException.class, () -> requestService.delete(manager, approvedId));
        assertEquals("APPROVED", statusOf(approvedId));
        assertEquals(2, usedDays(employeeId));
        printSuccess("Only pending requests were removable");
    }

    @Test
    @DisplayName("Counter stays equal to the sum of approved durations")
    void noDriftAfterWorkflow() {
        requestService.approve(manager,
            requestService.create(employee, date("2025-01-06"), date("2025-01-07"), null).getId(), null);
        requestService.approve(manager,
            requestService.create(employee, date("2025-02-03"), date("2025-02-07"), null).getId(), null);
        requestService.reject(manager,
            requestService.create(employee, date("2025-03-03"), date("2025-03-03"), null).getId(), null);

        assertEquals(7, usedDays(employeeId));
        assertEquals(7, approvedDaysSum(employeeId));
        assertNull(ledgerService.recompute(employeeId), "No correction expected");
    }
}
