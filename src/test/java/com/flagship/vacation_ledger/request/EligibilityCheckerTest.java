package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.account.Account;
import com.flagship.vacation_ledger.account.AccountRole;
import com.flagship.vacation_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityCheckerTest {

    @Mock
    private VacationRequestPersistenceService persistenceService;

    private EligibilityChecker checker;

    @BeforeEach
    void setUp() {
        checker = new EligibilityChecker(persistenceService);
    }

    private static Account employee(int total, int used) {
        return new Account(5L, "Ana", "ana@company.test", "2000001", AccountRole.EMPLOYEE,
            total, used, Instant.EPOCH, Instant.EPOCH);
    }

    private static DateRange days(int count) {
        LocalDate start = LocalDate.of(2025, 6, 2);
        return DateRange.of(start, start.plusDays(count - 1L));
    }

    @Test
    @DisplayName("Exactly the remaining balance is admissible")
    void exactRemainingBalanceAdmitted() {
        assertTrue(checker.checkBalance(employee(20, 15), 5));
    }

    @Test
    @DisplayName("One day more than the remaining balance is refused")
    void oneDayOverRefused() {
        assertFalse(checker.checkBalance(employee(20, 15), 6));
    }

    @Test
    @DisplayName("Overlap check is the negation of an existing overlap")
    void overlapDelegatesToRepository() {
        DateRange range = days(3);
        when(persistenceService.hasOverlap(5L, range, null)).thenReturn(true);

        assertFalse(checker.checkOverlap(5L, range, null));
    }

    @Test
    @DisplayName("Overlap is reported before balance")
    void overlapWinsOverBalance() {
        DateRange range = days(30);
        when(persistenceService.hasOverlap(eq(5L), eq(range), isNull())).thenReturn(true);

        ValidationException e = assertThrows(ValidationException.class,
            () -> checker.requireEligible(employee(20, 0), range, null));

        assertEquals(ValidationException.Reason.OVERLAP, e.getReason());
    }

    @Test
    @DisplayName("Insufficient balance carries its own reason")
    void insufficientBalanceReason() {
        DateRange range = days(6);
        when(persistenceService.hasOverlap(any(), any(), any())).thenReturn(false);

        ValidationException e = assertThrows(ValidationException.class,
            () -> checker.requireEligible(employee(20, 15), range, null));

        assertEquals(ValidationException.Reason.INSUFFICIENT_BALANCE, e.getReason());
    }

    @Test
    @DisplayName("The request being edited is excluded from the overlap check")
    void editExcludesItself() {
        DateRange range = days(2);
        when(persistenceService.hasOverlap(5L, range, 99L)).thenReturn(false);

        checker.requireEligible(employee(20, 0), range, 99L);

        verify(persistenceService).hasOverlap(5L, range, 99L);
        verify(persistenceService, never()).hasOverlap(5L, range, null);
    }
}
