package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.exception.ConflictException;
import com.flagship.vacation_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class RequestStatusTest {

    @Test
    @DisplayName("PENDING accepts every action")
    void pendingTransitions() {
        assertEquals(RequestStatus.PENDING, RequestStatus.PENDING.apply(RequestAction.EDIT));
        assertEquals(RequestStatus.PENDING, RequestStatus.PENDING.apply(RequestAction.DELETE));
        assertEquals(RequestStatus.APPROVED, RequestStatus.PENDING.apply(RequestAction.APPROVE));
        assertEquals(RequestStatus.REJECTED, RequestStatus.PENDING.apply(RequestAction.REJECT));
    }

    @ParameterizedTest
    @EnumSource(RequestAction.class)
    @DisplayName("APPROVED is terminal for every action")
    void approvedIsTerminal(RequestAction action) {
        ConflictException e = assertThrows(ConflictException.class, () -> RequestStatus.APPROVED.apply(action));
        assertTrue(e.getMessage().contains(action.getPastTense()));
    }

    @ParameterizedTest
    @EnumSource(RequestAction.class)
    @DisplayName("REJECTED is terminal for every action")
    void rejectedIsTerminal(RequestAction action) {
        assertThrows(ConflictException.class, () -> RequestStatus.REJECTED.apply(action));
    }

    @Test
    @DisplayName("Only PENDING and APPROVED reserve calendar days")
    void blocksCalendar() {
        assertTrue(RequestStatus.PENDING.blocksCalendar());
        assertTrue(RequestStatus.APPROVED.blocksCalendar());
        assertFalse(RequestStatus.REJECTED.blocksCalendar());
        assertEquals(EnumSet.of(RequestStatus.PENDING, RequestStatus.APPROVED),
            VacationRequestPersistenceService.CALENDAR_BLOCKING);
    }

    @Test
    @DisplayName("Wire values are lowercase and parse case-insensitively")
    void wireValues() {
        assertEquals("pending", RequestStatus.PENDING.toValue());
        assertEquals(RequestStatus.APPROVED, RequestStatus.fromValue("Approved"));
        assertNull(RequestStatus.fromValue(" "));
        assertThrows(ValidationException.class, () -> RequestStatus.fromValue("cancelled"));
    }
}
