package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateRangeTest {

    private static final LocalDate JAN_10 = LocalDate.of(2025, 1, 10);
    private static final LocalDate JAN_14 = LocalDate.of(2025, 1, 14);

    @Test
    @DisplayName("Duration counts both ends of the range")
    void durationIsInclusive() {
        assertEquals(5, DateRange.of(JAN_10, JAN_14).getDurationDays());
    }

    @Test
    @DisplayName("A single-day range lasts one day")
    void singleDayRange() {
        assertEquals(1, DateRange.of(JAN_10, JAN_10).getDurationDays());
    }

    @Test
    @DisplayName("Duration crosses month and leap-day boundaries")
    void durationAcrossLeapFebruary() {
        DateRange range = DateRange.of(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 1));
        assertEquals(3, range.getDurationDays());
    }

    @Test
    @DisplayName("End before start is rejected as an invalid date range")
    void reversedRangeRejected() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> DateRange.of(JAN_14, JAN_10));
        assertEquals(ValidationException.Reason.INVALID_DATE_RANGE, e.getReason());
    }

    @Test
    @DisplayName("Missing bounds are rejected")
    void missingBoundRejected() {
        assertThrows(ValidationException.class, () -> DateRange.of(null, JAN_10));
        assertThrows(ValidationException.class, () -> DateRange.of(JAN_10, null));
    }

    @Test
    @DisplayName("Ranges sharing a single day overlap")
    void touchingRangesOverlap() {
        DateRange first = DateRange.of(JAN_10, JAN_14);
        DateRange second = DateRange.of(JAN_14, LocalDate.of(2025, 1, 20));

        assertTrue(first.overlaps(second));
        assertTrue(second.overlaps(first));
    }

    @Test
    @DisplayName("Adjacent ranges do not overlap")
    void adjacentRangesDoNotOverlap() {
        DateRange first = DateRange.of(JAN_10, JAN_14);
        DateRange second = DateRange.of(LocalDate.of(2025, 1, 15), LocalDate.of(2025, 1, 20));

        assertFalse(first.overlaps(second));
        assertFalse(second.overlaps(first));
    }

    @Test
    @DisplayName("A range nested inside another overlaps it")
    void containedRangeOverlaps() {
        DateRange outer = DateRange.of(JAN_10, JAN_14);
        DateRange inner = DateRange.of(LocalDate.of(2025, 1, 12), LocalDate.of(2025, 1, 13));

        assertTrue(outer.overlaps(inner));
        assertTrue(inner.overlaps(outer));
    }
}
