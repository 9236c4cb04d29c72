package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive range of whole calendar days.
 *
 * Invariant: {@code start <= end}.
 */
@Value
public class DateRange {
    LocalDate start;
    LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws ValidationException if a bound is missing or end precedes start
     */
    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException(ValidationException.Reason.INVALID_DATE_RANGE,
                "Start and end dates are required");
        }
        if (end.isBefore(start)) {
            throw new ValidationException(ValidationException.Reason.INVALID_DATE_RANGE,
                String.format("End date %s must be on or after start date %s", end, start));
        }
        return new DateRange(start, end);
    }

    /**
     * Number of calendar days covered, both ends included. A single-day range is 1.
     */
    public int getDurationDays() {
        return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
    }

    /**
     * Two ranges overlap when they share at least one day. Covers containment,
     * partial overlap and exact match.
     */
    public boolean overlaps(DateRange other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
