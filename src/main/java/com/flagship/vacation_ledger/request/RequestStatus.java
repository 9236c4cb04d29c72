package com.flagship.vacation_ledger.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.vacation_ledger.exception.ConflictException;
import com.flagship.vacation_ledger.exception.ValidationException;

import java.util.Locale;

/**
 * Lifecycle state of a vacation request.
 *
 * PENDING is the only state that accepts actions; APPROVED and REJECTED are
 * terminal. {@link #apply(RequestAction)} is the single transition function:
 * every mutation of a request goes through it before anything is written.
 */
public enum RequestStatus {
    /**
     * Submitted by the owner, waiting for a manager decision.
     * Can be edited, deleted, approved or rejected.
     */
    PENDING,

    /**
     * Approved by a manager; its days count against the owner's balance.
     * Terminal state - no further transitions allowed.
     */
    APPROVED,

    /**
     * Rejected by a manager.
     * Terminal state - no further transitions allowed.
     */
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Whether requests in this state reserve their dates for overlap checks.
     */
    public boolean blocksCalendar() {
        return this == PENDING || this == APPROVED;
    }

    /**
     * Returns the state a request reaches when {@code action} is applied.
     * EDIT keeps the request PENDING; DELETE also reports PENDING, as the
     * row is removed rather than moved to another state.
     *
     * @throws ConflictException if the request is no longer pending
     */
    public RequestStatus apply(RequestAction action) {
        if (this != PENDING) {
            throw new ConflictException(String.format(
                "Only pending requests can be %s; request is %s", action.getPastTense(), toValue()));
        }
        return switch (action) {
            case EDIT, DELETE -> PENDING;
            case APPROVE -> APPROVED;
            case REJECT -> REJECTED;
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RequestStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RequestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationException.Reason.INVALID_INPUT,
                "Unknown request status: " + value);
        }
    }
}
