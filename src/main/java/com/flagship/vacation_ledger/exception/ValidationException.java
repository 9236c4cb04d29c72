package com.flagship.vacation_ledger.exception;

/**
 * Input is semantically inadmissible: bad date order, insufficient balance,
 * overlapping range and similar.
 */
public class ValidationException extends WorkflowException {

    /**
     * Machine-readable reason, exposed in the error details.
     */
    public enum Reason {
        INVALID_DATE_RANGE,
        OVERLAP,
        INSUFFICIENT_BALANCE,
        SELF_DELETE,
        INVALID_INPUT
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(ErrorKind.VALIDATION, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
