package com.flagship.vacation_ledger.exception;

/**
 * Operation attempted against a record that is not in the required state,
 * or that collides with an existing unique value.
 */
public class ConflictException extends WorkflowException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
