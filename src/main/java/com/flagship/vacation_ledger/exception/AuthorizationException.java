package com.flagship.vacation_ledger.exception;

/**
 * The principal's role forbids the operation, or the principal does not own
 * the targeted record.
 */
public class AuthorizationException extends WorkflowException {

    public AuthorizationException(String message) {
        super(ErrorKind.AUTHORIZATION, message);
    }
}
