package com.flagship.vacation_ledger.exception;

public class NotFoundException extends WorkflowException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException account(Long accountId) {
        return new NotFoundException("Account not found: " + accountId);
    }

    public static NotFoundException request(Long requestId) {
        return new NotFoundException("Vacation request not found: " + requestId);
    }
}
