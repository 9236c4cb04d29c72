package com.flagship.vacation_ledger.exception;

/**
 * Base type for business-rule failures raised by the vacation workflow.
 *
 * Every subclass carries an {@link ErrorKind} so the API layer can render a
 * response without inspecting the concrete type.
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;

    protected WorkflowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkflowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
