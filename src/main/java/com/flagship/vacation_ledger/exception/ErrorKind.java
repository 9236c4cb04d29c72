package com.flagship.vacation_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Categories of workflow failures reported to callers.
 */
public enum ErrorKind {
    VALIDATION("Validation Failed", HttpStatus.BAD_REQUEST),
    CONFLICT("Conflict", HttpStatus.CONFLICT),
    NOT_FOUND("Not Found", HttpStatus.NOT_FOUND),
    AUTHORIZATION("Access Denied", HttpStatus.FORBIDDEN);

    private final String title;
    private final HttpStatus httpStatus;

    ErrorKind(String title, HttpStatus httpStatus) {
        this.title = title;
        this.httpStatus = httpStatus;
    }

    public String getTitle() {
        return title;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
