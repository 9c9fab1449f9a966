package com.scifund.api.error;

import org.springframework.http.HttpStatus;

/**
 * Caller-visible failure categories of ledger operations.
 */
public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    INVALID_STATE(HttpStatus.CONFLICT),
    LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
