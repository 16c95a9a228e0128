package com.flagship.treasury_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error kinds returned to API callers.
 *
 * Each kind maps to exactly one HTTP status so clients can branch on
 * either. TRANSIENT_CONFLICT is the only kind where retrying the same
 * request unchanged is expected to succeed.
 */
public enum ErrorKind {
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    INVALID_TRANSACTION_SHAPE(HttpStatus.BAD_REQUEST),
    INVALID_RULE_CONFIGURATION(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_APPLICABLE_RULE(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    DUPLICATE_ACCOUNT(HttpStatus.CONFLICT),
    DUPLICATE_RULE(HttpStatus.CONFLICT),
    INSUFFICIENT_FUNDS(HttpStatus.CONFLICT),
    ALREADY_RESOLVED(HttpStatus.CONFLICT),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED),
    INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN),
    TRANSIENT_CONFLICT(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
