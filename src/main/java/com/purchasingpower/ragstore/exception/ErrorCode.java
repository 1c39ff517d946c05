package com.purchasingpower.ragstore.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable error codes returned by the API.
 *
 * <p>Each code is bound to exactly one HTTP status so clients can rely on
 * either the status or the {@code error} field of the body.
 */
public enum ErrorCode {
    CONFLICT(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    DIMENSION_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    UPSTREAM_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY),
    PARTIAL_FAILURE(HttpStatus.MULTI_STATUS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
