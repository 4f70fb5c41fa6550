package com.jreinhal.haven.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy surfaced to API callers.
 */
public enum ErrorKind {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    INVALID_STATE(HttpStatus.CONFLICT),
    FAILED_PRECONDITION(HttpStatus.PRECONDITION_FAILED),
    // Archived reports are locked for good.
    ARCHIVED_IMMUTABLE(HttpStatus.LOCKED);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return this.status;
    }
}
