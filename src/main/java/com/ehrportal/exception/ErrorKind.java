package com.ehrportal.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine readable failure kinds returned to callers.
 * <p>
 * {@link #MALFORMED_TOKEN}, {@link #INVALID_SIGNATURE}, {@link #EXPIRED} and
 * {@link #UNKNOWN_SUBJECT} are internal to token verification and are always
 * reported to callers as {@link #UNAUTHENTICATED}.
 */
public enum ErrorKind {
    DUPLICATE_IDENTITY(HttpStatus.CONFLICT),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED),
    MALFORMED_TOKEN(HttpStatus.UNAUTHORIZED),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED),
    EXPIRED(HttpStatus.UNAUTHORIZED),
    UNKNOWN_SUBJECT(HttpStatus.UNAUTHORIZED),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isTokenFailure() {
        return this == MALFORMED_TOKEN || this == INVALID_SIGNATURE
                || this == EXPIRED || this == UNKNOWN_SUBJECT;
    }

    /**
     * The kind a caller is allowed to see.
     */
    public ErrorKind publicKind() {
        return isTokenFailure() ? UNAUTHENTICATED : this;
    }
}
