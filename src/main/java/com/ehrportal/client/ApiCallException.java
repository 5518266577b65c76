package com.ehrportal.client;

import com.ehrportal.exception.ErrorKind;

/**
 * A call to the backend was answered with an error response.
 */
public class ApiCallException extends RuntimeException {

    private final ErrorKind kind;
    private final int status;

    public ApiCallException(ErrorKind kind, int status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public ApiCallException(ErrorKind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }
}
