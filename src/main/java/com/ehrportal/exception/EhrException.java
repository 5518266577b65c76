package com.ehrportal.exception;

public class EhrException extends RuntimeException {

    private final ErrorKind kind;

    public EhrException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EhrException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
