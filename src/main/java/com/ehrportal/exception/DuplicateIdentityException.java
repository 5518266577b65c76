package com.ehrportal.exception;

public class DuplicateIdentityException extends EhrException {

    public DuplicateIdentityException() {
        super(ErrorKind.DUPLICATE_IDENTITY, "Email already registered");
    }

    public DuplicateIdentityException(Throwable cause) {
        super(ErrorKind.DUPLICATE_IDENTITY, "Email already registered", cause);
    }
}
