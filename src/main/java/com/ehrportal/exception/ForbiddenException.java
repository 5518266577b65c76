package com.ehrportal.exception;

public class ForbiddenException extends EhrException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
