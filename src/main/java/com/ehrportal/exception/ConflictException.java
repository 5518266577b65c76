package com.ehrportal.exception;

public class ConflictException extends EhrException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
