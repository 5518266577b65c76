package com.ehrportal.exception;

public class NotFoundException extends EhrException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
