package com.ehrportal.exception;

public class UnauthenticatedException extends EhrException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }
}
