package com.ehrportal.exception;

/**
 * Raised for an unknown email and for a wrong password alike.
 */
public class InvalidCredentialsException extends EhrException {

    public static final String MESSAGE = "Invalid email or password";

    public InvalidCredentialsException() {
        super(ErrorKind.INVALID_CREDENTIALS, MESSAGE);
    }
}
