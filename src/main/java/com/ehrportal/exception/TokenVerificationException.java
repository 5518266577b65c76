package com.ehrportal.exception;

/**
 * A bearer token failed verification. The kind is one of the four token kinds
 * and stays inside the token layer; callers only see {@link ErrorKind#UNAUTHENTICATED}.
 */
public class TokenVerificationException extends EhrException {

    public TokenVerificationException(ErrorKind kind, String message) {
        super(requireTokenKind(kind), message);
    }

    public TokenVerificationException(ErrorKind kind, String message, Throwable cause) {
        super(requireTokenKind(kind), message, cause);
    }

    private static ErrorKind requireTokenKind(ErrorKind kind) {
        if (!kind.isTokenFailure()) {
            throw new IllegalArgumentException("Not a token failure kind: " + kind);
        }
        return kind;
    }
}
