package com.ehrportal.security;

import com.ehrportal.exception.ErrorKind;

/**
 * Outcome of {@link AuthorizationGuard#evaluate}: allow, or deny with
 * {@link ErrorKind#UNAUTHENTICATED} or {@link ErrorKind#FORBIDDEN}.
 */
public final class AccessDecision {

    private static final AccessDecision ALLOW = new AccessDecision(null, null);

    private final ErrorKind denyReason;
    private final String message;

    private AccessDecision(ErrorKind denyReason, String message) {
        this.denyReason = denyReason;
        this.message = message;
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision unauthenticated() {
        return new AccessDecision(ErrorKind.UNAUTHENTICATED, "Authentication required");
    }

    public static AccessDecision forbidden(String message) {
        return new AccessDecision(ErrorKind.FORBIDDEN, message);
    }

    public boolean isAllowed() {
        return denyReason == null;
    }

    public ErrorKind getDenyReason() {
        return denyReason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allow" : "Deny(" + denyReason + ")";
    }
}
