package com.ehrportal.client;

/**
 * Client session lifecycle.
 * <pre>
 * ANONYMOUS --login/register--> AUTHENTICATING --success--> AUTHENTICATED
 *                                      |                          |
 *                                      +--failure--> ANONYMOUS <--+-- UNAUTHENTICATED response or logout
 * </pre>
 */
public enum SessionState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED
}
