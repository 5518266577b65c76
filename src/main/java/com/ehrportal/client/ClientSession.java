package com.ehrportal.client;

import com.ehrportal.dto.AuthResponse;
import com.ehrportal.dto.ErrorResponse;
import com.ehrportal.dto.IdentitySummary;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * What a client remembers between calls: the current token and identity. All
 * changes go through the transition methods below; any other move throws
 * {@link IllegalStateException}.
 */
@Slf4j
public class ClientSession {

    private SessionState state = SessionState.ANONYMOUS;
    private String token;
    private IdentitySummary identity;
    private ErrorResponse lastError;

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized Optional<String> getToken() {
        return Optional.ofNullable(token);
    }

    public synchronized Optional<IdentitySummary> getIdentity() {
        return Optional.ofNullable(identity);
    }

    /**
     * The error that last sent the session back to {@link SessionState#ANONYMOUS}.
     */
    public synchronized Optional<ErrorResponse> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public synchronized boolean isAuthenticated() {
        return state == SessionState.AUTHENTICATED;
    }

    /**
     * ANONYMOUS to AUTHENTICATING, when credentials are submitted.
     */
    public synchronized void beginAuthentication() {
        require(SessionState.ANONYMOUS, "submit credentials");
        state = SessionState.AUTHENTICATING;
        lastError = null;
    }

    /**
     * AUTHENTICATING to AUTHENTICATED, storing the issued token.
     */
    public synchronized void completeAuthentication(AuthResponse response) {
        require(SessionState.AUTHENTICATING, "complete authentication");
        token = response.getToken();
        identity = response.getUser();
        state = SessionState.AUTHENTICATED;
    }

    /**
     * AUTHENTICATING back to ANONYMOUS with the error surfaced.
     */
    public synchronized void failAuthentication(ErrorResponse error) {
        require(SessionState.AUTHENTICATING, "fail authentication");
        clear();
        lastError = error;
    }

    /**
     * AUTHENTICATED to ANONYMOUS after the server answered UNAUTHENTICATED to a
     * call made with {@code rejectedToken}. The token is discarded and must not
     * be replayed. A late answer for a token that has since been replaced by a
     * new login leaves the current session alone.
     */
    public synchronized void invalidate(String rejectedToken, ErrorResponse error) {
        if (state != SessionState.AUTHENTICATED || rejectedToken == null || !rejectedToken.equals(token)) {
            return;
        }
        log.debug("Session invalidated by server: {}", error == null ? null : error.getKind());
        clear();
        lastError = error;
    }

    public synchronized void logout() {
        clear();
        lastError = null;
    }

    private void require(SessionState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " while " + state);
        }
    }

    private void clear() {
        token = null;
        identity = null;
        state = SessionState.ANONYMOUS;
    }
}
