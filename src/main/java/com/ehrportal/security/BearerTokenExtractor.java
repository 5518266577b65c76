package com.ehrportal.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer ";

    private BearerTokenExtractor() {
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
