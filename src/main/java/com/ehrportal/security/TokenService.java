package com.ehrportal.security;

import com.ehrportal.entity.User;
import com.ehrportal.exception.ErrorKind;
import com.ehrportal.exception.TokenVerificationException;
import com.ehrportal.service.CredentialStore;
import org.springframework.stereotype.Service;

/**
 * Issues tokens for identities and resolves presented tokens back to a live identity.
 */
@Service
public class TokenService {

    private final JwtTokenProvider tokenProvider;
    private final CredentialStore credentialStore;

    public TokenService(JwtTokenProvider tokenProvider, CredentialStore credentialStore) {
        this.tokenProvider = tokenProvider;
        this.credentialStore = credentialStore;
    }

    public IssuedToken issue(User user) {
        return tokenProvider.issue(user.getId());
    }

    /**
     * Verifies the token and re-reads its subject from the credential store, so
     * a deleted identity is rejected even while its tokens are unexpired.
     *
     * @throws TokenVerificationException with kind MALFORMED_TOKEN, INVALID_SIGNATURE,
     *                                    EXPIRED or UNKNOWN_SUBJECT
     */
    public User verify(String token) {
        TokenClaims claims = tokenProvider.parse(token);
        return credentialStore.findById(claims.getSubjectId())
                .orElseThrow(() -> new TokenVerificationException(
                        ErrorKind.UNKNOWN_SUBJECT, "No identity " + claims.getSubjectId()));
    }
}
