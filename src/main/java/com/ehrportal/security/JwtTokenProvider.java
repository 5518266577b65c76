package com.ehrportal.security;

import com.ehrportal.exception.ErrorKind;
import com.ehrportal.exception.TokenVerificationException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Mints and checks HS256 bearer tokens carrying {@code sub}, {@code iss},
 * {@code iat} and {@code exp}. Stateless: nothing about issued tokens is kept.
 */
@Component
public class JwtTokenProvider {

    private static final JWSHeader EXPECTED_HEADER = new JWSHeader(JWSAlgorithm.HS256);

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Duration tokenTtl;
    private final String issuer;
    private final Clock clock;

    public JwtTokenProvider(@Value("${ehr.auth.jwt-secret:}") String secret,
                            @Value("${ehr.auth.token-ttl:PT24H}") Duration tokenTtl,
                            @Value("${ehr.auth.issuer:ehr-portal}") String issuer,
                            Clock clock) {
        if (tokenTtl == null || tokenTtl.isZero() || tokenTtl.isNegative()) {
            throw new IllegalStateException("ehr.auth.token-ttl must be a positive duration");
        }
        byte[] key = deriveKey(secret);
        try {
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new IllegalStateException("Cannot initialise HS256 key", e);
        }
        this.tokenTtl = tokenTtl;
        this.issuer = issuer;
        this.clock = clock;
    }

    public IssuedToken issue(UUID subjectId) {
        // JWT dates have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(tokenTtl);

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subjectId.toString())
                .issuer(issuer)
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .build();

        SignedJWT jwt = new SignedJWT(EXPECTED_HEADER, claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Token signing failed", e);
        }
        return new IssuedToken(jwt.serialize(), subjectId, issuedAt, expiresAt);
    }

    /**
     * Checks structure, then signature, then claims, then expiry. The MAC is
     * computed over the header and payload segments exactly as transmitted,
     * before either is decoded, so any edit to the signed input is reported as
     * {@link ErrorKind#INVALID_SIGNATURE}.
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Token is empty");
        }

        String[] segments = token.trim().split("\\.", -1);
        if (segments.length != 3 || segments[0].isEmpty() || segments[1].isEmpty() || segments[2].isEmpty()) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Token must have three segments");
        }
        verifySignature(segments);

        SignedJWT jwt;
        try {
            jwt = new SignedJWT(new Base64URL(segments[0]), new Base64URL(segments[1]), new Base64URL(segments[2]));
        } catch (ParseException e) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Token header cannot be parsed", e);
        }
        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new TokenVerificationException(ErrorKind.INVALID_SIGNATURE, "Unexpected signing algorithm");
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Claims cannot be parsed", e);
        }

        Date issueTime = claims.getIssueTime();
        Date expirationTime = claims.getExpirationTime();
        if (claims.getSubject() == null || issueTime == null || expirationTime == null) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Required claims missing");
        }
        if (!issuer.equals(claims.getIssuer())) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Unexpected issuer");
        }

        UUID subjectId;
        try {
            subjectId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(ErrorKind.MALFORMED_TOKEN, "Subject is not an identity id", e);
        }

        Instant expiresAt = expirationTime.toInstant();
        if (clock.instant().isAfter(expiresAt)) {
            throw new TokenVerificationException(ErrorKind.EXPIRED, "Token expired at " + expiresAt);
        }
        return new TokenClaims(subjectId, issueTime.toInstant(), expiresAt);
    }

    private void verifySignature(String[] segments) {
        byte[] signingInput = (segments[0] + "." + segments[1]).getBytes(StandardCharsets.US_ASCII);
        boolean valid;
        try {
            valid = verifier.verify(EXPECTED_HEADER, signingInput, new Base64URL(segments[2]));
        } catch (JOSEException e) {
            throw new TokenVerificationException(ErrorKind.INVALID_SIGNATURE, "Signature cannot be verified", e);
        }
        if (!valid) {
            throw new TokenVerificationException(ErrorKind.INVALID_SIGNATURE, "Signature mismatch");
        }
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    // Any non-blank secret is stretched to a fixed 256-bit HMAC key.
    private static byte[] deriveKey(String secret) {
        String s = secret == null ? "" : secret.trim();
        if (s.isEmpty()) {
            throw new IllegalStateException("ehr.auth.jwt-secret is empty. Set EHR_JWT_SECRET.");
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
