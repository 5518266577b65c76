package com.ehrportal.security;

import com.ehrportal.exception.ErrorKind;
import com.ehrportal.exception.TokenVerificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenProviderTest {

    private static final String SECRET = "unit-test-secret";
    private static final String ISSUER = "ehr-portal";
    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private JwtTokenProvider provider;
    private UUID subjectId;

    @BeforeEach
    void setUp() {
        provider = providerAt(NOW);
        subjectId = UUID.randomUUID();
    }

    private static JwtTokenProvider providerAt(Instant instant) {
        return new JwtTokenProvider(SECRET, TTL, ISSUER, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static ErrorKind kindOf(JwtTokenProvider verifier, String token) {
        return assertThrows(TokenVerificationException.class, () -> verifier.parse(token)).getKind();
    }

    private static String replaceCharAt(String value, int index) {
        char replacement = value.charAt(index) == 'A' ? 'B' : 'A';
        return value.substring(0, index) + replacement + value.substring(index + 1);
    }

    @Test
    void issue_ThenParse_ReturnsSubjectAndTimes() {
        IssuedToken issued = provider.issue(subjectId);

        TokenClaims claims = provider.parse(issued.getValue());

        assertEquals(subjectId, claims.getSubjectId());
        assertEquals(NOW, claims.getIssuedAt());
        assertEquals(NOW.plus(TTL), claims.getExpiresAt());
        assertEquals(NOW.plus(TTL), issued.getExpiresAt());
        assertEquals(subjectId, issued.getSubjectId());
    }

    @Test
    void issue_TwoSubjects_ProduceDifferentTokens() {
        assertNotEquals(provider.issue(subjectId).getValue(), provider.issue(UUID.randomUUID()).getValue());
    }

    @Test
    void parse_AtExactExpiry_IsAccepted() {
        String token = provider.issue(subjectId).getValue();

        TokenClaims claims = providerAt(NOW.plus(TTL)).parse(token);

        assertEquals(subjectId, claims.getSubjectId());
    }

    @Test
    void parse_OneSecondAfterExpiry_IsExpired() {
        String token = provider.issue(subjectId).getValue();

        assertEquals(ErrorKind.EXPIRED, kindOf(providerAt(NOW.plus(TTL).plusSeconds(1)), token));
    }

    @Test
    void parse_AnySignedCharacterAltered_IsInvalidSignature() {
        String token = provider.issue(subjectId).getValue();
        int signedEnd = token.lastIndexOf('.');

        for (int i = 0; i < signedEnd; i++) {
            if (token.charAt(i) == '.') {
                continue;
            }
            String tampered = replaceCharAt(token, i);
            assertEquals(ErrorKind.INVALID_SIGNATURE, kindOf(provider, tampered), "altered index " + i);
        }
    }

    @Test
    void parse_HeaderReplacedWithUnparseableJson_IsInvalidSignature() {
        String token = provider.issue(subjectId).getValue();
        String forged = "eyJhbGciOi" + token.substring(token.indexOf('.'));

        assertEquals(ErrorKind.INVALID_SIGNATURE, kindOf(provider, forged));
    }

    @Test
    void parse_SignatureAltered_IsInvalidSignature() {
        String token = provider.issue(subjectId).getValue();
        int signatureStart = token.lastIndexOf('.') + 1;
        int middle = signatureStart + (token.length() - signatureStart) / 2;

        assertEquals(ErrorKind.INVALID_SIGNATURE, kindOf(provider, replaceCharAt(token, middle)));
    }

    @Test
    void parse_SignedWithOtherSecret_IsInvalidSignature() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret", TTL, ISSUER, Clock.fixed(NOW, ZoneOffset.UTC));
        String token = other.issue(subjectId).getValue();

        assertEquals(ErrorKind.INVALID_SIGNATURE, kindOf(provider, token));
    }

    @Test
    void parse_Garbage_IsMalformed() {
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, "not-a-token"));
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, "a.b"));
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, "a.b.c.d"));
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, "a..c"));
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, ""));
        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, null));
    }

    @Test
    void parse_ForeignIssuer_IsMalformed() {
        JwtTokenProvider foreign = new JwtTokenProvider(SECRET, TTL, "someone-else", Clock.fixed(NOW, ZoneOffset.UTC));
        String token = foreign.issue(subjectId).getValue();

        assertEquals(ErrorKind.MALFORMED_TOKEN, kindOf(provider, token));
    }

    @Test
    void constructor_BlankSecret_FailsFast() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        assertThrows(IllegalStateException.class, () -> new JwtTokenProvider("  ", TTL, ISSUER, clock));
        assertThrows(IllegalStateException.class, () -> new JwtTokenProvider(null, TTL, ISSUER, clock));
    }

    @Test
    void constructor_NonPositiveTtl_FailsFast() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        assertThrows(IllegalStateException.class, () -> new JwtTokenProvider(SECRET, Duration.ZERO, ISSUER, clock));
    }
}
