package com.skynet.security;

import com.skynet.config.AuthProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.Authentication;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JwtTokenProvider.
 *
 * Tests token operations including:
 * - Issue and verify round trip
 * - Expiry evaluated strictly against the supplied instant
 * - Signature tampering and foreign secrets
 * - Algorithm pinning
 * - Authorization header parsing
 */
@DisplayName("JwtTokenProvider Unit Tests")
class JwtTokenProviderTest {

    private static final String SECRET = "aVerySecureSecretKeyForJWTTokenGenerationThatIsAtLeast512BitsLongForHS512Algorithm";
    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private JwtTokenProvider jwtTokenProvider;
    private UUID testUserId;

    @BeforeEach
    void setUp() {
        jwtTokenProvider = new JwtTokenProvider(properties(SECRET, "HS256"));
        testUserId = UUID.randomUUID();
    }

    @Test
    @DisplayName("verify should return the subject for a fresh token")
    void testVerify_Valid() {
        // Arrange
        String token = jwtTokenProvider.issue(testUserId, NOW);

        // Act
        TokenVerification result = jwtTokenProvider.verify(token, NOW.plusSeconds(60));

        // Assert
        assertTrue(result.isValid());
        assertEquals(TokenVerification.Status.VALID, result.getStatus());
        assertEquals(testUserId, result.getSubjectId());
    }

    @Test
    @DisplayName("verify should accept a token one second before expiry")
    void testVerify_JustBeforeExpiry() {
        String token = jwtTokenProvider.issue(testUserId, NOW);

        TokenVerification result = jwtTokenProvider.verify(token, NOW.plus(Duration.ofMinutes(30)).minusSeconds(1));

        assertTrue(result.isValid());
    }

    @Test
    @DisplayName("verify should reject a token exactly at its expiry instant")
    void testVerify_AtExpiry() {
        String token = jwtTokenProvider.issue(testUserId, NOW);

        TokenVerification result = jwtTokenProvider.verify(token, NOW.plus(Duration.ofMinutes(30)));

        assertFalse(result.isValid());
        assertEquals(TokenVerification.Status.EXPIRED, result.getStatus());
    }

    @Test
    @DisplayName("verify should reject a token after its expiry")
    void testVerify_AfterExpiry() {
        String token = jwtTokenProvider.issue(testUserId, NOW);

        TokenVerification result = jwtTokenProvider.verify(token, NOW.plus(Duration.ofHours(2)));

        assertEquals(TokenVerification.Status.EXPIRED, result.getStatus());
        assertThrows(IllegalStateException.class, result::getSubjectId);
    }

    @Test
    @DisplayName("verify should reject a token with one signature character changed")
    void testVerify_TamperedSignature() {
        // Arrange
        String token = jwtTokenProvider.issue(testUserId, NOW);
        int signatureStart = token.lastIndexOf('.') + 1;
        int index = signatureStart + (token.length() - signatureStart) / 2;
        char replacement = token.charAt(index) == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, index) + replacement + token.substring(index + 1);

        // Act
        TokenVerification result = jwtTokenProvider.verify(tampered, NOW);

        // Assert
        assertEquals(TokenVerification.Status.INVALID_SIGNATURE, result.getStatus());
    }

    @Test
    @DisplayName("verify should reject a token with a modified payload")
    void testVerify_TamperedPayload() {
        String token = jwtTokenProvider.issue(testUserId, NOW);
        String[] parts = token.split("\\.");
        String otherPayload = jwtTokenProvider.issue(UUID.randomUUID(), NOW).split("\\.")[1];

        TokenVerification result = jwtTokenProvider.verify(parts[0] + "." + otherPayload + "." + parts[2], NOW);

        assertFalse(result.isValid());
    }

    @Test
    @DisplayName("verify should reject a token signed with another secret")
    void testVerify_ForeignSecret() {
        JwtTokenProvider other = new JwtTokenProvider(
                properties("anotherSecretKeyThatIsAlsoLongEnoughForHmacSha256Signing", "HS256"));
        String token = other.issue(testUserId, NOW);

        TokenVerification result = jwtTokenProvider.verify(token, NOW);

        assertEquals(TokenVerification.Status.INVALID_SIGNATURE, result.getStatus());
    }

    @Test
    @DisplayName("verify should reject a token signed with a different algorithm than configured")
    void testVerify_AlgorithmMismatch() {
        JwtTokenProvider hs512Provider = new JwtTokenProvider(properties(SECRET, "HS512"));
        String token = jwtTokenProvider.issue(testUserId, NOW);

        TokenVerification result = hs512Provider.verify(token, NOW);

        assertEquals(TokenVerification.Status.UNSUPPORTED, result.getStatus());
    }

    @Test
    @DisplayName("verify should report malformed input")
    void testVerify_Malformed() {
        assertEquals(TokenVerification.Status.MALFORMED, jwtTokenProvider.verify("not.a.valid.jwt", NOW).getStatus());
        assertEquals(TokenVerification.Status.MALFORMED, jwtTokenProvider.verify("", NOW).getStatus());
        assertEquals(TokenVerification.Status.MALFORMED, jwtTokenProvider.verify(null, NOW).getStatus());
    }

    @Test
    @DisplayName("verify should report a correctly signed token without subject as malformed")
    void testVerify_MissingSubject() {
        // Arrange
        String token = Jwts.builder()
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plus(Duration.ofMinutes(30))))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        // Act
        TokenVerification result = jwtTokenProvider.verify(token, NOW);

        // Assert
        assertEquals(TokenVerification.Status.MALFORMED, result.getStatus());
    }

    @Test
    @DisplayName("lifetime should count from the start of the issuing second")
    void testIssue_SubSecondInstant() {
        // Arrange
        Instant issuedAt = NOW.plusMillis(900);
        String token = jwtTokenProvider.issue(testUserId, issuedAt);

        // Act & Assert
        assertTrue(jwtTokenProvider.verify(token, NOW.plus(Duration.ofMinutes(30)).minusMillis(1)).isValid());
        assertEquals(TokenVerification.Status.EXPIRED,
                jwtTokenProvider.verify(token, NOW.plus(Duration.ofMinutes(30))).getStatus());
        assertEquals(TokenVerification.Status.EXPIRED,
                jwtTokenProvider.verify(token, issuedAt.plus(Duration.ofMinutes(30)).minusMillis(500)).getStatus());
    }

    @Test
    @DisplayName("HS512 provider should round trip its own tokens")
    void testIssue_Hs512() {
        JwtTokenProvider hs512Provider = new JwtTokenProvider(properties(SECRET, "HS512"));

        String token = hs512Provider.issue(testUserId, NOW);

        assertEquals(testUserId, hs512Provider.verify(token, NOW).getSubjectId());
    }

    @Test
    @DisplayName("constructor should refuse a secret shorter than the algorithm's key size")
    void testConstructor_ShortSecret() {
        assertThrows(IllegalStateException.class,
                () -> new JwtTokenProvider(properties("too-short", "HS256")));
        assertThrows(IllegalStateException.class,
                () -> new JwtTokenProvider(properties("exactly-thirty-two-bytes-long!!!", "HS512")));
    }

    @Test
    @DisplayName("getAuthentication should use the account id as principal")
    void testGetAuthentication() {
        Authentication authentication = jwtTokenProvider.getAuthentication(testUserId);

        assertEquals(testUserId.toString(), authentication.getName());
        assertTrue(authentication.isAuthenticated());
        assertTrue(authentication.getAuthorities().stream()
                .anyMatch(a -> "ROLE_USER".equals(a.getAuthority())));
    }

    @Test
    @DisplayName("extractTokenFromHeader should only accept Bearer headers")
    void testExtractTokenFromHeader() {
        assertEquals("abc.def.ghi", jwtTokenProvider.extractTokenFromHeader("Bearer abc.def.ghi"));
        assertNull(jwtTokenProvider.extractTokenFromHeader("Basic dXNlcjpwYXNz"));
        assertNull(jwtTokenProvider.extractTokenFromHeader("Bearer "));
        assertNull(jwtTokenProvider.extractTokenFromHeader(null));
    }

    private static AuthProperties properties(String secret, String algorithm) {
        return new AuthProperties(secret, algorithm, 30, 10, 4);
    }
}
