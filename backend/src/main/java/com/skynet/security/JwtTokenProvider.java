package com.skynet.security;

import com.skynet.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Date;
import java.util.UUID;

/**
 * JWT Token Provider for issuing and verifying bearer tokens.
 *
 * Tokens carry the account id as subject plus issued-at and expiration claims, and
 * are signed with the configured HMAC algorithm (HS256, HS384 or HS512). They are
 * never stored: verification is signature plus expiry against the supplied instant.
 *
 * Security Features:
 * - Secret key derived once from {@link AuthProperties}
 * - Tokens signed with a different algorithm than configured are rejected
 * - A token is valid strictly before its expiration instant
 * - iat and exp are whole seconds; the lifetime counts from the start of the issuing second
 * - Thread-safe: no mutable state after construction
 *
 * @see io.jsonwebtoken.Jwts
 * @see TokenVerification
 */
@Component
@Slf4j
public class JwtTokenProvider {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final MacAlgorithm algorithm;
    private final Duration tokenTtl;

    public JwtTokenProvider(AuthProperties authProperties) {
        this.algorithm = resolveAlgorithm(authProperties.jwtAlgorithm());
        this.secretKey = buildKey(authProperties.jwtSecret(), algorithm);
        this.tokenTtl = authProperties.accessTokenTtl();
        log.info("JWT Token Provider initialized: algorithm={}, expiration={} min",
                algorithm.getId(), tokenTtl.toMinutes());
    }

    /**
     * Issue a bearer token for an account.
     *
     * The token contains the following claims:
     * - sub: account id (UUID)
     * - iat: issued at ({@code now} truncated to seconds)
     * - exp: iat plus the configured token lifetime
     *
     * @param subjectId the account's stable identifier
     * @param now the issuing instant
     * @return compact JWS string
     */
    public String issue(UUID subjectId, Instant now) {
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiry = issuedAt.plus(tokenTtl);

        String token = Jwts.builder()
                .subject(subjectId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiry))
                .signWith(secretKey, algorithm)
                .compact();

        log.debug("Issued token for subject {} expiring at {}", subjectId, expiry);
        return token;
    }

    /**
     * Verify a bearer token's structure, signature and expiry.
     *
     * @param token compact JWS string, may be null
     * @param now the instant to evaluate expiry against
     * @return the subject on success, otherwise a typed failure
     */
    public TokenVerification verify(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return TokenVerification.failure(TokenVerification.Status.MALFORMED);
        }

        try {
            Jws<Claims> jws = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token);

            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                log.warn("Rejected token signed with {}", jws.getHeader().getAlgorithm());
                return TokenVerification.failure(TokenVerification.Status.UNSUPPORTED);
            }

            Claims claims = jws.getPayload();
            Date expiration = claims.getExpiration();
            if (expiration == null || !now.isBefore(expiration.toInstant())) {
                log.warn("Expired JWT token for subject {}", claims.getSubject());
                return TokenVerification.failure(TokenVerification.Status.EXPIRED);
            }

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("JWT token has no subject");
                return TokenVerification.failure(TokenVerification.Status.MALFORMED);
            }

            return TokenVerification.valid(UUID.fromString(subject));

        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.EXPIRED);
        } catch (SignatureException ex) {
            log.warn("Invalid JWT signature: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.INVALID_SIGNATURE);
        } catch (MalformedJwtException ex) {
            log.warn("Invalid JWT token: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.MALFORMED);
        } catch (UnsupportedJwtException ex) {
            log.warn("Unsupported JWT token: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.UNSUPPORTED);
        } catch (JwtException ex) {
            log.warn("JWT token rejected: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.MALFORMED);
        } catch (IllegalArgumentException ex) {
            // non-UUID subject
            log.warn("JWT token has no usable subject: {}", ex.getMessage());
            return TokenVerification.failure(TokenVerification.Status.MALFORMED);
        }
    }

    /**
     * Build the Spring Security principal for a verified subject.
     *
     * @param subjectId the verified account id
     * @return authenticated token with the account id as principal
     */
    public Authentication getAuthentication(UUID subjectId) {
        return new UsernamePasswordAuthenticationToken(
                subjectId.toString(),
                null,
                Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
        );
    }

    /**
     * Extract the token from an Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the token string, or null if the header is absent or not a bearer header
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith(BEARER_PREFIX)) {
            String token = bearerToken.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    private static MacAlgorithm resolveAlgorithm(String id) {
        switch (id) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalStateException("Unsupported JWT algorithm: " + id);
        }
    }

    private static SecretKey buildKey(String secret, MacAlgorithm algorithm) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        int requiredBytes = algorithm.getKeyBitLength() / 8;
        if (bytes.length < requiredBytes) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d bytes for %s", requiredBytes, algorithm.getId()));
        }
        return Keys.hmacShaKeyFor(bytes);
    }
}
