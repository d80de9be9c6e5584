package com.skynet.service;

import com.skynet.config.AuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OtpService.
 *
 * Tests OTP generation format and strict expiry evaluation.
 */
@DisplayName("OtpService Unit Tests")
class OtpServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private OtpService otpService;

    @BeforeEach
    void setUp() {
        otpService = new OtpService(new AuthProperties("unused-secret-for-otp-tests-0123456789", "HS256", 30, 10, 4));
    }

    @Test
    @DisplayName("generate should always return exactly 6 digits")
    void testGenerate_Format() {
        for (int i = 0; i < 1000; i++) {
            String otp = otpService.generate();
            assertEquals(6, otp.length());
            assertTrue(otp.matches("\\d{6}"), "Unexpected OTP format: " + otp);
        }
    }

    @Test
    @DisplayName("expiryFrom should add the configured TTL in UTC")
    void testExpiryFrom() {
        LocalDateTime expiry = otpService.expiryFrom(NOW);

        assertEquals(LocalDateTime.of(2025, 1, 1, 12, 10, 0), expiry);
        assertEquals(10, otpService.getOtpExpirationMinutes());
    }

    @Test
    @DisplayName("isValid should be true strictly before expiry and false at or after it")
    void testIsValid_Boundary() {
        LocalDateTime expiry = otpService.expiryFrom(NOW);
        Instant expiryInstant = NOW.plusSeconds(600);

        assertTrue(otpService.isValid(expiry, NOW));
        assertTrue(otpService.isValid(expiry, expiryInstant.minusMillis(1)));
        assertFalse(otpService.isValid(expiry, expiryInstant));
        assertFalse(otpService.isValid(expiry, expiryInstant.plusSeconds(1)));
    }

    @Test
    @DisplayName("isValid should be false without an expiry")
    void testIsValid_NullExpiry() {
        assertFalse(otpService.isValid(null, NOW));
    }
}
