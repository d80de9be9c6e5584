package com.skynet.service;

import com.skynet.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Service for generating one-time passcodes and evaluating their expiry.
 *
 * OTP Specifications:
 * - Length: 6 digits (100000-999999 plus leading-zero codes such as 004213)
 * - Generation: cryptographically secure random (SecureRandom)
 * - Expiry: configurable, default 10 minutes
 * - Storage: on the user row, see {@link com.skynet.entity.User#issueOtp}
 *
 * Expiry values are zone-less {@link LocalDateTime}s holding UTC wall-clock time, matching
 * the {@code otp_expiry} column. They are always converted through {@link ZoneOffset#UTC}.
 */
@Service
@Slf4j
public class OtpService {

    private static final int OTP_BOUND = 1_000_000;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final Duration otpTtl;

    public OtpService(AuthProperties authProperties) {
        this.otpTtl = authProperties.otpTtl();
        log.info("OTP service initialized: expiry={} min", otpTtl.toMinutes());
    }

    /**
     * Generate a uniformly random 6-digit OTP.
     *
     * @return 6-digit code, zero-padded
     */
    public String generate() {
        return String.format("%06d", SECURE_RANDOM.nextInt(OTP_BOUND));
    }

    /**
     * Expiry for an OTP issued at {@code now}.
     *
     * @param now the issuing instant
     * @return UTC wall-clock expiry
     */
    public LocalDateTime expiryFrom(Instant now) {
        return LocalDateTime.ofInstant(now.plus(otpTtl), ZoneOffset.UTC);
    }

    /**
     * Whether an OTP with the given expiry may still be used.
     *
     * @param expiry stored UTC expiry, may be null
     * @param now the instant of use
     * @return true strictly before expiry
     */
    public boolean isValid(LocalDateTime expiry, Instant now) {
        if (expiry == null) {
            return false;
        }
        return now.isBefore(expiry.toInstant(ZoneOffset.UTC));
    }

    public long getOtpExpirationMinutes() {
        return otpTtl.toMinutes();
    }
}
