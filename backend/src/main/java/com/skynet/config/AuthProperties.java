package com.skynet.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Authentication settings bound from {@code app.auth.*}.
 *
 * Built once at startup and shared by reference with the token provider, the OTP
 * generator and the password hasher. Changing {@code jwtSecret} requires a restart
 * and invalidates every token issued before it.
 *
 * @param jwtSecret                  HMAC signing secret (at least 32 bytes for HS256,
 *                                   48 for HS384, 64 for HS512)
 * @param jwtAlgorithm               HMAC algorithm identifier
 * @param accessTokenExpireMinutes   bearer token lifetime
 * @param otpExpiryMinutes           one-time passcode lifetime
 * @param bcryptStrength             BCrypt cost factor
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @NotBlank String jwtSecret,
        @DefaultValue("HS256") @Pattern(regexp = "HS256|HS384|HS512") String jwtAlgorithm,
        @DefaultValue("30") @Min(1) int accessTokenExpireMinutes,
        @DefaultValue("10") @Min(1) int otpExpiryMinutes,
        @DefaultValue("10") @Min(4) int bcryptStrength
) {

    public Duration accessTokenTtl() {
        return Duration.ofMinutes(accessTokenExpireMinutes);
    }

    public Duration otpTtl() {
        return Duration.ofMinutes(otpExpiryMinutes);
    }
}
