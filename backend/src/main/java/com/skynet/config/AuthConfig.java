package com.skynet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Beans shared by the authentication components.
 *
 * The {@link Clock} is the single source of "now" for OTP expiry and token
 * lifetimes, so tests can pin time with {@link Clock#fixed}.
 */
@Configuration
@Slf4j
public class AuthConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * BCrypt encoder with the configured cost factor.
     *
     * @param authProperties authentication settings
     * @return password encoder used by {@link com.skynet.security.PasswordHasher}
     */
    @Bean
    public PasswordEncoder passwordEncoder(AuthProperties authProperties) {
        log.info("Configuring BCrypt password encoder with strength {}", authProperties.bcryptStrength());
        return new BCryptPasswordEncoder(authProperties.bcryptStrength());
    }
}
