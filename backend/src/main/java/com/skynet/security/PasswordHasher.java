package com.skynet.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way password hashing backed by the configured BCrypt encoder.
 *
 * Hashing the same password twice yields different digests; {@link #verify} is the
 * only way to compare. A malformed or missing digest simply fails verification.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plainPassword) {
        return passwordEncoder.encode(plainPassword);
    }

    public boolean verify(String plainPassword, String digest) {
        if (plainPassword == null || digest == null || digest.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plainPassword, digest);
        } catch (IllegalArgumentException ex) {
            log.debug("Stored password digest could not be parsed: {}", ex.getMessage());
            return false;
        }
    }
}
