package com.skynet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the Skynet backend.
 *
 * This Spring Boot application provides a REST API for:
 * - Account registration with email OTP verification
 * - Password login issuing short-lived JWT bearer tokens
 * - Password reset via OTP
 * - Per-user document storage backed by MinIO object storage
 * - PostgreSQL persistence for accounts and document metadata
 *
 * @version 2.0.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SkynetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkynetApplication.class, args);
    }
}
