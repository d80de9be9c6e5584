package com.skynet.controller;

import com.skynet.dto.response.HealthResponse;
import com.skynet.dto.response.ServiceInfoResponse;
import com.skynet.storage.DocumentStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public service info and health endpoints.
 *
 * Endpoints:
 * - GET / - Service name, version and main routes
 * - GET /health - Database and storage connectivity
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String CONNECTED = "connected";
    static final String DISCONNECTED = "disconnected";
    private static final int DB_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final DocumentStorage documentStorage;

    @GetMapping("/")
    public ResponseEntity<ServiceInfoResponse> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("auth", "/auth");
        endpoints.put("users", "/users/me");
        endpoints.put("documents", "/documents");
        endpoints.put("health", "/health");

        return ResponseEntity.ok(ServiceInfoResponse.builder()
                .message("Welcome to Skynet API")
                .status("running")
                .version("2.0.0")
                .endpoints(endpoints)
                .build());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        String database = databaseStatus();
        String storage = documentStorage.isAvailable() ? CONNECTED : DISCONNECTED;
        String status = CONNECTED.equals(database) && CONNECTED.equals(storage) ? "healthy" : "degraded";

        return ResponseEntity.ok(HealthResponse.builder()
                .status(status)
                .database(database)
                .storage(storage)
                .build());
    }

    private String databaseStatus() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_TIMEOUT_SECONDS) ? CONNECTED : DISCONNECTED;
        } catch (SQLException ex) {
            log.warn("Database health check failed: {}", ex.getMessage());
            return DISCONNECTED;
        }
    }
}
