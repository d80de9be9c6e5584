package com.skynet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Component status report for {@code GET /health}.
 *
 * {@code status} is "healthy" only when every component reports "connected".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;
    private String database;
    private String storage;
}
