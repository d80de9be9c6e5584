package com.skynet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceInfoResponse {

    private String message;
    private String status;
    private String version;
    private Map<String, String> endpoints;
}
