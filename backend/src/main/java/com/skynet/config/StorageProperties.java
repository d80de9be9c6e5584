package com.skynet.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * MinIO connection settings bound from {@code app.storage.minio.*}.
 */
@Validated
@ConfigurationProperties(prefix = "app.storage.minio")
public record StorageProperties(
        @NotBlank String url,
        @NotBlank String accessKey,
        @NotBlank String secretKey,
        @NotBlank String bucket
) {
}
