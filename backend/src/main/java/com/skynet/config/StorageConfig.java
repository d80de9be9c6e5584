package com.skynet.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MinIO client configuration for document storage.
 *
 * The client is thread-safe and shared by every request. Bucket creation is
 * handled by {@link com.skynet.storage.MinioDocumentStorage} on startup.
 *
 * @see io.minio.MinioClient
 */
@Configuration
@Slf4j
public class StorageConfig {

    @Bean
    public MinioClient minioClient(StorageProperties storageProperties) {
        log.info("Configuring MinIO client: endpoint={}, bucket={}",
                storageProperties.url(), storageProperties.bucket());

        return MinioClient.builder()
                .endpoint(storageProperties.url())
                .credentials(storageProperties.accessKey(), storageProperties.secretKey())
                .build();
    }
}
