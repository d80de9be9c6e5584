package com.skynet.storage;

import com.skynet.config.StorageProperties;
import com.skynet.exception.StorageException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.messages.Item;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DocumentStorage} backed by a MinIO (S3-compatible) bucket.
 *
 * The bucket is created on startup if it does not exist yet.
 */
@Component
@Slf4j
public class MinioDocumentStorage implements DocumentStorage {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient client;
    private final String bucket;
    private final String baseUrl;

    public MinioDocumentStorage(MinioClient client, StorageProperties storageProperties) {
        this.client = client;
        this.bucket = storageProperties.bucket();
        this.baseUrl = stripTrailingSlash(storageProperties.url());
    }

    @PostConstruct
    void ensureBucket() {
        try {
            boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!exists) {
                client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created storage bucket '{}'", bucket);
            }
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            // Startup continues; /health reports storage as unavailable until the bucket is reachable
            log.error("Storage bucket '{}' could not be prepared: {}", bucket, ex.getMessage());
        }
    }

    @Override
    public String put(byte[] content, String key, String contentType) {
        try {
            client.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(new ByteArrayInputStream(content), content.length, -1)
                    .contentType(contentType)
                    .build());
            log.debug("Stored blob {} ({} bytes)", key, content.length);
            return urlFor(key);
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            throw StorageException.uploadFailed(key, ex);
        }
    }

    @Override
    public byte[] get(String key) {
        try (GetObjectResponse response = client.getObject(GetObjectArgs.builder()
                .bucket(bucket)
                .object(key)
                .build())) {
            return response.readAllBytes();
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            throw StorageException.downloadFailed(key, ex);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            client.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            log.debug("Deleted blob {}", key);
            return true;
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            log.warn("Failed to delete blob {}: {}", key, ex.getMessage());
            return false;
        }
    }

    @Override
    public List<String> list(String prefix) {
        ListObjectsArgs.Builder args = ListObjectsArgs.builder().bucket(bucket).recursive(true);
        if (prefix != null) {
            args.prefix(prefix);
        }

        List<String> keys = new ArrayList<>();
        try {
            for (Result<Item> result : client.listObjects(args.build())) {
                keys.add(result.get().objectName());
            }
            return keys;
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            throw StorageException.listFailed(prefix, ex);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            client.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            return true;
        } catch (ErrorResponseException ex) {
            if (NO_SUCH_KEY.equals(ex.errorResponse().code())) {
                return false;
            }
            throw StorageException.downloadFailed(key, ex);
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            throw StorageException.downloadFailed(key, ex);
        }
    }

    @Override
    public String urlFor(String key) {
        return baseUrl + "/" + bucket + "/" + key;
    }

    @Override
    public boolean isAvailable() {
        try {
            return client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            log.warn("Storage health check failed: {}", ex.getMessage());
            return false;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
