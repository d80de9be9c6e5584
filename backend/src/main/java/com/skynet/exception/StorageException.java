package com.skynet.exception;

/**
 * Exception thrown when the object storage service cannot complete an operation.
 *
 * Covers unreachable endpoints, missing buckets, credential errors and failed
 * transfers. The message is for logs only; GlobalExceptionHandler maps this to
 * HTTP 503 Service Unavailable with a generic detail.
 *
 * @see com.skynet.storage.MinioDocumentStorage
 * @see com.skynet.exception.GlobalExceptionHandler
 */
public class StorageException extends RuntimeException {

    private final String operation;
    private final String objectKey;

    public StorageException(String operation, String objectKey, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.objectKey = objectKey;
    }

    public String getOperation() {
        return operation;
    }

    public String getObjectKey() {
        return objectKey;
    }

    public static StorageException uploadFailed(String objectKey, Throwable cause) {
        return new StorageException(
                "upload",
                objectKey,
                String.format("Failed to upload object '%s' to storage.", objectKey),
                cause
        );
    }

    public static StorageException downloadFailed(String objectKey, Throwable cause) {
        return new StorageException(
                "download",
                objectKey,
                String.format("Failed to download object '%s' from storage.", objectKey),
                cause
        );
    }

    /**
     * The blob could not be removed, so its metadata record was kept.
     */
    public static StorageException deleteFailed(String objectKey) {
        return new StorageException(
                "delete",
                objectKey,
                String.format("Failed to delete object '%s' from storage; record kept.", objectKey),
                null
        );
    }

    public static StorageException listFailed(String prefix, Throwable cause) {
        return new StorageException(
                "list",
                prefix,
                String.format("Failed to list objects with prefix '%s'.", prefix),
                cause
        );
    }

    public static StorageException bucketUnavailable(String bucket, Throwable cause) {
        return new StorageException(
                "bucket",
                bucket,
                String.format("Storage bucket '%s' is unavailable.", bucket),
                cause
        );
    }
}
