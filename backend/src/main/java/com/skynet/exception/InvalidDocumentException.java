package com.skynet.exception;

/**
 * Thrown when an uploaded file is rejected before it reaches storage.
 */
public class InvalidDocumentException extends RuntimeException {

    public InvalidDocumentException(String message) {
        super(message);
    }

    public static InvalidDocumentException unsupportedType(String contentType) {
        return new InvalidDocumentException(
                String.format("File type %s is not supported.", contentType));
    }

    public static InvalidDocumentException tooLarge(long maxBytes) {
        return new InvalidDocumentException(
                String.format("File is too large (Max %dMB)", maxBytes / (1024 * 1024)));
    }

    public static InvalidDocumentException filenameTooLong(int maxLength) {
        return new InvalidDocumentException(
                String.format("File name is too long (Max %d characters)", maxLength));
    }

    public static InvalidDocumentException empty() {
        return new InvalidDocumentException("File is empty.");
    }
}
