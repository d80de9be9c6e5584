package com.skynet.exception;

import java.util.UUID;

/**
 * Thrown when a document does not exist or belongs to another account.
 *
 * Both cases produce the same 404 so that document ids of other users cannot be probed.
 */
public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(UUID documentId) {
        super(String.format("Document '%s' not found", documentId));
    }
}
