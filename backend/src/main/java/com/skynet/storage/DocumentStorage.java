package com.skynet.storage;

import java.util.List;

/**
 * Gateway to the external blob store holding document contents.
 *
 * Keys are opaque strings of the form {@code {ownerId}/{uuid}.{ext}}. Implementations
 * throw {@link com.skynet.exception.StorageException} when the store cannot be reached,
 * except {@link #delete} and {@link #isAvailable}, which report failure as {@code false}.
 */
public interface DocumentStorage {

    /**
     * Store a blob, replacing any existing blob under the same key.
     *
     * @return the blob's URL
     */
    String put(byte[] content, String key, String contentType);

    byte[] get(String key);

    /**
     * @return true if the blob is gone afterwards, false if deletion failed
     */
    boolean delete(String key);

    /**
     * @param prefix key prefix, or null for every blob
     * @return matching keys
     */
    List<String> list(String prefix);

    boolean exists(String key);

    String urlFor(String key);

    boolean isAvailable();
}
