package com.example.embeddingindex;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Key/value blob storage for uploaded items and snapshot files.
 */
public interface ObjectStorage {

    void put(String key, byte[] data, String contentType);

    /**
     * @throws NotFoundException when the key does not exist
     */
    byte[] get(String key);

    /** No-op when the key does not exist. */
    void delete(String key);

    boolean exists(String key);

    void upload(String key, Path source);

    /**
     * Copies the object to {@code target}, replacing it.
     *
     * @return false when the key does not exist
     */
    boolean download(String key, Path target);

    URI presignedUrl(String key, Duration ttl);
}
