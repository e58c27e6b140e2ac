package com.example.embeddingindex;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Filesystem-backed object storage. Keys map to paths under a root directory;
 * writes go through a temp file and an atomic move.
 */
@Slf4j
public class LocalObjectStorage implements ObjectStorage {

    private final Path root;

    public LocalObjectStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageIOException("Cannot create object storage root " + this.root, e);
        }
        log.info("Local object storage at {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".put-", ".tmp");
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageIOException("Failed to write object " + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        try {
            return Files.readAllBytes(resolve(key));
        } catch (NoSuchFileException e) {
            throw NotFoundException.object(key);
        } catch (IOException e) {
            throw new StorageIOException("Failed to read object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageIOException("Failed to delete object " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public void upload(String key, Path source) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".put-", ".tmp");
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageIOException("Failed to upload " + source + " to " + key, e);
        }
    }

    @Override
    public boolean download(String key, Path target) {
        Path source = resolve(key);
        if (!Files.isRegularFile(source)) return false;
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            throw new StorageIOException("Failed to download " + key + " to " + target, e);
        }
    }

    @Override
    public URI presignedUrl(String key, Duration ttl) {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) throw NotFoundException.object(key);
        return path.toUri();
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidRequestException("INVALID_KEY", "Object key must not be blank");
        }
        Path p = root.resolve(key).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new InvalidRequestException("INVALID_KEY", "Object key escapes storage root: " + key);
        }
        return p;
    }
}
