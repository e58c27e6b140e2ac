package com.example.embeddingindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consistent copies of the whole store. A backup is an H2 SQL script
 * (gzip) covering every table and the id sequence, taken under the store lock.
 */
@Slf4j
@Service
public class SnapshotManager {

    public enum RestoreOutcome { DISABLED, LOCAL_STORE_PRESENT, NOT_FOUND, RESTORED, FAILED }

    private final JdbcTemplate jdbc;
    private final SchemaVersionManager schema;
    private final StoreLock storeLock;
    private final ObjectStorage storage;
    private final boolean remoteEnabled;
    private final String remoteKey;

    private volatile Instant lastBackupAt;
    private volatile String lastBackupKey;
    private volatile String lastError;
    private volatile RestoreOutcome lastRestore;

    public SnapshotManager(JdbcTemplate jdbc, SchemaVersionManager schema, StoreLock storeLock,
                           ObjectStorage storage, EmbeddingIndexProperties props) {
        this.jdbc = jdbc;
        this.schema = schema;
        this.storeLock = storeLock;
        this.storage = storage;
        this.remoteEnabled = props.getSnapshot().isRemoteEnabled();
        this.remoteKey = props.getSnapshot().getKey();
    }

    public void backupTo(Path dest) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            Files.createDirectories(dest.toAbsolutePath().getParent());
            Files.deleteIfExists(dest);
            jdbc.execute("SCRIPT TO " + sqlPath(dest) + " COMPRESSION GZIP");
        } catch (IOException | DataAccessException e) {
            throw new StorageIOException("Backup to " + dest + " failed", e);
        }
        log.info("Backed up store to {}", dest);
    }

    /**
     * Loads a backup into an empty store. Refuses when a store already exists.
     */
    public void restoreFrom(Path src) {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            if (schema.isInitialized()) {
                throw new IllegalStateException("Refusing to restore over an existing store");
            }
            jdbc.execute("RUNSCRIPT FROM " + sqlPath(src) + " COMPRESSION GZIP");
        } catch (DataAccessException e) {
            throw new StorageIOException("Restore from " + src + " failed", e);
        }
        log.info("Restored store from {}", src);
    }

    /**
     * Backs up to object storage. The script is written under the store lock;
     * the upload happens after the lock is released.
     */
    public Instant backupToRemote() {
        Path tmp = null;
        try {
            tmp = Files.createTempFile("embedding-index-", ".sql.gz");
            backupTo(tmp);
            storage.upload(remoteKey, tmp);
            Instant now = Instant.now();
            lastBackupAt = now;
            lastBackupKey = remoteKey;
            lastError = null;
            log.info("Uploaded snapshot to {}", remoteKey);
            return now;
        } catch (IOException e) {
            lastError = e.getMessage();
            throw new StorageIOException("Cannot create snapshot temp file", e);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            throw e;
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Startup restore. Only runs when remote snapshots are enabled and no
     * local store exists; a failed restore leaves an empty store behind.
     */
    public RestoreOutcome restoreFromRemoteIfAbsent() {
        RestoreOutcome outcome = doRestoreFromRemote();
        lastRestore = outcome;
        return outcome;
    }

    private RestoreOutcome doRestoreFromRemote() {
        if (!remoteEnabled) return RestoreOutcome.DISABLED;
        if (schema.isInitialized()) {
            log.info("Local store present, skipping remote restore");
            return RestoreOutcome.LOCAL_STORE_PRESENT;
        }
        Path tmp = null;
        try {
            tmp = Files.createTempFile("embedding-index-restore-", ".sql.gz");
            if (!storage.download(remoteKey, tmp)) {
                log.info("No remote snapshot at {}, starting empty", remoteKey);
                return RestoreOutcome.NOT_FOUND;
            }
            restoreFrom(tmp);
            return RestoreOutcome.RESTORED;
        } catch (IOException | RuntimeException e) {
            lastError = e.getMessage();
            log.warn("Remote restore from {} failed, continuing with an empty store: {}", remoteKey, e.getMessage());
            try (StoreLock.Guard ignored = storeLock.acquire()) {
                schema.dropAll();
            } catch (DataAccessException dropError) {
                log.error("Could not clear half-restored store", dropError);
                throw new StorageIOException("Store left in an unknown state after failed restore", dropError);
            }
            return RestoreOutcome.FAILED;
        } finally {
            deleteQuietly(tmp);
        }
    }

    public Map<String, Object> info() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("remote_enabled", remoteEnabled);
        out.put("key", remoteKey);
        out.put("last_backup_at", lastBackupAt == null ? null : lastBackupAt.toString());
        out.put("last_backup_key", lastBackupKey);
        out.put("last_error", lastError);
        out.put("last_restore", lastRestore == null ? null : lastRestore.name());
        return out;
    }

    public boolean isRemoteEnabled() { return remoteEnabled; }
    public Instant getLastBackupAt() { return lastBackupAt; }
    public String getLastError() { return lastError; }

    private static String sqlPath(Path p) {
        String s = p.toAbsolutePath().toString().replace('\\', '/');
        return "'" + s.replace("'", "''") + "'";
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", p, e.getMessage());
        }
    }
}
