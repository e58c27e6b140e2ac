package com.example.embeddingindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Owns the on-disk layout. A store written under a different layout version,
 * or for a different embedding dimension, is dropped and recreated; there is
 * no migration path.
 */
@Component
public class SchemaVersionManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaVersionManager.class);

    /** Bump whenever a table definition below changes. */
    public static final int CURRENT_VERSION = 3;

    public enum OpenResult { CREATED, OPENED, RESET }

    static final List<String> CREATE_STATEMENTS = List.of(
            "CREATE TABLE IF NOT EXISTS schema_version ("
                    + "id INT PRIMARY KEY, version INT NOT NULL, dimension INT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS projects ("
                    + "project_id VARCHAR(128) PRIMARY KEY, created_at BIGINT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS identity_mapping ("
                    + "internal_id BIGINT PRIMARY KEY, project_id VARCHAR(128) NOT NULL, item_id VARCHAR(255) NOT NULL, "
                    + "CONSTRAINT uq_identity_project_item UNIQUE (project_id, item_id))",
            "CREATE TABLE IF NOT EXISTS item_records ("
                    + "internal_id BIGINT PRIMARY KEY, blob_key VARCHAR(1024) NOT NULL, content_type VARCHAR(255) NOT NULL, "
                    + "original_filename VARCHAR(1024), size_bytes BIGINT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS item_vectors ("
                    + "internal_id BIGINT PRIMARY KEY, embedding VARBINARY NOT NULL)",
            "CREATE SEQUENCE IF NOT EXISTS internal_id_seq START WITH 1 INCREMENT BY 1"
    );

    static final List<String> DROP_STATEMENTS = List.of(
            "DROP TABLE IF EXISTS item_vectors",
            "DROP TABLE IF EXISTS item_records",
            "DROP TABLE IF EXISTS identity_mapping",
            "DROP TABLE IF EXISTS projects",
            "DROP TABLE IF EXISTS schema_version",
            "DROP SEQUENCE IF EXISTS internal_id_seq"
    );

    private final JdbcTemplate jdbc;

    public SchemaVersionManager(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Whether a store already exists at the configured location.
     */
    public boolean isInitialized() {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE UPPER(TABLE_NAME) = 'SCHEMA_VERSION'",
                Integer.class);
        return n != null && n > 0;
    }

    public OpenResult openOrInitialize(int dimension) {
        if (dimension < 1) throw new IllegalArgumentException("dimension must be >= 1");
        if (!isInitialized()) {
            createAll(dimension);
            log.info("Initialized new store (schema version {}, dimension {})", CURRENT_VERSION, dimension);
            return OpenResult.CREATED;
        }
        List<int[]> rows = jdbc.query("SELECT version, dimension FROM schema_version WHERE id = 1",
                (rs, i) -> new int[]{rs.getInt(1), rs.getInt(2)});
        if (rows.isEmpty()) {
            log.warn("Store has no schema version tag; DROPPING ALL TABLES and starting empty");
            dropAll();
            createAll(dimension);
            return OpenResult.RESET;
        }
        int storedVersion = rows.get(0)[0];
        int storedDimension = rows.get(0)[1];
        if (storedVersion != CURRENT_VERSION || storedDimension != dimension) {
            log.warn("Incompatible store layout (version {} dim {}, expected version {} dim {}); "
                            + "DROPPING ALL TABLES. Every indexed item in this store is discarded.",
                    storedVersion, storedDimension, CURRENT_VERSION, dimension);
            dropAll();
            createAll(dimension);
            return OpenResult.RESET;
        }
        // tables added after the tag was written are created here
        CREATE_STATEMENTS.forEach(jdbc::execute);
        log.info("Opened store (schema version {}, dimension {})", storedVersion, storedDimension);
        return OpenResult.OPENED;
    }

    public int storedVersion() {
        Integer v = jdbc.queryForObject("SELECT version FROM schema_version WHERE id = 1", Integer.class);
        return v == null ? -1 : v;
    }

    public void dropAll() {
        DROP_STATEMENTS.forEach(jdbc::execute);
    }

    private void createAll(int dimension) {
        CREATE_STATEMENTS.forEach(jdbc::execute);
        jdbc.update("MERGE INTO schema_version (id, version, dimension) KEY (id) VALUES (1, ?, ?)",
                CURRENT_VERSION, dimension);
    }
}
