package com.example.embeddingindex;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:schema-test;DB_CLOSE_DELAY=-1")
public class SchemaVersionManagerTest {

    @Autowired
    private SchemaVersionManager schema;

    @Autowired
    private EmbeddingStore store;

    @Autowired
    private JdbcTemplate jdbc;

    @AfterEach
    public void reopen() {
        schema.openOrInitialize(2);
        store.open(2);
    }

    private long rows(String table) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return n == null ? 0 : n;
    }

    @Test
    public void bootstrapWritesTheCurrentTag() {
        assertThat(schema.isInitialized()).isTrue();
        assertThat(schema.storedVersion()).isEqualTo(SchemaVersionManager.CURRENT_VERSION);
    }

    @Test
    public void matchingTagKeepsData() {
        store.upsertItem(new StoredItem("keep", "a", "k", "image/png", null, 1), new float[]{1f, 0f});

        assertThat(schema.openOrInitialize(2)).isEqualTo(SchemaVersionManager.OpenResult.OPENED);
        assertThat(rows("item_records")).isGreaterThan(0);
    }

    @Test
    public void differentVersionDropsEverything() {
        store.upsertItem(new StoredItem("old", "a", "k", "image/png", null, 1), new float[]{1f, 0f});
        jdbc.update("UPDATE schema_version SET version = ? WHERE id = 1", SchemaVersionManager.CURRENT_VERSION - 1);

        assertThat(schema.openOrInitialize(2)).isEqualTo(SchemaVersionManager.OpenResult.RESET);

        assertThat(rows("projects")).isZero();
        assertThat(rows("identity_mapping")).isZero();
        assertThat(rows("item_records")).isZero();
        assertThat(rows("item_vectors")).isZero();
        assertThat(schema.storedVersion()).isEqualTo(SchemaVersionManager.CURRENT_VERSION);
    }

    @Test
    public void differentDimensionDropsEverything() {
        store.upsertItem(new StoredItem("dim", "a", "k", "image/png", null, 1), new float[]{1f, 0f});

        assertThat(schema.openOrInitialize(3)).isEqualTo(SchemaVersionManager.OpenResult.RESET);
        assertThat(rows("item_vectors")).isZero();
        assertThat(jdbc.queryForObject("SELECT dimension FROM schema_version WHERE id = 1", Integer.class)).isEqualTo(3);
    }

    @Test
    public void missingTagRowResets() {
        jdbc.update("DELETE FROM schema_version");
        assertThat(schema.openOrInitialize(2)).isEqualTo(SchemaVersionManager.OpenResult.RESET);
        assertThat(schema.storedVersion()).isEqualTo(SchemaVersionManager.CURRENT_VERSION);
    }

    @Test
    public void dropAllRemovesTheStore() {
        schema.dropAll();
        assertThat(schema.isInitialized()).isFalse();
        assertThat(schema.openOrInitialize(2)).isEqualTo(SchemaVersionManager.OpenResult.CREATED);
    }
}
