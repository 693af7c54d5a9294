package com.issuelake.pipeline.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CheckpointStore} against a real SQLite file.
 */
class CheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(CheckpointStore.sqliteDataSource(tempDir.resolve("state.db").toString()));
        store = new CheckpointStore(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("get returns null for an unknown source")
    void unknownSource() {
        assertNull(store.get("missing"));
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    @DisplayName("set then get returns the cursor, meta and update time")
    void setAndGet() {
        store.set("gh", "2024-01-02T00:00:00Z", Map.of("rows_seen", 10, "bad_rows", 1));

        assertEquals("2024-01-02T00:00:00Z", store.get("gh"));
        Optional<Checkpoint> checkpoint = store.find("gh");
        assertTrue(checkpoint.isPresent());
        assertEquals(10, checkpoint.get().meta().get("rows_seen"));
        assertEquals(1, checkpoint.get().meta().get("bad_rows"));
        assertEquals(NOW, checkpoint.get().updatedAt());
    }

    @Test
    @DisplayName("set overwrites the single row for a source")
    void overwrite() {
        store.set("gh", "a", Map.of());
        store.set("gh", "b", Map.of());
        store.set("other", "z", Map.of());

        assertEquals("b", store.get("gh"));
        assertEquals(2, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM state", Integer.class));
    }

    @Test
    @DisplayName("Checkpoints survive reopening the database")
    void durable() {
        store.set("gh", "c1", Map.of());

        CheckpointStore reopened = new CheckpointStore(tempDir.resolve("state.db").toString());

        assertEquals("c1", reopened.get("gh"));
    }

    @Test
    @DisplayName("Storage errors propagate from set")
    void storageErrorPropagates() {
        jdbcTemplate.execute("DROP TABLE state");

        assertThrows(DataAccessException.class, () -> store.set("gh", "c1", Map.of()));
    }
}
