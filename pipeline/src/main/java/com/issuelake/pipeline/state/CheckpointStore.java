package com.issuelake.pipeline.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable source-to-cursor mapping kept in a single SQLite table, one row per source.
 * Storage errors are not caught here: a failed {@link #set} must fail the caller's pass.
 */
public class CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointStore.class);

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS state(
                source TEXT PRIMARY KEY,
                checkpoint TEXT,
                meta TEXT,
                updated_at INTEGER
            )""";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public CheckpointStore(String dbPath) {
        this(new JdbcTemplate(sqliteDataSource(dbPath)), Clock.systemUTC());
    }

    CheckpointStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        jdbcTemplate.execute(CREATE_TABLE);
    }

    static DriverManagerDataSource sqliteDataSource(String dbPath) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }

    /**
     * @return the stored cursor for the source, or {@code null} if none was committed yet
     */
    public String get(String source) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT checkpoint FROM state WHERE source = ?", String.class, source);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Optional<Checkpoint> find(String source) {
        List<Checkpoint> rows = jdbcTemplate.query(
                "SELECT source, checkpoint, meta, updated_at FROM state WHERE source = ?",
                (rs, rowNum) -> new Checkpoint(
                        rs.getString("source"),
                        rs.getString("checkpoint"),
                        readMeta(rs.getString("meta")),
                        Instant.ofEpochSecond(rs.getLong("updated_at"))),
                source);
        return rows.stream().findFirst();
    }

    /**
     * Replaces the row for {@code source}, recording the current time as {@code updated_at}.
     */
    public void set(String source, String cursor, Map<String, Object> meta) {
        long updatedAt = Instant.now(clock).getEpochSecond();
        jdbcTemplate.update(
                "INSERT OR REPLACE INTO state(source, checkpoint, meta, updated_at) VALUES (?, ?, ?, ?)",
                source, cursor, writeMeta(meta), updatedAt);
        logger.info("Checkpoint for {} set to {}", source, cursor);
    }

    private String writeMeta(Map<String, Object> meta) {
        try {
            return objectMapper.writeValueAsString(meta != null ? meta : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Checkpoint meta is not serializable: " + meta, e);
        }
    }

    private Map<String, Object> readMeta(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored checkpoint meta is not valid JSON: " + json, e);
        }
    }
}
