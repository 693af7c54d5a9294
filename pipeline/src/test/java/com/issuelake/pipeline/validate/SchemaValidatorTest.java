package com.issuelake.pipeline.validate;

import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.config.SourceKind;
import com.issuelake.pipeline.model.GitHubIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SchemaValidator} dispatch, coercion and error reporting.
 */
class SchemaValidatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final SchemaValidator validator = new SchemaValidator(Clock.fixed(NOW, ZoneOffset.UTC));

    private static final SourceConfig GITHUB = new SourceConfig("gh", SourceKind.HTTP_GITHUB,
            Map.of("owner", "o", "repo", "r"), "bronze/github/issues", "updated_at");
    private static final SourceConfig CSV = new SourceConfig("csv", SourceKind.FILE_CSV,
            Map.of("path", "*.csv"), "bronze/csv", null);

    private static Map<String, Object> issue() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", 101L);
        record.put("number", 1L);
        record.put("title", "Crash");
        record.put("state", "open");
        record.put("user.login", "alice");
        record.put("comments", 3L);
        record.put("created_at", "2024-01-01T00:00:00Z");
        record.put("updated_at", "2024-01-02T10:00:00+02:00");
        record.put("closed_at", null);
        record.put("repo_owner", "o");
        record.put("repo_name", "r");
        return record;
    }

    // =========================================================================
    // GitHub issues
    // =========================================================================

    @Test
    @DisplayName("GitHub record is emitted in schema order with ingest_ts last")
    void githubRow() throws Exception {
        Map<String, Object> row = validator.validate(GITHUB, issue());

        assertEquals(List.of("id", "number", "title", "state", "user_login", "comments", "created_at",
                "updated_at", "closed_at", "repo_owner", "repo_name", "ingest_ts"), new ArrayList<>(row.keySet()));
        assertEquals("alice", row.get("user_login"));
        assertEquals("2024-01-02T08:00:00Z", row.get("updated_at"));
        assertEquals(NOW.toString(), row.get(SchemaValidator.INGEST_TS));
    }

    @Test
    @DisplayName("Integral strings and floats are coerced, booleans are rejected")
    void coercion() throws Exception {
        Map<String, Object> record = issue();
        record.put("id", "101");
        record.put("comments", 4.0);

        GitHubIssue parsed = SchemaValidator.toGitHubIssue(record);
        assertEquals(101L, parsed.id());
        assertEquals(4L, parsed.comments());

        record.put("comments", true);
        assertThrows(ValidationException.class, () -> SchemaValidator.toGitHubIssue(record));
    }

    @Test
    @DisplayName("user_login is accepted as an alias of user.login")
    void loginAlias() throws Exception {
        Map<String, Object> record = issue();
        record.remove("user.login");
        record.put("user_login", "bob");

        assertEquals("bob", SchemaValidator.toGitHubIssue(record).userLogin());
    }

    @Test
    @DisplayName("Comment counts beyond the int range are kept, beyond long are rejected")
    void largeCommentCount() throws Exception {
        Map<String, Object> record = issue();
        record.put("comments", 3_000_000_000L);

        Map<String, Object> row = validator.validate(GITHUB, record);
        assertEquals(3_000_000_000L, row.get("comments"));

        record.put("comments", "100000000000000000000");
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(GITHUB, record));
        assertTrue(ex.getMessage().contains("comments: not a valid integer"));
    }

    @Test
    @DisplayName("All field errors are reported together")
    void multipleErrors() {
        Map<String, Object> record = issue();
        record.remove("title");
        record.put("created_at", "yesterday");

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(GITHUB, record));

        assertTrue(ex.getMessage().contains("title: field required"));
        assertTrue(ex.getMessage().contains("created_at"));
    }

    @Test
    @DisplayName("Local date-times without offset are treated as UTC")
    void localDateTime() {
        assertEquals(Instant.parse("2024-01-01T05:00:00Z"), SchemaValidator.parseTimestamp("2024-01-01T05:00:00"));
    }

    // =========================================================================
    // Pass-through kinds
    // =========================================================================

    @Test
    @DisplayName("CSV records pass through with ingest_ts added")
    void csvPassThrough() throws Exception {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("a", "1");
        record.put("b", null);

        Map<String, Object> row = validator.validate(CSV, record);

        assertEquals("1", row.get("a"));
        assertTrue(row.containsKey("b"));
        assertEquals(NOW.toString(), row.get("ingest_ts"));
        assertFalse(record.containsKey("ingest_ts"));
    }
}
