package com.issuelake.pipeline.validate;

import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.model.GitHubIssue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coerces raw records into the fixed schema of their source kind and stamps {@code ingest_ts}.
 * Kinds without a schema are passed through unchanged apart from the stamp.
 */
public class SchemaValidator {

    public static final String INGEST_TS = "ingest_ts";

    private final Clock clock;

    public SchemaValidator() {
        this(Clock.systemUTC());
    }

    public SchemaValidator(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> validate(SourceConfig source, Map<String, Object> record)
            throws ValidationException {
        Map<String, Object> row = switch (source.kind()) {
            case HTTP_GITHUB -> toGitHubIssue(record).toRow();
            case FILE_CSV -> new LinkedHashMap<>(record);
        };
        row.put(INGEST_TS, Instant.now(clock).toString());
        return row;
    }

    /**
     * Maps a flattened API record onto {@link GitHubIssue}. Every missing or malformed
     * field is reported in one message.
     */
    public static GitHubIssue toGitHubIssue(Map<String, Object> record) throws ValidationException {
        FieldErrors errors = new FieldErrors();

        Long id = errors.requiredLong(record, "id");
        Long number = errors.requiredLong(record, "number");
        String title = errors.requiredString(record, "title");
        String state = errors.requiredString(record, "state");
        Object login = record.containsKey("user.login") ? record.get("user.login") : record.get("user_login");
        String userLogin = errors.requiredString("user.login", login);
        Long comments = errors.requiredLong(record, "comments");
        Instant createdAt = errors.requiredInstant(record, "created_at");
        Instant updatedAt = errors.requiredInstant(record, "updated_at");
        Instant closedAt = errors.optionalInstant(record, "closed_at");
        String repoOwner = optionalString(record.get("repo_owner"));
        String repoName = optionalString(record.get("repo_name"));

        errors.throwIfAny();

        return new GitHubIssue(id, number, title, state, userLogin, comments,
                createdAt, updatedAt, closedAt, repoOwner, repoName);
    }

    /**
     * Parses ISO-8601 date-times. Values without an offset are taken as UTC.
     */
    public static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }

    private static String optionalString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static final class FieldErrors {

        private final List<String> messages = new ArrayList<>();

        Long requiredLong(Map<String, Object> record, String field) {
            Object value = record.get(field);
            if (value == null) {
                messages.add(field + ": field required");
                return null;
            }
            Long parsed = coerceLong(value);
            if (parsed == null) {
                messages.add(field + ": not a valid integer (" + value + ")");
            }
            return parsed;
        }

        String requiredString(Map<String, Object> record, String field) {
            return requiredString(field, record.get(field));
        }

        String requiredString(String field, Object value) {
            if (value == null) {
                messages.add(field + ": field required");
                return null;
            }
            if (!(value instanceof CharSequence)) {
                messages.add(field + ": not a string (" + value + ")");
                return null;
            }
            return value.toString();
        }

        Instant requiredInstant(Map<String, Object> record, String field) {
            if (record.get(field) == null) {
                messages.add(field + ": field required");
                return null;
            }
            return optionalInstant(record, field);
        }

        Instant optionalInstant(Map<String, Object> record, String field) {
            Object value = record.get(field);
            if (value == null) {
                return null;
            }
            if (value instanceof Instant instant) {
                return instant;
            }
            try {
                return parseTimestamp(value.toString());
            } catch (DateTimeParseException e) {
                messages.add(field + ": not a valid datetime (" + value + ")");
                return null;
            }
        }

        void throwIfAny() throws ValidationException {
            if (!messages.isEmpty()) {
                throw new ValidationException(String.join("; ", messages));
            }
        }

        private static Long coerceLong(Object value) {
            if (value instanceof Boolean) {
                return null;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return ((Number) value).longValue();
            }
            try {
                BigDecimal decimal = value instanceof Number number
                        ? new BigDecimal(number.toString())
                        : new BigDecimal(value.toString().trim());
                return decimal.longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
    }
}
