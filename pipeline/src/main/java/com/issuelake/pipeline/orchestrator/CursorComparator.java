package com.issuelake.pipeline.orchestrator;

import com.issuelake.pipeline.validate.SchemaValidator;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Orders checkpoint cursors. Two ISO-8601 timestamps compare as instants; anything else
 * compares as plain strings.
 */
final class CursorComparator implements Comparator<String> {

    static final CursorComparator INSTANCE = new CursorComparator();

    private CursorComparator() {}

    @Override
    public int compare(String left, String right) {
        Instant leftTs = tryParse(left);
        Instant rightTs = tryParse(right);
        if (leftTs != null && rightTs != null) {
            return leftTs.compareTo(rightTs);
        }
        return left.compareTo(right);
    }

    /**
     * The larger of the two cursors; a null current value always loses.
     */
    static String max(String current, String candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null) {
            return candidate;
        }
        return INSTANCE.compare(candidate, current) > 0 ? candidate : current;
    }

    private static Instant tryParse(String value) {
        try {
            return SchemaValidator.parseTimestamp(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
