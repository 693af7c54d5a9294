package com.issuelake.pipeline.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    private static Map<String, Object> sample() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("title", "  Crash on start \t");
        record.put("body", "   ");
        record.put("empty", "");
        record.put("comments", 7L);
        record.put("locked", Boolean.FALSE);
        record.put("closed_at", null);
        return record;
    }

    @Test
    @DisplayName("Strings are trimmed, blank strings become null, other values pass through")
    void normalize() {
        Map<String, Object> out = RecordNormalizer.normalize(sample());

        assertEquals("Crash on start", out.get("title"));
        assertNull(out.get("body"));
        assertNull(out.get("empty"));
        assertEquals(7L, out.get("comments"));
        assertEquals(Boolean.FALSE, out.get("locked"));
        assertTrue(out.containsKey("closed_at"));
        assertEquals(List.of("title", "body", "empty", "comments", "locked", "closed_at"),
                new ArrayList<>(out.keySet()));
    }

    @Test
    @DisplayName("Normalizing twice equals normalizing once")
    void idempotent() {
        Map<String, Object> once = RecordNormalizer.normalize(sample());

        assertEquals(once, RecordNormalizer.normalize(once));
    }

    @Test
    @DisplayName("Input map is not modified")
    void inputUntouched() {
        Map<String, Object> input = sample();

        RecordNormalizer.normalize(input);

        assertEquals("  Crash on start \t", input.get("title"));
    }
}
