package com.issuelake.pipeline.transform;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stateless per-record cleanup: strings are trimmed and blank strings become null.
 * Other values are left alone. Applying it twice gives the same result as once.
 */
public final class RecordNormalizer {

    private RecordNormalizer() {}

    public static Map<String, Object> normalize(Map<String, Object> record) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String s) {
                String trimmed = s.strip();
                value = trimmed.isEmpty() ? null : trimmed;
            }
            out.put(entry.getKey(), value);
        }
        return out;
    }
}
