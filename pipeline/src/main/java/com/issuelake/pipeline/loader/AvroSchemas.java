package com.issuelake.pipeline.loader;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Avro record schemas for lake files. Bronze schemas are inferred from the batch being
 * written; every field is nullable.
 */
public final class AvroSchemas {

    private AvroSchemas() {}

    static final String BRONZE_NAMESPACE = "com.issuelake.bronze";

    enum ColumnType { LONG, DOUBLE, BOOLEAN, STRING }

    /**
     * Column name to Avro field name, in first-seen order.
     */
    public static Map<String, String> fieldNames(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String column : columns) {
            String candidate = sanitize(column);
            String name = candidate;
            int suffix = 1;
            while (!used.add(name)) {
                name = candidate + "_" + suffix++;
            }
            names.put(column, name);
        }
        return names;
    }

    public static Schema inferRecordSchema(String recordName, List<Map<String, Object>> rows) {
        Map<String, String> names = fieldNames(rows);
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(sanitize(recordName))
                .namespace(BRONZE_NAMESPACE)
                .fields();
        for (Map.Entry<String, String> column : names.entrySet()) {
            String name = column.getValue();
            switch (resolveType(rows, column.getKey())) {
                case LONG -> fields = fields.optionalLong(name);
                case DOUBLE -> fields = fields.optionalDouble(name);
                case BOOLEAN -> fields = fields.optionalBoolean(name);
                default -> fields = fields.optionalString(name);
            }
        }
        return fields.endRecord();
    }

    static ColumnType resolveType(List<Map<String, Object>> rows, String column) {
        boolean sawValue = false;
        boolean allIntegral = true;
        boolean allNumeric = true;
        boolean allBoolean = true;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                continue;
            }
            sawValue = true;
            boolean integral = value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte;
            allIntegral &= integral;
            allNumeric &= integral || value instanceof Double || value instanceof Float;
            allBoolean &= value instanceof Boolean;
        }
        if (!sawValue) {
            return ColumnType.STRING;
        }
        if (allIntegral) {
            return ColumnType.LONG;
        }
        if (allNumeric) {
            return ColumnType.DOUBLE;
        }
        return allBoolean ? ColumnType.BOOLEAN : ColumnType.STRING;
    }

    /**
     * Converts a row value to what the field's Avro type expects.
     */
    static Object toAvroValue(Schema fieldSchema, Object value) {
        if (value == null) {
            return null;
        }
        Schema.Type type = nonNullType(fieldSchema).getType();
        return switch (type) {
            case LONG -> ((Number) value).longValue();
            case DOUBLE -> ((Number) value).doubleValue();
            case INT -> ((Number) value).intValue();
            case BOOLEAN -> value;
            default -> value.toString();
        };
    }

    static Schema nonNullType(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) {
            return schema;
        }
        for (Schema member : schema.getTypes()) {
            if (member.getType() != Schema.Type.NULL) {
                return member;
            }
        }
        return schema;
    }

    static String sanitize(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (cleaned.isEmpty() || Character.isDigit(cleaned.charAt(0))) {
            cleaned = "_" + cleaned;
        }
        return cleaned;
    }
}
