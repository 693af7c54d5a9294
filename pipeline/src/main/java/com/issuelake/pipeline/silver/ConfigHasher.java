package com.issuelake.pipeline.silver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 over the key-sorted JSON of the effective config and the path it came from.
 */
public final class ConfigHasher {

    private ConfigHasher() {}

    private static final ObjectMapper SORTED = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static String hash(Map<String, Object> config, Path configPath) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("config", config != null ? config : Map.of());
        payload.put("config_path", configPath != null ? configPath.toString() : null);
        try {
            return sha256Hex(SORTED.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Config is not serializable", e);
        }
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
