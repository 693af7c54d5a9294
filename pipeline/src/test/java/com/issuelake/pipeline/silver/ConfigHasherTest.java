package com.issuelake.pipeline.silver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigHasherTest {

    private static Map<String, Object> config(boolean reversed) {
        Map<String, Object> source = new LinkedHashMap<>();
        Map<String, Object> doc = new LinkedHashMap<>();
        if (reversed) {
            source.put("kind", "http.github");
            source.put("name", "gh");
            doc.put("sources", List.of(source));
            doc.put("lake_root", "./lake");
        } else {
            source.put("name", "gh");
            source.put("kind", "http.github");
            doc.put("lake_root", "./lake");
            doc.put("sources", List.of(source));
        }
        return doc;
    }

    @Test
    @DisplayName("Hash ignores key order and is 64 hex characters")
    void stableAcrossKeyOrder() {
        String a = ConfigHasher.hash(config(false), Path.of("config.yaml"));
        String b = ConfigHasher.hash(config(true), Path.of("config.yaml"));

        assertEquals(a, b);
        assertTrue(a.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("Config path is part of the hash")
    void pathMatters() {
        assertNotEquals(ConfigHasher.hash(config(false), Path.of("a.yaml")),
                ConfigHasher.hash(config(false), Path.of("b.yaml")));
        assertNotEquals(ConfigHasher.hash(config(false), null),
                ConfigHasher.hash(config(false), Path.of("a.yaml")));
    }

    @Test
    @DisplayName("SHA-256 of a known value")
    void knownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ConfigHasher.sha256Hex("abc"));
    }
}
