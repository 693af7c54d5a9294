package com.issuelake.pipeline.extract;

import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.config.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvFileExtractorTest {

    @TempDir
    Path tempDir;

    private SourceConfig source(String pattern) {
        return new SourceConfig("csv", SourceKind.FILE_CSV, Map.of("path", pattern), "bronze/csv", null);
    }

    @Test
    @DisplayName("Reads every matching file in sorted order with header-keyed rows")
    void readsMatchingFiles() throws Exception {
        Files.writeString(tempDir.resolve("b.csv"), "id,name\n3,carol\n");
        Files.writeString(tempDir.resolve("a.csv"), "id,name\n1,alice\n2,bob\n");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        CsvFileExtractor extractor = new CsvFileExtractor();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (RecordStream stream = extractor.open(source(tempDir + "/*.csv"), null)) {
            Map<String, Object> row;
            while ((row = stream.nextRecord()) != null) {
                rows.add(row);
            }
            assertEquals(StopReason.EXHAUSTED, stream.stopReason());
        }

        assertEquals(3, rows.size());
        assertEquals(Map.of("id", "1", "name", "alice"), rows.get(0));
        assertEquals(List.of("id", "name"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals("carol", rows.get(2).get("name"));
    }

    @Test
    @DisplayName("No matching files yields an empty stream")
    void noMatches() throws Exception {
        RecordStream stream = new CsvFileExtractor().open(source(tempDir + "/missing/*.csv"), null);

        assertNull(stream.nextRecord());
        assertEquals(StopReason.EXHAUSTED, stream.stopReason());
    }

    @Test
    @DisplayName("Short rows leave trailing columns null")
    void shortRows() throws Exception {
        Files.writeString(tempDir.resolve("a.csv"), "id,name,extra\n1,alice\n");

        RecordStream stream = new CsvFileExtractor().open(source(tempDir + "/*.csv"), null);
        Map<String, Object> row = stream.nextRecord();

        assertEquals("alice", row.get("name"));
        assertTrue(row.containsKey("extra"));
        assertNull(row.get("extra"));
    }

    @Test
    @DisplayName("Glob matching descends into subdirectories for ** patterns")
    void recursiveGlob() throws Exception {
        Files.createDirectories(tempDir.resolve("2024/01"));
        Files.writeString(tempDir.resolve("2024/01/x.csv"), "id\n1\n");

        List<Path> files = CsvFileExtractor.matchFiles(tempDir + "/**/*.csv");

        assertEquals(List.of(tempDir.resolve("2024/01/x.csv")), files);
    }
}
