package com.issuelake.pipeline.extract;

import com.issuelake.pipeline.config.SourceConfig;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads every local CSV file matching the {@code path} glob option. Values are emitted as strings
 * keyed by header; the resume cursor is ignored.
 */
public class CsvFileExtractor implements RecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CsvFileExtractor.class);

    @Override
    public RecordStream open(SourceConfig source, String since) throws IOException {
        String pattern = source.requiredOption("path");
        List<Path> files = matchFiles(pattern);
        logger.info("Source {} matched {} CSV files for {}", source.name(), files.size(), pattern);
        return new CsvRecordStream(files);
    }

    /**
     * Expands a glob such as {@code data/in/*.csv}. The walk starts at the longest
     * directory prefix without glob characters.
     */
    static List<Path> matchFiles(String pattern) throws IOException {
        Path root = globRoot(pattern);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        String normalized = Path.of(pattern).normalize().toString();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + normalized);
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.normalize()))
                    .sorted()
                    .toList();
        }
    }

    private static Path globRoot(String pattern) {
        Path path = Path.of(pattern).normalize();
        Path root = path.getRoot();
        for (Path part : path) {
            if (part.toString().matches(".*[*?\\[{].*")) {
                break;
            }
            root = root == null ? part : root.resolve(part);
        }
        if (root == null) {
            return Path.of(".");
        }
        return root.equals(path) ? (path.getParent() != null ? path.getParent() : Path.of(".")) : root;
    }

    private static class CsvRecordStream implements RecordStream {

        private final Deque<Path> pending;
        private CSVReader current;
        private String[] header;
        private StopReason stopReason;

        CsvRecordStream(List<Path> files) {
            this.pending = new ArrayDeque<>(files);
        }

        @Override
        public Map<String, Object> nextRecord() throws IOException {
            while (stopReason == null) {
                if (current == null) {
                    Path next = pending.poll();
                    if (next == null) {
                        stopReason = StopReason.EXHAUSTED;
                        return null;
                    }
                    logger.debug("Reading {}", next);
                    current = new CSVReader(Files.newBufferedReader(next));
                    header = readLine();
                    if (header == null) {
                        closeCurrent();
                        continue;
                    }
                }
                String[] line = readLine();
                if (line != null) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < header.length; i++) {
                        row.put(header[i], i < line.length ? line[i] : null);
                    }
                    return row;
                }
                closeCurrent();
            }
            return null;
        }

        private String[] readLine() throws IOException {
            try {
                return current.readNext();
            } catch (CsvValidationException e) {
                throw new IOException("Malformed CSV row: " + e.getMessage(), e);
            }
        }

        private void closeCurrent() throws IOException {
            current.close();
            current = null;
            header = null;
        }

        @Override
        public StopReason stopReason() {
            return stopReason;
        }

        @Override
        public void close() throws IOException {
            if (current != null) {
                closeCurrent();
            }
        }
    }
}
