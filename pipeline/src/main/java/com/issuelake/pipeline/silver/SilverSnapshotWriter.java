package com.issuelake.pipeline.silver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.issuelake.pipeline.loader.ParquetFiles;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Writes one silver snapshot: a timestamped run directory plus a {@code latest} copy.
 *
 * <p>{@code latest} is staged in a sibling directory and renamed into place, so readers never
 * see it half written.</p>
 */
public class SilverSnapshotWriter {

    private static final Logger logger = LoggerFactory.getLogger(SilverSnapshotWriter.class);

    static final String LATEST = "latest";
    static final String META_FILE = "_meta.json";
    static final String DATA_FILE = "data.parquet";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param silverRoot directory holding {@code run_ts=...} and {@code latest}
     * @param runStamp   run timestamp, used for the run directory name
     * @param splits     split name to rows, in {@link FeatureSchema#outputColumns()} layout; empty splits are not written
     * @return the run directory
     */
    public Path write(Path silverRoot, String runStamp, Map<String, List<Map<String, Object>>> splits,
                      SilverMetadata metadata) throws IOException {
        Schema schema = FeatureSchema.silverSchema();
        Path runDir = silverRoot.resolve("run_ts=" + runStamp);
        Path staging = silverRoot.resolve(".latest-staging-" + runStamp);

        Files.createDirectories(runDir);
        deleteRecursively(staging);
        Files.createDirectories(staging);

        for (Map.Entry<String, List<Map<String, Object>>> split : splits.entrySet()) {
            if (split.getValue().isEmpty()) {
                continue;
            }
            String splitDir = "split=" + split.getKey();
            for (Path target : List.of(runDir, staging)) {
                Path dir = Files.createDirectories(target.resolve(splitDir));
                ParquetFiles.write(dir.resolve(DATA_FILE), schema, split.getValue());
            }
        }
        objectMapper.writeValue(runDir.resolve(META_FILE).toFile(), metadata);
        objectMapper.writeValue(staging.resolve(META_FILE).toFile(), metadata);

        swapLatest(silverRoot, staging, runStamp);
        logger.info("Silver snapshot written to {} ({} rows)", runDir, metadata.totalRows());
        return runDir;
    }

    private void swapLatest(Path silverRoot, Path staging, String runStamp) throws IOException {
        Path latest = silverRoot.resolve(LATEST);
        Path retired = silverRoot.resolve(".latest-retired-" + runStamp);
        if (Files.exists(latest)) {
            deleteRecursively(retired);
            Files.move(latest, retired, StandardCopyOption.ATOMIC_MOVE);
        }
        Files.move(staging, latest, StandardCopyOption.ATOMIC_MOVE);
        deleteRecursively(retired);
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }
}
