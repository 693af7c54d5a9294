package com.issuelake.pipeline.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Effective pipeline configuration for a run.
 *
 * @param lakeRoot         root directory of the lake (bronze and silver)
 * @param defaultPartition partition key used for bronze writes
 * @param microBatchSize   number of valid records buffered before a flush
 * @param sources          sources in the order they are processed
 * @param rawDocument      the parsed config document, used for the config hash
 * @param configPath       the file the config was read from, or null when built in code
 */
public record PipelineConfig(
        Path lakeRoot,
        String defaultPartition,
        int microBatchSize,
        List<SourceConfig> sources,
        Map<String, Object> rawDocument,
        Path configPath
) {

    public static final String DEFAULT_PARTITION = "ingest_date";
    public static final int DEFAULT_MICRO_BATCH_SIZE = 5000;

    public PipelineConfig {
        sources = List.copyOf(sources);
        rawDocument = rawDocument == null ? Map.of() : rawDocument;
    }

    public List<SourceConfig> sourcesOfKind(SourceKind kind) {
        return sources.stream().filter(s -> s.kind() == kind).toList();
    }
}
