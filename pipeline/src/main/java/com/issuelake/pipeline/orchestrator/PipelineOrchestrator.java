package com.issuelake.pipeline.orchestrator;

import com.issuelake.pipeline.config.PipelineConfig;
import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.config.SourceKind;
import com.issuelake.pipeline.extract.ExtractorRegistry;
import com.issuelake.pipeline.extract.RecordStream;
import com.issuelake.pipeline.loader.ParquetLakeWriter;
import com.issuelake.pipeline.loader.WriteResult;
import com.issuelake.pipeline.silver.GitHubIssuesSilverBuilder;
import com.issuelake.pipeline.silver.SilverMetadata;
import com.issuelake.pipeline.state.CheckpointStore;
import com.issuelake.pipeline.transform.RecordNormalizer;
import com.issuelake.pipeline.validate.SchemaValidator;
import com.issuelake.pipeline.validate.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one extract → normalize → validate → write pass per configured source, then builds
 * the GitHub issues silver snapshot.
 *
 * <p>A source's checkpoint only moves when its whole pass succeeds. Batches flushed before a
 * failure stay in the lake; the unflushed buffer is dropped. A failing source never stops the
 * sources after it.</p>
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String META_ROWS_SEEN = "rows_seen";
    static final String META_BAD_ROWS = "bad_rows";

    private final PipelineConfig config;
    private final ExtractorRegistry extractors;
    private final SchemaValidator validator;
    private final ParquetLakeWriter lakeWriter;
    private final CheckpointStore checkpoints;
    private final GitHubIssuesSilverBuilder silverBuilder;

    public PipelineOrchestrator(PipelineConfig config, ExtractorRegistry extractors, SchemaValidator validator,
                                ParquetLakeWriter lakeWriter, CheckpointStore checkpoints,
                                GitHubIssuesSilverBuilder silverBuilder) {
        this.config = config;
        this.extractors = extractors;
        this.validator = validator;
        this.lakeWriter = lakeWriter;
        this.checkpoints = checkpoints;
        this.silverBuilder = silverBuilder;
    }

    public PipelineSummary run() {
        Instant runStart = Instant.now();
        logger.info("Starting pipeline run: {} sources, lake={}", config.sources().size(), config.lakeRoot());

        List<SourcePassResult> results = new ArrayList<>();
        for (SourceConfig source : config.sources()) {
            results.add(runSource(source));
        }

        SilverMetadata silver = null;
        List<SourceConfig> githubSources = config.sourcesOfKind(SourceKind.HTTP_GITHUB);
        if (!githubSources.isEmpty()) {
            silver = buildSilver(githubSources);
        }

        long duration = Duration.between(runStart, Instant.now()).toMillis();
        logger.info("Pipeline run finished in {}ms", duration);
        return new PipelineSummary(results, silver, duration);
    }

    /**
     * One full pass over a single source. Never throws.
     */
    SourcePassResult runSource(SourceConfig source) {
        long start = System.currentTimeMillis();
        String name = source.name();
        logger.info("=== Source: {} ({}) ===", name, source.kind().tag());
        transition(name, PassStatus.START);

        PassState state = new PassState();
        String checkpointBefore = null;
        try {
            checkpointBefore = checkpoints.get(name);
            state.maxCursor = checkpointBefore;
            consume(source, checkpointBefore, state);

            if (!state.buffer.isEmpty()) {
                flush(source, state);
            }
            if (source.hasCheckpointKey() && state.maxCursor != null) {
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(META_ROWS_SEEN, state.rowsSeen);
                meta.put(META_BAD_ROWS, state.rowsRejected);
                checkpoints.set(name, state.maxCursor, meta);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.error("Source {} failed after {} rows", name, state.rowsSeen, e);
            if (!state.buffer.isEmpty()) {
                logger.warn("Discarding {} buffered rows for {} due to earlier failure", state.buffer.size(), name);
                state.buffer.clear();
            }
            transition(name, PassStatus.FAILED);
            logSummary(PassStatus.FAILED, state, checkpointBefore, checkpointBefore);
            return SourcePassResult.failed(name, state.rowsSeen, state.rowsRejected, state.rowsWritten,
                    new ArrayList<>(state.partitions), checkpointBefore, e.getMessage(),
                    System.currentTimeMillis() - start);
        }

        String checkpointAfter = source.hasCheckpointKey() ? state.maxCursor : checkpointBefore;
        transition(name, PassStatus.COMPLETED);
        logSummary(PassStatus.COMPLETED, state, checkpointBefore, checkpointAfter);
        return SourcePassResult.completed(name, state.rowsSeen, state.rowsRejected, state.rowsWritten,
                new ArrayList<>(state.partitions), checkpointBefore, checkpointAfter,
                System.currentTimeMillis() - start);
    }

    private void consume(SourceConfig source, String since, PassState state)
            throws IOException, InterruptedException {
        transition(source.name(), PassStatus.EXTRACTING);
        try (RecordStream stream = extractors.forKind(source.kind()).open(source, since)) {
            Map<String, Object> raw;
            while ((raw = stream.nextRecord()) != null) {
                state.rowsSeen++;
                Map<String, Object> validated;
                try {
                    validated = validator.validate(source, RecordNormalizer.normalize(raw));
                } catch (ValidationException e) {
                    state.rowsRejected++;
                    logger.warn("Validation failed for {}: {}", source.name(), e.getMessage());
                    continue;
                }

                if (source.hasCheckpointKey()) {
                    Object cursor = validated.get(source.checkpointKey());
                    if (cursor != null) {
                        state.maxCursor = CursorComparator.max(state.maxCursor, cursor.toString());
                    }
                }

                state.buffer.add(validated);
                if (state.buffer.size() >= config.microBatchSize()) {
                    flush(source, state);
                }
            }
            logger.debug("Source {} stream ended: {}", source.name(), stream.stopReason());
        }
    }

    private void flush(SourceConfig source, PassState state) throws IOException {
        transition(source.name(), PassStatus.FLUSHING);
        WriteResult result = lakeWriter.write(new ArrayList<>(state.buffer), config.lakeRoot(),
                source.destination(), config.defaultPartition());
        state.buffer.clear();
        state.rowsWritten += result.rowsWritten();
        state.partitions.addAll(result.partitions());
        logger.info("Wrote {} rows to {} partitions={}", result.rowsWritten(), source.destination(),
                result.partitions());
        transition(source.name(), PassStatus.EXTRACTING);
    }

    private SilverMetadata buildSilver(List<SourceConfig> githubSources) {
        try {
            SilverMetadata meta = silverBuilder.build(githubSources, config);
            if (meta != null) {
                Map<String, Integer> splits = meta.quality().splitRows();
                logger.info("GitHub silver build completed rows={} train={} val={} test={} duplicates_removed={}",
                        meta.totalRows(), splits.getOrDefault("train", 0), splits.getOrDefault("val", 0),
                        splits.getOrDefault("test", 0), meta.quality().duplicatesRemoved());
            }
            return meta;
        } catch (Exception e) {
            logger.error("Failed to build GitHub silver layer", e);
            return null;
        }
    }

    private static void transition(String source, PassStatus status) {
        logger.debug("Source {} -> {}", source, status);
    }

    private static void logSummary(PassStatus status, PassState state, String before, String after) {
        logger.info("SUMMARY[{}]: seen={} bad={} checkpoint_before={} checkpoint_after={}",
                status, state.rowsSeen, state.rowsRejected, before, after);
    }

    private static final class PassState {
        int rowsSeen;
        int rowsRejected;
        int rowsWritten;
        String maxCursor;
        final List<Map<String, Object>> buffer = new ArrayList<>();
        final Set<String> partitions = new LinkedHashSet<>();
    }
}
