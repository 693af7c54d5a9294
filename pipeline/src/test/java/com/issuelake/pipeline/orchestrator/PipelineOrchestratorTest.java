package com.issuelake.pipeline.orchestrator;

import com.issuelake.pipeline.config.PipelineConfig;
import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.config.SourceKind;
import com.issuelake.pipeline.extract.ExtractorRegistry;
import com.issuelake.pipeline.extract.RecordExtractor;
import com.issuelake.pipeline.extract.RecordStream;
import com.issuelake.pipeline.extract.StopReason;
import com.issuelake.pipeline.loader.ParquetLakeWriter;
import com.issuelake.pipeline.loader.WriteResult;
import com.issuelake.pipeline.silver.GitHubIssuesSilverBuilder;
import com.issuelake.pipeline.state.CheckpointStore;
import com.issuelake.pipeline.validate.SchemaValidator;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link PipelineOrchestrator} per-source passes: checkpoint monotonicity,
 * failure isolation, micro-batch flushing and the silver hand-off.
 */
@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final Path LAKE = Path.of("lake");

    @Mock
    private ParquetLakeWriter lakeWriter;

    @Mock
    private CheckpointStore checkpoints;

    @Mock
    private GitHubIssuesSilverBuilder silverBuilder;

    @Captor
    private ArgumentCaptor<List<Map<String, Object>>> batchCaptor;

    private final Map<String, RecordStream> streams = new HashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        lenient().when(lakeWriter.write(anyList(), any(), anyString(), anyString()))
                .thenAnswer(inv -> new WriteResult(((List<?>) inv.getArgument(0)).size(), List.of("2024-01-01")));
    }

    private PipelineOrchestrator orchestrator(int batchSize, SourceConfig... sources) {
        RecordExtractor byName = (source, since) -> {
            RecordStream stream = streams.get(source.name());
            if (stream == null) {
                throw new IOException("cannot open " + source.name());
            }
            return stream;
        };
        Map<SourceKind, RecordExtractor> extractors = new EnumMap<>(SourceKind.class);
        extractors.put(SourceKind.HTTP_GITHUB, byName);
        extractors.put(SourceKind.FILE_CSV, byName);
        PipelineConfig config = new PipelineConfig(LAKE, "ingest_date", batchSize, List.of(sources), Map.of(), null);
        return new PipelineOrchestrator(config, new ExtractorRegistry(extractors), new SchemaValidator(),
                lakeWriter, checkpoints, silverBuilder);
    }

    private static SourceConfig csvSource(String name, String checkpointKey) {
        return new SourceConfig(name, SourceKind.FILE_CSV, Map.of("path", "*.csv"), "bronze/" + name, checkpointKey);
    }

    private static Map<String, Object> csvRow(String cursor) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("cursor", cursor);
        row.put("value", "  x  ");
        return row;
    }

    private static Map<String, Object> issue(long id, String updatedAt, String title) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("number", id);
        row.put("title", title);
        row.put("state", "open");
        row.put("user.login", "alice");
        row.put("comments", 1L);
        row.put("created_at", "2024-01-01T00:00:00Z");
        row.put("updated_at", updatedAt);
        row.put("repo_owner", "o");
        row.put("repo_name", "r");
        return row;
    }

    /** Yields the given records, then either ends cleanly or fails. */
    private static final class ListStream implements RecordStream {

        private final Iterator<Map<String, Object>> records;
        private final IOException failure;
        private boolean ended;

        ListStream(List<Map<String, Object>> records, IOException failure) {
            this.records = records.iterator();
            this.failure = failure;
        }

        @Override
        public Map<String, Object> nextRecord() throws IOException {
            if (records.hasNext()) {
                return records.next();
            }
            if (failure != null) {
                throw failure;
            }
            ended = true;
            return null;
        }

        @Override
        public StopReason stopReason() {
            return ended ? StopReason.EXHAUSTED : null;
        }
    }

    // =========================================================================
    // Checkpointing
    // =========================================================================

    @Test
    @DisplayName("Checkpoint advances to the largest cursor seen, regardless of delivery order")
    void checkpointIsMonotonic() {
        streams.put("csv", new ListStream(List.of(
                csvRow("2024-01-02T00:00:00Z"),
                csvRow("2024-01-03T00:00:00Z"),
                csvRow("2024-01-01T00:00:00Z")), null));

        PipelineSummary summary = orchestrator(100, csvSource("csv", "cursor")).run();

        SourcePassResult result = summary.results().get(0);
        assertEquals(PassStatus.COMPLETED, result.status());
        assertEquals(3, result.rowsSeen());
        assertEquals(3, result.rowsWritten());
        assertNull(result.checkpointBefore());
        assertEquals("2024-01-03T00:00:00Z", result.checkpointAfter());
        verify(checkpoints).set("csv", "2024-01-03T00:00:00Z", Map.of("rows_seen", 3, "bad_rows", 0));
    }

    @Test
    @DisplayName("Checkpoint never moves below the stored value")
    void checkpointNeverDecreases() {
        when(checkpoints.get("csv")).thenReturn("2024-06-01T00:00:00Z");
        streams.put("csv", new ListStream(List.of(csvRow("2024-01-01T00:00:00Z")), null));

        SourcePassResult result = orchestrator(100, csvSource("csv", "cursor")).run().results().get(0);

        assertEquals("2024-06-01T00:00:00Z", result.checkpointAfter());
        verify(checkpoints, never()).set(anyString(), eq("2024-01-01T00:00:00Z"), anyMap());
    }

    @Test
    @DisplayName("No checkpoint is written when the source has no checkpoint_key")
    void noCheckpointKey() {
        streams.put("csv", new ListStream(List.of(csvRow("a")), null));

        SourcePassResult result = orchestrator(100, csvSource("csv", null)).run().results().get(0);

        assertTrue(result.success());
        verify(checkpoints, never()).set(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Records are normalized before being buffered")
    void recordsAreNormalized() throws IOException {
        streams.put("csv", new ListStream(List.of(csvRow("a")), null));

        orchestrator(100, csvSource("csv", null)).run();

        verify(lakeWriter).write(batchCaptor.capture(), eq(LAKE), eq("bronze/csv"), eq("ingest_date"));
        Map<String, Object> written = batchCaptor.getValue().get(0);
        assertEquals("x", written.get("value"));
        assertNotNull(written.get("ingest_ts"));
    }

    // =========================================================================
    // Failure handling
    // =========================================================================

    @Test
    @DisplayName("A failing pass keeps flushed batches, drops the buffer and leaves the checkpoint untouched")
    void failureKeepsFlushedBatchesOnly() throws IOException {
        streams.put("csv", new ListStream(List.of(
                csvRow("2024-01-01T00:00:00Z"),
                csvRow("2024-01-02T00:00:00Z"),
                csvRow("2024-01-03T00:00:00Z")), new IOException("connection reset")));

        SourcePassResult result = orchestrator(2, csvSource("csv", "cursor")).run().results().get(0);

        assertEquals(PassStatus.FAILED, result.status());
        assertEquals(3, result.rowsSeen());
        assertEquals(2, result.rowsWritten());
        assertEquals("connection reset", result.errorMessage());
        assertNull(result.checkpointAfter());
        verify(lakeWriter, times(1)).write(anyList(), any(), anyString(), anyString());
        verify(checkpoints, never()).set(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("A failing source does not stop the sources after it")
    void failureIsIsolated() {
        streams.put("second", new ListStream(List.of(csvRow("b")), null));

        PipelineSummary summary = orchestrator(100,
                csvSource("first", "cursor"), csvSource("second", "cursor")).run();

        assertEquals(2, summary.results().size());
        assertEquals(PassStatus.FAILED, summary.results().get(0).status());
        assertEquals(PassStatus.COMPLETED, summary.results().get(1).status());
        assertTrue(summary.hasFailures());
        assertEquals(1, summary.failureCount());
        verify(checkpoints).set(eq("second"), eq("b"), anyMap());
        verify(checkpoints, never()).set(eq("first"), anyString(), anyMap());
    }

    @Test
    @DisplayName("A checkpoint write failure fails the pass")
    void checkpointFailureFailsPass() {
        streams.put("csv", new ListStream(List.of(csvRow("a")), null));
        doThrow(new DataAccessResourceFailureException("disk full"))
                .when(checkpoints).set(anyString(), anyString(), anyMap());

        SourcePassResult result = orchestrator(100, csvSource("csv", "cursor")).run().results().get(0);

        assertEquals(PassStatus.FAILED, result.status());
        assertEquals(1, result.rowsWritten());
        assertNull(result.checkpointAfter());
    }

    @Test
    @DisplayName("Invalid records are counted and skipped")
    void rejectsAreCounted() throws IOException {
        SourceConfig github = new SourceConfig("gh", SourceKind.HTTP_GITHUB, Map.of("owner", "o", "repo", "r"),
                "bronze/github/issues", "updated_at");
        streams.put("gh", new ListStream(List.of(
                issue(1, "2024-01-02T00:00:00Z", "Good"),
                issue(2, "2024-01-05T00:00:00Z", "   ")), null));

        PipelineSummary summary = orchestrator(100, github).run();

        SourcePassResult result = summary.results().get(0);
        assertEquals(2, result.rowsSeen());
        assertEquals(1, result.rowsRejected());
        assertEquals(1, result.rowsWritten());
        assertEquals("2024-01-02T00:00:00Z", result.checkpointAfter());
        verify(checkpoints).set("gh", "2024-01-02T00:00:00Z", Map.of("rows_seen", 2, "bad_rows", 1));
    }

    // =========================================================================
    // Silver hand-off
    // =========================================================================

    @Test
    @DisplayName("Silver build runs once for GitHub sources and its failure does not fail the run")
    void silverFailureIsContained() throws IOException {
        SourceConfig github = new SourceConfig("gh", SourceKind.HTTP_GITHUB, Map.of("owner", "o", "repo", "r"),
                "bronze/github/issues", null);
        streams.put("gh", new ListStream(List.of(), null));
        streams.put("csv", new ListStream(List.of(), null));
        when(silverBuilder.build(anyList(), any())).thenThrow(new IOException("bad parquet"));

        PipelineSummary summary = orchestrator(100, github, csvSource("csv", null)).run();

        assertNull(summary.silverMetadata());
        assertFalse(summary.hasFailures());
        verify(silverBuilder, times(1)).build(eq(List.of(github)), any());
    }

    @Test
    @DisplayName("Silver build is skipped without GitHub sources")
    void noSilverWithoutGithub() throws IOException {
        streams.put("csv", new ListStream(List.of(), null));

        orchestrator(100, csvSource("csv", null)).run();

        verifyNoInteractions(silverBuilder);
    }

    // =========================================================================
    // Cursor ordering
    // =========================================================================

    @Test
    @DisplayName("Cursors compare as instants when both parse, otherwise as strings")
    void cursorComparison() {
        assertEquals("2024-01-01T10:00:00Z",
                CursorComparator.max("2024-01-01T11:00:00+02:00", "2024-01-01T10:00:00Z"));
        assertEquals("b", CursorComparator.max("a", "b"));
        assertEquals("a", CursorComparator.max("a", null));
        assertEquals("b", CursorComparator.max(null, "b"));
        assertEquals("10", CursorComparator.max("10", "09"));
    }
}
