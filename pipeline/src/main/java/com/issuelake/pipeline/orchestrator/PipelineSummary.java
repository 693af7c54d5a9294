package com.issuelake.pipeline.orchestrator;

import com.issuelake.pipeline.silver.SilverMetadata;

import java.util.List;

/**
 * Aggregated summary of a pipeline run: one result per source plus the silver snapshot
 * metadata, which is null when no snapshot was produced.
 */
public record PipelineSummary(
        List<SourcePassResult> results,
        SilverMetadata silverMetadata,
        long totalDurationMs
) {

    public int successCount() {
        return (int) results.stream().filter(SourcePassResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    public int totalRowsWritten() {
        return results.stream().mapToInt(SourcePassResult::rowsWritten).sum();
    }

    public int totalRowsRejected() {
        return results.stream().mapToInt(SourcePassResult::rowsRejected).sum();
    }
}
