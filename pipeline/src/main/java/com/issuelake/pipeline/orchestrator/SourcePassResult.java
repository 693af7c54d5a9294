package com.issuelake.pipeline.orchestrator;

import java.util.List;

/**
 * Outcome of one source pass, reported whether or not the pass succeeded.
 */
public record SourcePassResult(
        String sourceName,
        PassStatus status,
        int rowsSeen,
        int rowsRejected,
        int rowsWritten,
        List<String> partitions,
        String checkpointBefore,
        String checkpointAfter,
        String errorMessage,
        long durationMs
) {

    public boolean success() {
        return status == PassStatus.COMPLETED;
    }

    public static SourcePassResult completed(String sourceName, int seen, int rejected, int written,
                                             List<String> partitions, String before, String after,
                                             long durationMs) {
        return new SourcePassResult(sourceName, PassStatus.COMPLETED, seen, rejected, written,
                List.copyOf(partitions), before, after, null, durationMs);
    }

    /**
     * A failed pass never moves the checkpoint, so {@code checkpointAfter} equals {@code before}.
     */
    public static SourcePassResult failed(String sourceName, int seen, int rejected, int written,
                                          List<String> partitions, String before, String error,
                                          long durationMs) {
        return new SourcePassResult(sourceName, PassStatus.FAILED, seen, rejected, written,
                List.copyOf(partitions), before, before, error, durationMs);
    }
}
