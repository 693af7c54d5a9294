package com.issuelake.pipeline.loader;

import java.util.List;

/**
 * Outcome of one lake write: rows written and the partition values that received a new file.
 */
public record WriteResult(int rowsWritten, List<String> partitions) {

    public static final WriteResult EMPTY = new WriteResult(0, List.of());

    public WriteResult {
        partitions = List.copyOf(partitions);
    }
}
