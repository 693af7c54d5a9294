package com.issuelake.pipeline.orchestrator;

/**
 * States of a single source pass. Only {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum PassStatus {
    START,
    EXTRACTING,
    FLUSHING,
    COMPLETED,
    FAILED
}
