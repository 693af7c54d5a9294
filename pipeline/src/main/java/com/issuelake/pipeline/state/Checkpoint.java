package com.issuelake.pipeline.state;

import java.time.Instant;
import java.util.Map;

/**
 * The stored resume point of one source.
 */
public record Checkpoint(String source, String cursor, Map<String, Object> meta, Instant updatedAt) {}
