package com.issuelake.pipeline.extract;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Forward-only, single-pass sequence of raw records. A stream cannot be rewound;
 * opening a new one re-reads from the stored checkpoint.
 */
public interface RecordStream extends Closeable {

    /**
     * Reads the next raw record.
     *
     * @return the record, or {@code null} once the stream has ended cleanly
     * @throws IOException if the source fails; the stream must not be read further
     */
    Map<String, Object> nextRecord() throws IOException, InterruptedException;

    /**
     * @return why the stream ended, or {@code null} while records may still follow
     */
    StopReason stopReason();

    @Override
    default void close() throws IOException {
    }
}
