package com.issuelake.pipeline.extract;

import com.issuelake.pipeline.config.SourceConfig;

import java.io.IOException;

public interface RecordExtractor {

    /**
     * Opens a new pass over the source.
     *
     * @param source the configured source
     * @param since  resume cursor from the checkpoint store, or {@code null} for a full pull
     */
    RecordStream open(SourceConfig source, String since) throws IOException;
}
