package com.issuelake.pipeline.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of source kinds. The tag is the value used for {@code kind} in the pipeline config.
 */
public enum SourceKind {

    HTTP_GITHUB("http.github"),
    FILE_CSV("file.csv");

    private final String tag;

    SourceKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a config tag to its kind.
     *
     * @throws IllegalArgumentException if the tag is not a known kind
     */
    public static SourceKind fromTag(String tag) {
        for (SourceKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + tag + " (expected one of "
                + Arrays.stream(values()).map(SourceKind::tag).collect(Collectors.joining(", ")) + ")");
    }
}
