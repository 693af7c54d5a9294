package com.issuelake.pipeline.extract;

import com.issuelake.pipeline.client.GitHubApiClient;
import com.issuelake.pipeline.config.SourceKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each {@link SourceKind} to its extractor. Every kind must be covered.
 */
public class ExtractorRegistry {

    private final Map<SourceKind, RecordExtractor> extractors;

    public ExtractorRegistry(Map<SourceKind, RecordExtractor> extractors) {
        EnumMap<SourceKind, RecordExtractor> copy = new EnumMap<>(SourceKind.class);
        copy.putAll(extractors);
        for (SourceKind kind : SourceKind.values()) {
            if (!copy.containsKey(kind)) {
                throw new IllegalStateException("No extractor registered for source kind " + kind.tag());
            }
        }
        this.extractors = copy;
    }

    public static ExtractorRegistry defaults(GitHubApiClient client) {
        Map<SourceKind, RecordExtractor> map = new EnumMap<>(SourceKind.class);
        map.put(SourceKind.HTTP_GITHUB, new GitHubIssuesExtractor(client));
        map.put(SourceKind.FILE_CSV, new CsvFileExtractor());
        return new ExtractorRegistry(map);
    }

    public RecordExtractor forKind(SourceKind kind) {
        return extractors.get(kind);
    }
}
