package com.issuelake.pipeline.silver;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Lineage and data-quality document written as {@code _meta.json} next to each snapshot.
 */
@JsonPropertyOrder({"generated_at", "data_cutoff", "total_rows", "feature_columns", "label_column",
        "commit", "config_hash", "source_destinations", "quality", "run_directory", "feature_version"})
public record SilverMetadata(
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("data_cutoff") Instant dataCutoff,
        @JsonProperty("total_rows") int totalRows,
        @JsonProperty("feature_columns") List<String> featureColumns,
        @JsonProperty("label_column") String labelColumn,
        @JsonProperty("commit") String commit,
        @JsonProperty("config_hash") String configHash,
        @JsonProperty("source_destinations") List<String> sourceDestinations,
        @JsonProperty("quality") Quality quality,
        @JsonProperty("run_directory") String runDirectory,
        @JsonProperty("feature_version") String featureVersion
) {

    @JsonPropertyOrder({"rows_raw", "rows_after_dedupe", "rows_current_open", "duplicates_removed",
            "split_rows", "missing_pct"})
    public record Quality(
            @JsonProperty("rows_raw") int rowsRaw,
            @JsonProperty("rows_after_dedupe") int rowsAfterDedupe,
            @JsonProperty("rows_current_open") int rowsCurrentOpen,
            @JsonProperty("duplicates_removed") int duplicatesRemoved,
            @JsonProperty("split_rows") Map<String, Integer> splitRows,
            @JsonProperty("missing_pct") Map<String, Double> missingPct
    ) {}
}
