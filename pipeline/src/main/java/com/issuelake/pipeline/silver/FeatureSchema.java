package com.issuelake.pipeline.silver;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Column layout of the GitHub issues silver dataset.
 */
public final class FeatureSchema {

    private FeatureSchema() {}

    public static final String FEATURE_VERSION = "v1.1";

    public static final String LABEL_COLUMN = "priority_label";

    /** Comment count at or above which an issue is labelled high priority. */
    public static final int LABEL_COMMENT_THRESHOLD = 5;

    public static final List<String> FEATURE_COLUMNS = List.of(
            "title_length",
            "title_word_count",
            "issue_age_days",
            "time_since_update_days",
            "is_recent_update",
            "is_weekend_created",
            "repo_issue_count_30d",
            "repo_issue_count_90d",
            "user_issue_count_30d",
            "user_issue_count_90d",
            "title_has_bug",
            "title_has_error"
    );

    public static final List<String> BASE_COLUMNS = List.of(
            "id",
            "repo_owner",
            "repo_name",
            "number",
            "state",
            "user_login",
            "created_at",
            "updated_at",
            "ingest_ts"
    );

    /** Bronze files missing any of these predate the current bronze layout and are skipped. */
    public static final Set<String> REQUIRED_BRONZE_COLUMNS = Set.of(
            "repo_owner", "repo_name", "created_at", "updated_at", "ingest_ts",
            "title", "state", "comments", "id", "user_login");

    public static List<String> outputColumns() {
        return Stream.of(BASE_COLUMNS, List.of(LABEL_COLUMN), FEATURE_COLUMNS)
                .flatMap(List::stream)
                .toList();
    }

    public static Schema silverSchema() {
        Schema timestamp = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
        return SchemaBuilder.record("GitHubIssueFeatures")
                .namespace("com.issuelake.silver")
                .fields()
                .optionalLong("id")
                .optionalString("repo_owner")
                .optionalString("repo_name")
                .optionalLong("number")
                .optionalString("state")
                .optionalString("user_login")
                .name("created_at").type().unionOf().nullType().and().type(timestamp).endUnion().nullDefault()
                .name("updated_at").type().unionOf().nullType().and().type(timestamp).endUnion().nullDefault()
                .name("ingest_ts").type().unionOf().nullType().and().type(timestamp).endUnion().nullDefault()
                .requiredInt(LABEL_COLUMN)
                .requiredInt("title_length")
                .requiredInt("title_word_count")
                .requiredDouble("issue_age_days")
                .requiredDouble("time_since_update_days")
                .requiredInt("is_recent_update")
                .requiredInt("is_weekend_created")
                .requiredLong("repo_issue_count_30d")
                .requiredLong("repo_issue_count_90d")
                .requiredLong("user_issue_count_30d")
                .requiredLong("user_issue_count_90d")
                .requiredInt("title_has_bug")
                .requiredInt("title_has_error")
                .endRecord();
    }
}
