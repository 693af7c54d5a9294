package com.issuelake.pipeline.silver;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One issue observation moving through the silver build. Bronze fields are set on load;
 * rolling counts, features and the label are filled in by later steps.
 */
final class IssueRow {

    Long id;
    String repoOwner;
    String repoName;
    Long number;
    String title;
    String state;
    String userLogin;
    Long comments;
    Instant createdAt;
    Instant updatedAt;
    Instant ingestTs;

    long repoCount30d;
    long repoCount90d;
    long userCount30d;
    long userCount90d;

    int titleLength;
    int titleWordCount;
    double issueAgeDays;
    double timeSinceUpdateDays;
    int recentUpdate;
    int weekendCreated;
    int titleHasBug;
    int titleHasError;
    int priorityLabel;

    /**
     * Grouping key for repository-level aggregates, or null if either part is missing.
     */
    String repoFullName() {
        if (repoOwner == null || repoName == null) {
            return null;
        }
        return repoOwner + "/" + repoName;
    }

    /**
     * Output row in {@link FeatureSchema#outputColumns()} order. Timestamps are epoch millis.
     */
    Map<String, Object> toOutputRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("repo_owner", repoOwner);
        row.put("repo_name", repoName);
        row.put("number", number);
        row.put("state", state);
        row.put("user_login", userLogin);
        row.put("created_at", millis(createdAt));
        row.put("updated_at", millis(updatedAt));
        row.put("ingest_ts", millis(ingestTs));
        row.put(FeatureSchema.LABEL_COLUMN, priorityLabel);
        row.put("title_length", titleLength);
        row.put("title_word_count", titleWordCount);
        row.put("issue_age_days", issueAgeDays);
        row.put("time_since_update_days", timeSinceUpdateDays);
        row.put("is_recent_update", recentUpdate);
        row.put("is_weekend_created", weekendCreated);
        row.put("repo_issue_count_30d", repoCount30d);
        row.put("repo_issue_count_90d", repoCount90d);
        row.put("user_issue_count_30d", userCount30d);
        row.put("user_issue_count_90d", userCount90d);
        row.put("title_has_bug", titleHasBug);
        row.put("title_has_error", titleHasError);
        return row;
    }

    private static Long millis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }
}
