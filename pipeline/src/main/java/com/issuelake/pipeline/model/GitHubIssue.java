package com.issuelake.pipeline.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated GitHub issue as stored in bronze.
 * Built by {@code SchemaValidator} from the flattened API record.
 */
public record GitHubIssue(
        long id,
        long number,
        String title,
        String state,
        String userLogin,
        long comments,
        Instant createdAt,
        Instant updatedAt,
        Instant closedAt,
        String repoOwner,
        String repoName
) {

    /**
     * Bronze row in column order. Timestamps are written as UTC ISO-8601 strings.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("number", number);
        row.put("title", title);
        row.put("state", state);
        row.put("user_login", userLogin);
        row.put("comments", comments);
        row.put("created_at", createdAt.toString());
        row.put("updated_at", updatedAt.toString());
        row.put("closed_at", closedAt != null ? closedAt.toString() : null);
        row.put("repo_owner", repoOwner);
        row.put("repo_name", repoName);
        return row;
    }
}
