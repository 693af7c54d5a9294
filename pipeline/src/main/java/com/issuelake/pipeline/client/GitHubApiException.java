package com.issuelake.pipeline.client;

import java.io.IOException;

/**
 * A response status that cannot be retried, or that is still failing once attempts run out.
 */
public class GitHubApiException extends IOException {

    private final int statusCode;

    public GitHubApiException(int statusCode, String url) {
        super("GitHub API error: " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
