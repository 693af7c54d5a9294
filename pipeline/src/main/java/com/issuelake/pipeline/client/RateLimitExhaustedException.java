package com.issuelake.pipeline.client;

import java.io.IOException;

public class RateLimitExhaustedException extends IOException {

    public RateLimitExhaustedException(String url, int attempts) {
        super("GitHub rate limit exceeded and retries exhausted after " + attempts
                + " attempts for " + url);
    }
}
