package com.issuelake.pipeline.client;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * GitHub REST API client for the issues endpoint with rate-limit handling and
 * exponential backoff retry.
 *
 * <p>The client only fetches and retries. Deciding what a returned status means for
 * pagination is left to the caller.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";

    private final OkHttpClient httpClient;
    private final String token;
    private final HttpUrl baseUrl;
    private final Sleeper sleeper;
    private final Clock clock;

    public GitHubApiClient(String token) {
        this(token, DEFAULT_BASE_URL, defaultHttpClient(30), Sleeper.SYSTEM, Clock.systemUTC());
    }

    public GitHubApiClient(String token, String baseUrl, OkHttpClient httpClient,
                           Sleeper sleeper, Clock clock) {
        this.token = token;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    static OkHttpClient defaultHttpClient(int timeoutSeconds) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Returns a client that shares this one's connection pool and credentials but uses
     * a different base URL and per-call timeout.
     */
    public GitHubApiClient withEndpoint(String baseUrl, Duration callTimeout) {
        OkHttpClient tuned = httpClient.newBuilder()
                .callTimeout(callTimeout)
                .build();
        return new GitHubApiClient(token, baseUrl, tuned, sleeper, clock);
    }

    // -------------------------------------------------------------------------
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches one page of issues (pull requests included, as GitHub returns them).
     * Endpoint: GET /repos/{owner}/{repo}/issues?state=all&per_page=N&page=P[&since=S]
     *
     * @return the final status and body; non-2xx statuses are returned, not thrown
     */
    public PageResult fetchIssuesPage(String owner, String repo, int page, int perPage,
                                      String since, RetryPolicy policy)
            throws IOException, InterruptedException {
        HttpUrl.Builder url = baseUrl.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(repo)
                .addPathSegment("issues")
                .addQueryParameter("state", "all")
                .addQueryParameter("per_page", String.valueOf(perPage))
                .addQueryParameter("page", String.valueOf(page));
        if (since != null) {
            url.addQueryParameter("since", since);
        }
        return executePageWithRetry(buildRequest(url.build()), policy);
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with retries and rate-limit handling
    // -------------------------------------------------------------------------

    Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");

        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        return builder.build();
    }

    /**
     * Executes a request, retrying transport failures, rate limits and 5xx responses
     * up to {@code policy.maxAttempts()} times in total.
     *
     * @throws RateLimitExhaustedException if the last attempt is still rate limited
     * @throws IOException                 if the last attempt fails at the transport level
     */
    PageResult executePageWithRetry(Request request, RetryPolicy policy)
            throws IOException, InterruptedException {
        int maxAttempts = policy.maxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(request.url().toString(), statusCode, response);

                if (isRateLimited(response)) {
                    if (attempt == maxAttempts) {
                        throw new RateLimitExhaustedException(request.url().toString(), attempt);
                    }
                    Duration wait = getRateLimitWait(response, policy.backoff(attempt));
                    logger.warn("GitHub rate limit hit ({}) for {}. Sleeping {}ms before retry (attempt {}/{})",
                            statusCode, request.url(), wait.toMillis(), attempt, maxAttempts);
                    sleeper.sleep(wait);
                    continue;
                }

                if (statusCode >= 500 && attempt < maxAttempts) {
                    Duration wait = policy.backoff(attempt);
                    logger.warn("Server error ({}) for {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url(), wait.toMillis(), attempt, maxAttempts);
                    sleeper.sleep(wait);
                    continue;
                }

                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : null;
                return new PageResult(statusCode, bodyString);
            } catch (RateLimitExhaustedException e) {
                throw e;
            } catch (IOException e) {
                if (attempt == maxAttempts) {
                    throw e;
                }
                Duration wait = policy.backoff(attempt);
                logger.warn("Request error ({}/{}) for {}: {}; retrying in {}ms",
                        attempt, maxAttempts, request.url(), e.getMessage(), wait.toMillis());
                sleeper.sleep(wait);
            }
        }

        throw new IOException("Exhausted retries for " + request.url());
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    static boolean isRateLimited(Response response) {
        if (response.code() == 429) {
            return true;
        }
        return response.code() == 403 && "0".equals(response.header("X-RateLimit-Remaining"));
    }

    /**
     * Wait before retrying a rate-limited request: Retry-After seconds if present,
     * otherwise until X-RateLimit-Reset (clamped to zero), otherwise the backoff.
     */
    Duration getRateLimitWait(Response response, Duration backoff) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Math.max(Long.parseLong(retryAfter.trim()), 0));
            } catch (NumberFormatException ignored) {
                // fall through to the reset header
            }
        }
        String resetHeader = response.header("X-RateLimit-Reset");
        if (resetHeader != null) {
            try {
                long resetEpoch = Long.parseLong(resetHeader.trim());
                long waitMs = resetEpoch * 1_000 - clock.millis();
                return Duration.ofMillis(Math.max(waitMs, 0));
            } catch (NumberFormatException ignored) {
                // fall through to backoff
            }
        }
        return backoff;
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Result holder
    // -------------------------------------------------------------------------

    public record PageResult(int statusCode, String body) {

        public boolean isSuccessful() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
