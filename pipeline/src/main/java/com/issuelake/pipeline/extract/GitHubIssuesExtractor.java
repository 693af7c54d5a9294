package com.issuelake.pipeline.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.issuelake.pipeline.client.GitHubApiClient;
import com.issuelake.pipeline.client.GitHubApiClient.PageResult;
import com.issuelake.pipeline.client.GitHubApiException;
import com.issuelake.pipeline.client.RetryPolicy;
import com.issuelake.pipeline.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pulls GitHub issues page by page, dropping pull requests and flattening each
 * issue to a fixed set of columns.
 *
 * <p>Options: {@code owner}, {@code repo} (required), {@code per_page} (100),
 * {@code request_timeout} seconds (30), {@code max_attempts} (3),
 * {@code backoff_seconds} (1.5), {@code samples_dir}, {@code base_url}.</p>
 */
public class GitHubIssuesExtractor implements RecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(GitHubIssuesExtractor.class);

    static final int PAGINATION_LIMIT_STATUS = 422;

    private final GitHubApiClient client;
    private final ObjectMapper objectMapper;

    public GitHubIssuesExtractor(GitHubApiClient client) {
        this.client = client;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public RecordStream open(SourceConfig source, String since) {
        String owner = source.requiredOption("owner");
        String repo = source.requiredOption("repo");
        int perPage = source.intOption("per_page", 100);
        int timeoutSeconds = source.intOption("request_timeout", 30);
        RetryPolicy policy = RetryPolicy.ofSeconds(
                source.intOption("max_attempts", 3),
                source.doubleOption("backoff_seconds", 1.5));
        String samplesDir = source.stringOption("samples_dir", null);

        GitHubApiClient sourceClient = client.withEndpoint(
                source.stringOption("base_url", GitHubApiClient.DEFAULT_BASE_URL),
                Duration.ofSeconds(timeoutSeconds));

        logger.info("Extracting issues for {}/{} (since: {})", owner, repo, since != null ? since : "full");
        return new IssuePageStream(sourceClient, owner, repo, perPage, since, policy,
                samplesDir != null ? Path.of(samplesDir) : null);
    }

    /**
     * Projects one API entry to the flat bronze shape.
     */
    static Map<String, Object> flatten(JsonNode item, String owner, String repo) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", scalar(item.get("id")));
        out.put("number", scalar(item.get("number")));
        out.put("title", scalar(item.get("title")));
        out.put("state", scalar(item.get("state")));
        JsonNode user = item.get("user");
        out.put("user.login", user != null && !user.isNull() ? scalar(user.get("login")) : null);
        out.put("comments", scalar(item.get("comments")));
        out.put("created_at", scalar(item.get("created_at")));
        out.put("updated_at", scalar(item.get("updated_at")));
        out.put("closed_at", scalar(item.get("closed_at")));
        out.put("repo_owner", owner);
        out.put("repo_name", repo);
        return out;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    private class IssuePageStream implements RecordStream {

        private final GitHubApiClient sourceClient;
        private final String owner;
        private final String repo;
        private final int perPage;
        private final String since;
        private final RetryPolicy policy;
        private final Path samplesDir;
        private final Deque<Map<String, Object>> buffered = new ArrayDeque<>();

        private int page = 1;
        private StopReason stopReason;

        IssuePageStream(GitHubApiClient sourceClient, String owner, String repo, int perPage,
                        String since, RetryPolicy policy, Path samplesDir) {
            this.sourceClient = sourceClient;
            this.owner = owner;
            this.repo = repo;
            this.perPage = perPage;
            this.since = since;
            this.policy = policy;
            this.samplesDir = samplesDir;
        }

        @Override
        public Map<String, Object> nextRecord() throws IOException, InterruptedException {
            while (buffered.isEmpty()) {
                if (stopReason != null) {
                    return null;
                }
                fetchNextPage();
            }
            return buffered.poll();
        }

        @Override
        public StopReason stopReason() {
            return buffered.isEmpty() ? stopReason : null;
        }

        private void fetchNextPage() throws IOException, InterruptedException {
            PageResult result = sourceClient.fetchIssuesPage(owner, repo, page, perPage, since, policy);

            if (result.statusCode() == PAGINATION_LIMIT_STATUS) {
                logger.info("GitHub returned 422 for {}/{} page={}; stopping pagination at API limit",
                        owner, repo, page);
                stopReason = StopReason.PAGINATION_LIMIT;
                return;
            }
            if (!result.isSuccessful()) {
                throw new GitHubApiException(result.statusCode(),
                        "/repos/" + owner + "/" + repo + "/issues?page=" + page);
            }

            JsonNode batch = objectMapper.readTree(result.body() != null ? result.body() : "[]");
            if (batch == null || !batch.isArray() || batch.isEmpty()) {
                logger.info("Empty page {} for {}/{}; pagination complete", page, owner, repo);
                stopReason = StopReason.EMPTY_PAGE;
                return;
            }

            writeSample(batch);

            int skipped = 0;
            for (JsonNode item : batch) {
                if (item.has("pull_request")) {
                    skipped++;
                    continue;
                }
                buffered.add(flatten(item, owner, repo));
            }
            logger.debug("Page {} for {}/{}: {} issues, {} pull requests skipped",
                    page, owner, repo, batch.size() - skipped, skipped);
            page++;
        }

        private void writeSample(JsonNode batch) {
            if (samplesDir == null) {
                return;
            }
            Path samplePath = samplesDir.resolve("github_issues_page_" + page + ".json");
            try {
                Files.createDirectories(samplesDir);
                objectMapper.writeValue(samplePath.toFile(), batch);
            } catch (IOException e) {
                logger.warn("Could not write sample page {}: {}", samplePath, e.getMessage());
            }
        }
    }
}
