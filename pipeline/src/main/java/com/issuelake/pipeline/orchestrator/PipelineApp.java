package com.issuelake.pipeline.orchestrator;

import com.issuelake.pipeline.client.GitHubApiClient;
import com.issuelake.pipeline.config.AppConfig;
import com.issuelake.pipeline.config.PipelineConfig;
import com.issuelake.pipeline.config.PipelineConfigLoader;
import com.issuelake.pipeline.extract.ExtractorRegistry;
import com.issuelake.pipeline.loader.ParquetLakeWriter;
import com.issuelake.pipeline.silver.GitHubIssuesSilverBuilder;
import com.issuelake.pipeline.state.CheckpointStore;
import com.issuelake.pipeline.validate.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the IssueLake pipeline.
 * Parses CLI arguments, wires the components, runs every source and the silver build,
 * and exits with an appropriate status code.
 *
 * <p>Usage:
 * <pre>
 *   java -jar issuelake-pipeline.jar                      # same as "run"
 *   java -jar issuelake-pipeline.jar run --env dev        # use config.dev.yaml when present
 *   java -jar issuelake-pipeline.jar --config my.yaml
 *   java -jar issuelake-pipeline.jar --version
 * </pre>
 */
public class PipelineApp {

    private static final Logger logger = LoggerFactory.getLogger(PipelineApp.class);

    static final String VERSION = "0.3.0";
    static final String COMMAND_RUN = "run";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println("usage: PipelineApp [run] [--config <path>] [--env <name>] [--version]");
            return EXIT_USAGE;
        }

        if (options.version()) {
            System.out.println("IssueLake Pipeline " + VERSION);
            return EXIT_OK;
        }

        try {
            AppConfig env = new AppConfig().withOverrides(options.configPath(), options.envName());
            return execute(env);
        } catch (Exception e) {
            logger.error("Fatal error during pipeline run", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Loads the pipeline config named by {@code env}, runs it, prints the summary and returns the exit code.
     */
    static int execute(AppConfig env) throws Exception {
        logger.info("Starting pipeline run");
        Path configPath = PipelineConfigLoader.resolvePath(env.getConfigPath(), env.getEnvName(), Path.of("."));
        PipelineConfig config = new PipelineConfigLoader().load(configPath);

        GitHubApiClient client = new GitHubApiClient(env.getGithubToken());
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                config,
                ExtractorRegistry.defaults(client),
                new SchemaValidator(),
                new ParquetLakeWriter(),
                new CheckpointStore(env.getStateDbPath()),
                new GitHubIssuesSilverBuilder());

        PipelineSummary summary = orchestrator.run();
        printSummary(summary);

        if (summary.hasFailures()) {
            logger.warn("Pipeline run completed with failures");
            return EXIT_FAILURE;
        }
        logger.info("Pipeline run finished successfully.");
        return EXIT_OK;
    }

    record CliOptions(String command, String configPath, String envName, boolean version) {}

    static CliOptions parseArgs(String[] args) {
        String command = null;
        String configPath = null;
        String envName = null;
        boolean version = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--version" -> version = true;
                case "--config" -> configPath = requireValue(args, ++i, arg);
                case "--env" -> envName = requireValue(args, ++i, arg);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (command != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    command = arg;
                }
            }
        }

        if (command == null) {
            command = COMMAND_RUN;
        }
        if (!version && !COMMAND_RUN.equals(command)) {
            throw new IllegalArgumentException("Unsupported command '" + command + "'; only 'run' is available");
        }
        return new CliOptions(command, configPath, envName, version);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static void printSummary(PipelineSummary summary) {
        System.out.println();
        System.out.println("=== IssueLake Pipeline Summary ===");
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");
        System.out.println("Sources:  " + summary.successCount() + " completed, "
                + summary.failureCount() + " failed");

        System.out.println();
        System.out.println("Source breakdown:");
        for (SourcePassResult r : summary.results()) {
            System.out.printf("  %-20s %-9s seen=%-6d rejected=%-6d written=%-6d checkpoint=%s%n",
                    r.sourceName(), r.status(), r.rowsSeen(), r.rowsRejected(), r.rowsWritten(),
                    r.checkpointAfter() != null ? r.checkpointAfter() : "-");
        }

        if (summary.silverMetadata() != null) {
            System.out.println();
            System.out.println("Silver snapshot: " + summary.silverMetadata().runDirectory()
                    + " (" + summary.silverMetadata().totalRows() + " rows)");
        }

        if (summary.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            summary.results().stream()
                    .filter(r -> !r.success())
                    .forEach(r -> System.out.println("  - " + r.sourceName() + ": " + r.errorMessage()));
        }
        System.out.println();
    }
}
