package com.issuelake.pipeline.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Environment-level settings, read from the process environment with a {@code .env}
 * file as fallback via dotenv-java.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_STATE_DB = "./pipeline_state.db";

    private final String githubToken;
    private final String stateDbPath;
    private final String configPath;
    private final String envName;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.githubToken = resolveOptional(dotenv, "GITHUB_TOKEN");
        String stateDb = resolveOptional(dotenv, "PIPELINE_STATE_DB");
        this.stateDbPath = stateDb != null ? stateDb : DEFAULT_STATE_DB;
        this.configPath = resolveOptional(dotenv, "PIPELINE_CONFIG_PATH");
        this.envName = resolveOptional(dotenv, "PIPELINE_ENV");

        validate();

        logger.info("Environment loaded: stateDb={}, configPath={}, env={}, githubToken={}",
                stateDbPath, configPath != null ? configPath : "default",
                envName != null ? envName : "none", githubToken != null ? "set" : "unset");
    }

    /**
     * Constructor for testing: accepts values directly.
     */
    public AppConfig(String githubToken, String stateDbPath, String configPath, String envName) {
        this.githubToken = githubToken;
        this.stateDbPath = stateDbPath;
        this.configPath = configPath;
        this.envName = envName;

        validate();
    }

    /**
     * Returns a copy with command-line overrides applied. Null arguments keep the current value.
     */
    public AppConfig withOverrides(String configPathOverride, String envNameOverride) {
        return new AppConfig(githubToken, stateDbPath,
                configPathOverride != null ? configPathOverride : configPath,
                envNameOverride != null ? envNameOverride : envName);
    }

    private void validate() {
        if (isBlank(stateDbPath)) {
            throw new IllegalStateException("Missing required environment variable: PIPELINE_STATE_DB");
        }
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return isBlank(dotenvValue) ? null : dotenvValue;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getGithubToken() {
        return githubToken;
    }

    public String getStateDbPath() {
        return stateDbPath;
    }

    public String getConfigPath() {
        return configPath;
    }

    public String getEnvName() {
        return envName;
    }
}
