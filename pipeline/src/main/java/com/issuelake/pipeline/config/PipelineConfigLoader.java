package com.issuelake.pipeline.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves and parses the pipeline YAML file. All structural problems are reported
 * here, before any source is touched.
 */
public class PipelineConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    static final String DEFAULT_FILE_NAME = "config.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Picks the config file: an explicit path wins, then {@code config.<env>.yaml} next to the
     * default file when it exists, then the default file itself.
     */
    public static Path resolvePath(String explicitPath, String envName, Path defaultDirectory) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            Path path = Path.of(explicitPath);
            if (!Files.exists(path)) {
                throw new IllegalStateException("PIPELINE_CONFIG_PATH=" + explicitPath + " does not exist");
            }
            return path;
        }
        Path base = defaultDirectory.resolve(DEFAULT_FILE_NAME);
        if (envName != null && !envName.isBlank()) {
            Path candidate = defaultDirectory.resolve("config." + envName + ".yaml");
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return base;
    }

    public PipelineConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Map<String, Object> document = YAML_MAPPER.readValue(in, MAP_TYPE);
            PipelineConfig config = fromDocument(document, path);
            logger.info("Loaded configuration from {} ({} sources)", path, config.sources().size());
            return config;
        }
    }

    PipelineConfig fromDocument(Map<String, Object> document, Path path) {
        if (document == null) {
            throw new IllegalStateException("Pipeline config is empty: " + path);
        }
        Object lakeRoot = document.get("lake_root");
        if (lakeRoot == null || lakeRoot.toString().isBlank()) {
            throw new IllegalStateException("Pipeline config is missing lake_root");
        }

        String defaultPartition = document.get("default_partition") != null
                ? document.get("default_partition").toString()
                : PipelineConfig.DEFAULT_PARTITION;

        int microBatchSize = PipelineConfig.DEFAULT_MICRO_BATCH_SIZE;
        if (document.get("micro_batch_size") != null) {
            microBatchSize = Integer.parseInt(document.get("micro_batch_size").toString());
            if (microBatchSize <= 0) {
                throw new IllegalStateException("micro_batch_size must be positive, got " + microBatchSize);
            }
        }

        Object rawSources = document.get("sources");
        if (!(rawSources instanceof List<?> sourceList)) {
            throw new IllegalStateException("Pipeline config has no sources list");
        }

        List<SourceConfig> sources = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Object entry : sourceList) {
            if (!(entry instanceof Map<?, ?>)) {
                throw new IllegalStateException("Source entry is not a mapping: " + entry);
            }
            SourceConfig source = toSource(YAML_MAPPER.convertValue(entry, MAP_TYPE));
            if (!names.add(source.name())) {
                throw new IllegalStateException("Duplicate source name: " + source.name());
            }
            sources.add(source);
        }

        return new PipelineConfig(Path.of(lakeRoot.toString()), defaultPartition, microBatchSize,
                sources, document, path);
    }

    private static SourceConfig toSource(Map<String, Object> entry) {
        String name = asString(entry.get("name"));
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Source entry is missing name: " + entry);
        }
        String destination = asString(entry.get("destination"));
        if (destination == null || destination.isBlank()) {
            throw new IllegalStateException("Source " + name + " is missing destination");
        }
        SourceKind kind = SourceKind.fromTag(asString(entry.get("kind")));
        Object options = entry.get("options");
        Map<String, Object> optionMap = options instanceof Map<?, ?>
                ? YAML_MAPPER.convertValue(options, MAP_TYPE)
                : Map.<String, Object>of();
        return new SourceConfig(name, kind, optionMap, destination, asString(entry.get("checkpoint_key")));
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
