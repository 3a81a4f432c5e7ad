package org.carball.deepanalysis.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String ENV_PREFIX = "DEEP_ANALYSIS_";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration using the hierarchy: overrides > env vars > defaults
     */
    public DeepAnalysisConfig loadConfiguration(String[] overrides) {
        return build(DeepAnalysisConfig.builder(), System.getenv(), overrides);
    }

    /**
     * Loads configuration using the hierarchy: overrides > env vars > YAML file > defaults
     */
    public DeepAnalysisConfig loadConfiguration(Path configFile, String[] overrides) throws IOException {
        return loadConfiguration(configFile, System.getenv(), overrides);
    }

    DeepAnalysisConfig loadConfiguration(Path configFile, Map<String, String> env, String[] overrides)
            throws IOException {
        DeepAnalysisConfig.DeepAnalysisConfigBuilder builder = DeepAnalysisConfig.builder();
        if (configFile != null) {
            applyYaml(builder, configFile);
        }
        return build(builder, env, overrides);
    }

    private DeepAnalysisConfig build(DeepAnalysisConfig.DeepAnalysisConfigBuilder builder,
                                     Map<String, String> env, String[] overrides) {
        log.debug("Loading analysis configuration");

        applyEnvironmentVariables(builder, env);
        applyOverrides(builder, overrides != null ? overrides : new String[0]);

        DeepAnalysisConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYaml(DeepAnalysisConfig.DeepAnalysisConfigBuilder builder, Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }

        JsonNode root = yamlMapper.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Configuration file must contain a mapping: " + configFile);
        }
        JsonNode node = root.has("deep_analysis") ? root.get("deep_analysis") : root;

        if (node.has("max_dimensions")) {
            builder.maxDimensions(node.get("max_dimensions").asInt());
        }
        if (node.has("default_target_count")) {
            builder.defaultTargetCount(node.get("default_target_count").asInt());
        }
        if (node.has("rank_size")) {
            builder.rankSize(node.get("rank_size").asInt());
        }
        if (node.has("time_bucket_dimension")) {
            builder.timeBucketDimension(node.get("time_bucket_dimension").asText());
        }
        if (node.has("version_dimension")) {
            builder.versionDimension(node.get("version_dimension").asText());
        }
        if (node.has("actual_version")) {
            builder.actualVersion(node.get("actual_version").asText());
        }
        if (node.has("budget_version")) {
            builder.budgetVersion(node.get("budget_version").asText());
        }
        if (node.has("probe_parallelism")) {
            builder.probeParallelism(node.get("probe_parallelism").asInt());
        }
        if (node.has("probe_deadline_ms")) {
            builder.probeDeadline(Duration.ofMillis(node.get("probe_deadline_ms").asLong()));
        }
        if (node.has("default_measure")) {
            builder.defaultMeasure(node.get("default_measure").asText());
        }
        if (node.has("banned_dimension_terms")) {
            builder.bannedDimensionTerms(readStrings(node.get("banned_dimension_terms")));
        }
        if (node.has("preferred_dimensions")) {
            builder.preferredDimensions(readStrings(node.get("preferred_dimensions")));
        }
        if (node.has("preferred_vectors")) {
            builder.preferredVectors(readStrings(node.get("preferred_vectors")));
        }
        log.debug("Applied configuration file {}", configFile);
    }

    private void applyEnvironmentVariables(DeepAnalysisConfig.DeepAnalysisConfigBuilder builder,
                                           Map<String, String> env) {
        if (env.containsKey(ENV_PREFIX + "MAX_DIMENSIONS")) {
            builder.maxDimensions(Integer.parseInt(env.get(ENV_PREFIX + "MAX_DIMENSIONS")));
        }
        if (env.containsKey(ENV_PREFIX + "RANK_SIZE")) {
            builder.rankSize(Integer.parseInt(env.get(ENV_PREFIX + "RANK_SIZE")));
        }
        if (env.containsKey(ENV_PREFIX + "TIME_BUCKET_DIMENSION")) {
            builder.timeBucketDimension(env.get(ENV_PREFIX + "TIME_BUCKET_DIMENSION"));
        }
        if (env.containsKey(ENV_PREFIX + "PROBE_PARALLELISM")) {
            builder.probeParallelism(Integer.parseInt(env.get(ENV_PREFIX + "PROBE_PARALLELISM")));
        }
        if (env.containsKey(ENV_PREFIX + "PROBE_DEADLINE_MS")) {
            builder.probeDeadline(Duration.ofMillis(Long.parseLong(env.get(ENV_PREFIX + "PROBE_DEADLINE_MS"))));
        }
        if (env.containsKey(ENV_PREFIX + "DEFAULT_MEASURE")) {
            builder.defaultMeasure(env.get(ENV_PREFIX + "DEFAULT_MEASURE"));
        }
    }

    private void applyOverrides(DeepAnalysisConfig.DeepAnalysisConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--analysis.max-dimensions":
                        builder.maxDimensions(Integer.parseInt(value));
                        break;
                    case "--analysis.target-count":
                        builder.defaultTargetCount(Integer.parseInt(value));
                        break;
                    case "--analysis.rank-size":
                        builder.rankSize(Integer.parseInt(value));
                        break;
                    case "--analysis.time-bucket":
                        builder.timeBucketDimension(value);
                        break;
                    case "--analysis.version-dimension":
                        builder.versionDimension(value);
                        break;
                    case "--analysis.parallelism":
                        builder.probeParallelism(Integer.parseInt(value));
                        break;
                    case "--analysis.deadline-ms":
                        builder.probeDeadline(Duration.ofMillis(Long.parseLong(value)));
                        break;
                    case "--analysis.default-measure":
                        builder.defaultMeasure(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isNull() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            }
        }
        return List.copyOf(values);
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getOverrideHelp() {
        return """
            Deep Analysis Configuration Options:

            Overrides:
              --analysis.max-dimensions <num>       Upper bound on planned dimensions
              --analysis.target-count <num>         Dimensions planned when the request names none
              --analysis.rank-size <num>            Groups kept per Top/Bottom ranking
              --analysis.time-bucket <name>         Dimension used for the temporal drill
              --analysis.version-dimension <name>   Dimension splitting Actual from Budget
              --analysis.parallelism <num>          Hierarchy vectors drilled concurrently
              --analysis.deadline-ms <num>          Overall probe deadline per request
              --analysis.default-measure <name>     Measure for metrics that declare none

            Environment Variables:
              DEEP_ANALYSIS_MAX_DIMENSIONS          Same as --analysis.max-dimensions
              DEEP_ANALYSIS_RANK_SIZE               Same as --analysis.rank-size
              DEEP_ANALYSIS_TIME_BUCKET_DIMENSION   Same as --analysis.time-bucket
              DEEP_ANALYSIS_PROBE_PARALLELISM       Same as --analysis.parallelism
              DEEP_ANALYSIS_PROBE_DEADLINE_MS       Same as --analysis.deadline-ms
              DEEP_ANALYSIS_DEFAULT_MEASURE         Same as --analysis.default-measure

            Priority Order (highest to lowest):
              1. Overrides
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
