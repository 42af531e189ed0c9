package org.carball.relinfer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String ENV_PREFIX = "RELINFER_";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public InferenceThresholds loadConfiguration(String[] args) {
        return loadConfiguration(null, null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > profile > defaults.
     * Either the profile name or the YAML file may be null.
     */
    public InferenceThresholds loadConfiguration(String profileName, Path thresholdsFile, String[] args) {
        log.debug("Loading configuration (profile: {}, file: {})", profileName, thresholdsFile);

        InferenceThresholds.InferenceThresholdsBuilder builder = profileName != null
                ? loadProfile(profileName).toBuilder()
                : InferenceThresholds.builder();

        if (thresholdsFile != null) {
            loadFromYaml(thresholdsFile).applyTo(builder);
        }

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        InferenceThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public InferenceThresholds loadProfile(String profileName) {
        try {
            InferenceProfile profile = InferenceProfile.fromName(profileName);
            InferenceThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public ThresholdOverrides loadFromYaml(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Thresholds file not found: " + file);
        }
        try {
            ThresholdOverrides overrides = yamlMapper.readValue(file.toFile(), ThresholdOverrides.class);
            return overrides != null ? overrides : new ThresholdOverrides();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read thresholds file " + file + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(InferenceThresholds.InferenceThresholdsBuilder builder) {
        Map<String, String> env = environment;

        try {
            if (env.containsKey(ENV_PREFIX + "MIN_DISTINCT_VALUES")) {
                builder.minDistinctSourceValues(Integer.parseInt(env.get(ENV_PREFIX + "MIN_DISTINCT_VALUES")));
            }
            if (env.containsKey(ENV_PREFIX + "MIN_MATCHED_VALUES")) {
                builder.minMatchedValues(Integer.parseInt(env.get(ENV_PREFIX + "MIN_MATCHED_VALUES")));
            }
            if (env.containsKey(ENV_PREFIX + "MIN_INTEGRITY_RATIO")) {
                builder.minIntegrityRatio(Double.parseDouble(env.get(ENV_PREFIX + "MIN_INTEGRITY_RATIO")));
            }
            if (env.containsKey(ENV_PREFIX + "NAMING_SIMILARITY_THRESHOLD")) {
                builder.namingSimilarityThreshold(Double.parseDouble(env.get(ENV_PREFIX + "NAMING_SIMILARITY_THRESHOLD")));
            }
            if (env.containsKey(ENV_PREFIX + "REVIEW_THRESHOLD")) {
                builder.reviewThreshold(Double.parseDouble(env.get(ENV_PREFIX + "REVIEW_THRESHOLD")));
            }
            if (env.containsKey(ENV_PREFIX + "CONCURRENCY")) {
                builder.concurrency(Integer.parseInt(env.get(ENV_PREFIX + "CONCURRENCY")));
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid numeric value in " + ENV_PREFIX + "* environment: " + e.getMessage(), e);
        }
    }

    private void applyCLIArguments(InferenceThresholds.InferenceThresholdsBuilder builder, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.min-distinct":
                        builder.minDistinctSourceValues(Integer.parseInt(value));
                        break;
                    case "--thresholds.min-matched":
                        builder.minMatchedValues(Integer.parseInt(value));
                        break;
                    case "--thresholds.min-integrity":
                        builder.minIntegrityRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.weak-integrity":
                        builder.weakIntegrityRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.naming-similarity":
                        builder.namingSimilarityThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.review":
                        builder.reviewThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.high":
                        builder.highConfidenceThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.medium":
                        builder.mediumConfidenceThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.schema-weight":
                        double schemaWeight = Double.parseDouble(value);
                        builder.schemaWeight(schemaWeight).dataWeight(1.0 - schemaWeight);
                        break;
                    case "--concurrency":
                        builder.concurrency(Integer.parseInt(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.min-distinct <num>       Minimum distinct source values before judging a link
              --thresholds.min-matched <num>        Minimum matched values before judging a link
              --thresholds.min-integrity <num>      Minimum referential integrity ratio (0-1)
              --thresholds.weak-integrity <num>     Integrity ratio below which a penalty applies
              --thresholds.naming-similarity <num>  Minimum name similarity for fuzzy table matches
              --thresholds.review <num>             Confidence below which review is required
              --thresholds.high <num>               Lower bound of the 'high' confidence bucket
              --thresholds.medium <num>             Lower bound of the 'medium' confidence bucket
              --thresholds.schema-weight <num>      Weight of schema evidence in the hybrid blend
              --concurrency <num>                   Number of candidates analyzed in parallel

            Environment Variables:
              RELINFER_MIN_DISTINCT_VALUES          Same as --thresholds.min-distinct
              RELINFER_MIN_MATCHED_VALUES           Same as --thresholds.min-matched
              RELINFER_MIN_INTEGRITY_RATIO          Same as --thresholds.min-integrity
              RELINFER_NAMING_SIMILARITY_THRESHOLD  Same as --thresholds.naming-similarity
              RELINFER_REVIEW_THRESHOLD             Same as --thresholds.review
              RELINFER_CONCURRENCY                  Same as --concurrency

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds YAML file (--thresholds <file>)
              4. Profile defaults or built-in defaults
            """;
    }
}
