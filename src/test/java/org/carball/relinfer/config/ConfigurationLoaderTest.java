package org.carball.relinfer.config;

import org.carball.relinfer.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        InferenceThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(5);
        assertThat(thresholds.getMinIntegrityRatio()).isEqualTo(0.5);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldLoadSpecificProfile() {
        // When
        InferenceThresholds thresholds = loader.loadProfile("strict");

        // Then
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(10);
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown inference profile: nonexistent");
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--thresholds.min-distinct", "8",
                "--thresholds.min-matched", "4",
                "--thresholds.min-integrity", "0.6",
                "--thresholds.review", "0.85",
                "--thresholds.schema-weight", "0.4",
                "--concurrency", "2"
        };

        // When
        InferenceThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(8);
        assertThat(thresholds.getMinMatchedValues()).isEqualTo(4);
        assertThat(thresholds.getMinIntegrityRatio()).isEqualTo(0.6);
        assertThat(thresholds.getReviewThreshold()).isEqualTo(0.85);
        assertThat(thresholds.getSchemaWeight()).isEqualTo(0.4);
        assertThat(thresholds.getDataWeight()).isCloseTo(0.6, within(1e-9));
        assertThat(thresholds.getConcurrency()).isEqualTo(2);
    }

    @Test
    void shouldIgnoreInvalidCLINumbers() {
        // Given
        String[] args = {"--thresholds.min-distinct", "many"};

        // When
        InferenceThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(5);
    }

    @Test
    void shouldReadEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "RELINFER_MIN_DISTINCT_VALUES", "7",
                "RELINFER_CONCURRENCY", "8"));

        // When
        InferenceThresholds thresholds = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(7);
        assertThat(thresholds.getConcurrency()).isEqualTo(8);
    }

    @Test
    void shouldRejectInvalidEnvironmentNumbers() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("RELINFER_CONCURRENCY", "lots"));

        // When/Then
        assertThatThrownBy(() -> envLoader.loadConfiguration(new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("RELINFER_");
    }

    @Test
    void shouldApplyHierarchyOfSources() throws IOException {
        // Given
        Path yaml = tempDir.resolve("thresholds.yaml");
        Files.writeString(yaml, """
                min_distinct_source_values: 12
                min_matched_values: 6
                probe_unhinted_scalar_columns: true
                unknown_key: ignored
                """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("RELINFER_MIN_MATCHED_VALUES", "7"));
        String[] args = {"--thresholds.min-integrity", "0.65"};

        // When
        InferenceThresholds thresholds = envLoader.loadConfiguration("strict", yaml, args);

        // Then - CLI > env vars > YAML > profile
        assertThat(thresholds.getMinIntegrityRatio()).isEqualTo(0.65);
        assertThat(thresholds.getMinMatchedValues()).isEqualTo(7);
        assertThat(thresholds.getMinDistinctSourceValues()).isEqualTo(12);
        assertThat(thresholds.isProbeUnhintedScalarColumns()).isTrue();
        assertThat(thresholds.getNamingSimilarityThreshold()).isEqualTo(0.9);
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldRejectMissingThresholdsFile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadFromYaml(tempDir.resolve("missing.yaml")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Thresholds file not found");
    }

    @Test
    void shouldRejectMalformedThresholdsFile() throws IOException {
        // Given
        Path yaml = tempDir.resolve("broken.yaml");
        Files.writeString(yaml, "min_distinct_source_values: [1, 2\n");

        // When/Then
        assertThatThrownBy(() -> loader.loadFromYaml(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Failed to read thresholds file");
    }

    @Test
    void shouldRejectInvalidCombinations() {
        // When/Then
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--concurrency", "0"}))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldProvideThresholdHelp() {
        assertThat(ConfigurationLoader.getThresholdHelp())
                .contains("--thresholds.min-integrity", "RELINFER_CONCURRENCY");
    }
}
