package org.carball.relinfer.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.ConfigurationException;

/**
 * Every tunable number of the inference pipeline. None of these cut-offs is a
 * universal truth; profiles and overrides exist to move them.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class InferenceThresholds {

    // Minimum-sample guard
    @Builder.Default
    private int minDistinctSourceValues = 5;

    @Builder.Default
    private int minMatchedValues = 3;

    // Referential integrity
    @Builder.Default
    private double minIntegrityRatio = 0.5;

    @Builder.Default
    private double weakIntegrityRatio = 0.8;

    @Builder.Default
    private double weakIntegrityPenalty = 0.15;

    // Naming heuristics
    @Builder.Default
    private double namingSimilarityThreshold = 0.8;

    @Builder.Default
    private double namingSimilarityWeight = 0.0;

    @Builder.Default
    private boolean probeUnhintedScalarColumns = false;

    // Data volume
    @Builder.Default
    private long volumeMinRows = 100;

    @Builder.Default
    private long volumeMinNonNull = 50;

    // Scoring contributions
    @Builder.Default
    private double baseAnalysisScore = 0.30;

    @Builder.Default
    private double measuredCardinalityScore = 0.40;

    @Builder.Default
    private double fallbackCardinalityScore = 0.15;

    @Builder.Default
    private double cleanPatternBonus = 0.10;

    @Builder.Default
    private double manyToManyPatternBonus = 0.05;

    @Builder.Default
    private double shapeMatchScore = 0.20;

    @Builder.Default
    private double shapeMismatchScore = 0.10;

    @Builder.Default
    private double dataVolumeScore = 0.10;

    // Schema evidence
    @Builder.Default
    private double schemaBaseConfidence = 0.65;

    @Builder.Default
    private double symmetricLinkBoost = 0.10;

    @Builder.Default
    private double inverseFieldBoost = 0.10;

    @Builder.Default
    private double schemaConfidenceCap = 0.80;

    @Builder.Default
    private double schemaWeight = 0.3;

    @Builder.Default
    private double dataWeight = 0.7;

    @Builder.Default
    private double schemaAgreementBonus = 0.10;

    // Final value and buckets
    @Builder.Default
    private double minConfidence = 0.1;

    @Builder.Default
    private double maxConfidence = 0.99;

    @Builder.Default
    private double reviewThreshold = 0.8;

    @Builder.Default
    private double highConfidenceThreshold = 0.8;

    @Builder.Default
    private double mediumConfidenceThreshold = 0.6;

    // Execution
    @Builder.Default
    private int concurrency = 4;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced thresholds";

    public static InferenceThresholds defaults() {
        return InferenceThresholds.builder().build();
    }

    /**
     * Logs warnings for suspicious combinations and rejects impossible ones.
     */
    public void validate() {
        if (concurrency <= 0) {
            throw new ConfigurationException("Concurrency must be positive, got " + concurrency);
        }
        if (minConfidence > maxConfidence) {
            throw new ConfigurationException(String.format(
                    "Minimum confidence (%.2f) exceeds maximum confidence (%.2f)", minConfidence, maxConfidence));
        }
        if (minConfidence < 0.0 || maxConfidence > 1.0) {
            throw new ConfigurationException(String.format(
                    "Confidence clamp [%.2f, %.2f] must lie within [0, 1]", minConfidence, maxConfidence));
        }

        if (minMatchedValues > minDistinctSourceValues) {
            log.warn("Minimum matched values ({}) should not exceed minimum distinct source values ({})",
                    minMatchedValues, minDistinctSourceValues);
        }

        if (minIntegrityRatio < 0.0 || minIntegrityRatio > 1.0) {
            log.warn("Minimum integrity ratio ({}) should be between 0 and 1", minIntegrityRatio);
        }

        if (weakIntegrityRatio < minIntegrityRatio) {
            log.warn("Weak integrity ratio ({}) should not be below minimum integrity ratio ({})",
                    weakIntegrityRatio, minIntegrityRatio);
        }

        if (namingSimilarityThreshold <= 0.0 || namingSimilarityThreshold > 1.0) {
            log.warn("Naming similarity threshold ({}) should be in (0, 1]", namingSimilarityThreshold);
        }

        if (highConfidenceThreshold <= mediumConfidenceThreshold) {
            log.warn("High confidence threshold ({}) should be greater than medium confidence threshold ({})",
                    highConfidenceThreshold, mediumConfidenceThreshold);
        }

        if (Math.abs(schemaWeight + dataWeight - 1.0) > 1e-9) {
            log.warn("Schema weight ({}) and data weight ({}) should add up to 1.0", schemaWeight, dataWeight);
        }

        if (schemaBaseConfidence > schemaConfidenceCap) {
            log.warn("Schema base confidence ({}) exceeds the schema confidence cap ({})",
                    schemaBaseConfidence, schemaConfidenceCap);
        }

        log.debug("Using thresholds - minDistinct: {}, minMatched: {}, minIntegrity: {}, concurrency: {}, profile: {}",
                minDistinctSourceValues, minMatchedValues, minIntegrityRatio, concurrency, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Min distinct: %d | Min matched: %d | Min integrity: %.2f | Naming: %.2f | Concurrency: %d",
                profileName, minDistinctSourceValues, minMatchedValues, minIntegrityRatio,
                namingSimilarityThreshold, concurrency);
    }
}
