package org.carball.relinfer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Partial threshold settings read from a YAML file. Unset keys leave the
 * underlying profile value untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdOverrides {

    @JsonProperty("min_distinct_source_values")
    private Integer minDistinctSourceValues;

    @JsonProperty("min_matched_values")
    private Integer minMatchedValues;

    @JsonProperty("min_integrity_ratio")
    private Double minIntegrityRatio;

    @JsonProperty("weak_integrity_ratio")
    private Double weakIntegrityRatio;

    @JsonProperty("weak_integrity_penalty")
    private Double weakIntegrityPenalty;

    @JsonProperty("naming_similarity_threshold")
    private Double namingSimilarityThreshold;

    @JsonProperty("naming_similarity_weight")
    private Double namingSimilarityWeight;

    @JsonProperty("probe_unhinted_scalar_columns")
    private Boolean probeUnhintedScalarColumns;

    @JsonProperty("volume_min_rows")
    private Long volumeMinRows;

    @JsonProperty("volume_min_non_null")
    private Long volumeMinNonNull;

    @JsonProperty("schema_weight")
    private Double schemaWeight;

    @JsonProperty("data_weight")
    private Double dataWeight;

    @JsonProperty("review_threshold")
    private Double reviewThreshold;

    @JsonProperty("high_confidence_threshold")
    private Double highConfidenceThreshold;

    @JsonProperty("medium_confidence_threshold")
    private Double mediumConfidenceThreshold;

    @JsonProperty("concurrency")
    private Integer concurrency;

    public void applyTo(InferenceThresholds.InferenceThresholdsBuilder builder) {
        if (minDistinctSourceValues != null) builder.minDistinctSourceValues(minDistinctSourceValues);
        if (minMatchedValues != null) builder.minMatchedValues(minMatchedValues);
        if (minIntegrityRatio != null) builder.minIntegrityRatio(minIntegrityRatio);
        if (weakIntegrityRatio != null) builder.weakIntegrityRatio(weakIntegrityRatio);
        if (weakIntegrityPenalty != null) builder.weakIntegrityPenalty(weakIntegrityPenalty);
        if (namingSimilarityThreshold != null) builder.namingSimilarityThreshold(namingSimilarityThreshold);
        if (namingSimilarityWeight != null) builder.namingSimilarityWeight(namingSimilarityWeight);
        if (probeUnhintedScalarColumns != null) builder.probeUnhintedScalarColumns(probeUnhintedScalarColumns);
        if (volumeMinRows != null) builder.volumeMinRows(volumeMinRows);
        if (volumeMinNonNull != null) builder.volumeMinNonNull(volumeMinNonNull);
        if (schemaWeight != null) builder.schemaWeight(schemaWeight);
        if (dataWeight != null) builder.dataWeight(dataWeight);
        if (reviewThreshold != null) builder.reviewThreshold(reviewThreshold);
        if (highConfidenceThreshold != null) builder.highConfidenceThreshold(highConfidenceThreshold);
        if (mediumConfidenceThreshold != null) builder.mediumConfidenceThreshold(mediumConfidenceThreshold);
        if (concurrency != null) builder.concurrency(concurrency);
    }
}
