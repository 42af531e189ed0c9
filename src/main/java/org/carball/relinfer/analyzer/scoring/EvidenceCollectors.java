package org.carball.relinfer.analyzer.scoring;

import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.candidate.CardinalityResult;
import org.carball.relinfer.model.candidate.NameMatch;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.proposal.RelationshipType;

import java.util.List;
import java.util.Optional;

/**
 * The standard evidence collectors, each reading its weights from the thresholds.
 */
public final class EvidenceCollectors {

    private EvidenceCollectors() {
    }

    public static List<EvidenceCollector> standard(InferenceThresholds thresholds) {
        return List.of(
                integrity(thresholds),
                weakIntegrityPenalty(thresholds),
                cardinalityMeasurement(thresholds),
                patternClarity(thresholds),
                shapeMatch(thresholds),
                dataVolume(thresholds),
                namingSimilarity(thresholds));
    }

    /**
     * Base score for a candidate whose integrity analysis completed.
     */
    public static EvidenceCollector integrity(InferenceThresholds thresholds) {
        return input -> {
            OverlapResult overlap = input.overlap();
            return Optional.of(new EvidenceContribution(ConfidenceFactor.REFERENTIAL_INTEGRITY,
                    thresholds.getBaseAnalysisScore(),
                    String.format("Referential integrity %.2f%% (%d of %d distinct values found in %s)",
                            overlap.integrityPercent(), overlap.matched(), overlap.distinctSourceValues(),
                            input.candidate().getTargetTable())));
        };
    }

    public static EvidenceCollector weakIntegrityPenalty(InferenceThresholds thresholds) {
        return input -> {
            double ratio = input.overlap().integrityRatio();
            if (ratio >= thresholds.getWeakIntegrityRatio()) {
                return Optional.empty();
            }
            return Optional.of(new EvidenceContribution(ConfidenceFactor.REFERENTIAL_INTEGRITY,
                    -thresholds.getWeakIntegrityPenalty(),
                    String.format("Integrity below %.0f%% (-%.2f)",
                            thresholds.getWeakIntegrityRatio() * 100, thresholds.getWeakIntegrityPenalty())));
        };
    }

    public static EvidenceCollector cardinalityMeasurement(InferenceThresholds thresholds) {
        return input -> {
            CardinalityResult cardinality = input.cardinality();
            if (cardinality.measured()) {
                return Optional.of(new EvidenceContribution(ConfidenceFactor.CARDINALITY_CLARITY,
                        thresholds.getMeasuredCardinalityScore(),
                        String.format("Cardinality %s measured: max %d links per source record, max %d references per target (+%.2f)",
                                cardinality.type(), cardinality.maxLinksFrom(), cardinality.maxLinksTo(),
                                thresholds.getMeasuredCardinalityScore())));
            }
            return Optional.of(new EvidenceContribution(ConfidenceFactor.CARDINALITY_CLARITY,
                    thresholds.getFallbackCardinalityScore(),
                    String.format("Cardinality %s inferred without target-side measurement (+%.2f)",
                            cardinality.type(), thresholds.getFallbackCardinalityScore())));
        };
    }

    /**
     * Bonus for a measured, unambiguous pattern. Many-to-many is inherently noisier.
     */
    public static EvidenceCollector patternClarity(InferenceThresholds thresholds) {
        return input -> {
            CardinalityResult cardinality = input.cardinality();
            if (!cardinality.measured()) {
                return Optional.empty();
            }
            if (cardinality.type() == RelationshipType.MANY_TO_MANY) {
                return Optional.of(new EvidenceContribution(ConfidenceFactor.CARDINALITY_CLARITY,
                        thresholds.getManyToManyPatternBonus(),
                        String.format("Many-to-many pattern (+%.2f)", thresholds.getManyToManyPatternBonus())));
            }
            return Optional.of(new EvidenceContribution(ConfidenceFactor.CARDINALITY_CLARITY,
                    thresholds.getCleanPatternBonus(),
                    String.format("Clear %s pattern (+%.2f)", cardinality.type(), thresholds.getCleanPatternBonus())));
        };
    }

    /**
     * Array columns should back a "many" side and scalar columns a "one" side.
     */
    public static EvidenceCollector shapeMatch(InferenceThresholds thresholds) {
        return input -> {
            CardinalityResult cardinality = input.cardinality();
            boolean array = input.column().getShape().isArray();
            boolean matches = array
                    ? cardinality.maxLinksFrom() > 1 || cardinality.type().isManyFromSource()
                    : cardinality.maxLinksFrom() <= 1;
            double value = matches ? thresholds.getShapeMatchScore() : thresholds.getShapeMismatchScore();
            String note = matches
                    ? String.format("%s column shape matches %s (+%.2f)",
                        input.column().getShape().getDisplayName(), cardinality.type(), value)
                    : String.format("%s column shape does not match %s (+%.2f)",
                        input.column().getShape().getDisplayName(), cardinality.type(), value);
            return Optional.of(new EvidenceContribution(ConfidenceFactor.CARDINALITY_CLARITY, value, note));
        };
    }

    public static EvidenceCollector dataVolume(InferenceThresholds thresholds) {
        return input -> {
            long rows = input.sourceTable().getRowCount();
            long nonNull = input.column().getNonNullCount();
            if (input.overlap().matched() == 0
                    || rows < thresholds.getVolumeMinRows()
                    || nonNull < thresholds.getVolumeMinNonNull()) {
                return Optional.empty();
            }
            return Optional.of(new EvidenceContribution(ConfidenceFactor.DATA_VOLUME,
                    thresholds.getDataVolumeScore(),
                    String.format("Sample of %d rows with %d non-null values (+%.2f)",
                            rows, nonNull, thresholds.getDataVolumeScore())));
        };
    }

    /**
     * Names only choose which target to test. The weight defaults to zero, so the
     * match is recorded without moving the score.
     */
    public static EvidenceCollector namingSimilarity(InferenceThresholds thresholds) {
        return input -> {
            NameMatch match = input.candidate().getNameMatch();
            if (match == null) {
                return Optional.empty();
            }
            double value = thresholds.getNamingSimilarityWeight() * match.similarity();
            return Optional.of(new EvidenceContribution(ConfidenceFactor.NAMING_SIMILARITY, value,
                    String.format("Column name matches table %s by %s (similarity %.2f)",
                            match.targetTable(), match.rule().getDescription(), match.similarity())));
        };
    }
}
