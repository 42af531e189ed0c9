package org.carball.relinfer.analyzer.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.candidate.SchemaLinkEvidence;
import org.carball.relinfer.model.proposal.ConfidenceFactors;
import org.carball.relinfer.model.proposal.RelationshipType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sums the contributions of all collectors into a data confidence, blends it
 * with schema confidence when a declared link exists, and clamps the result.
 */
@Slf4j
public class WeightedSumScoringStrategy implements ScoringStrategy {

    private final List<EvidenceCollector> collectors;
    private final InferenceThresholds thresholds;

    public WeightedSumScoringStrategy(List<EvidenceCollector> collectors, InferenceThresholds thresholds) {
        this.collectors = List.copyOf(collectors);
        this.thresholds = thresholds;
    }

    @Override
    public ScoreResult score(ScoringInput input) {
        Map<ConfidenceFactor, Double> factors = new EnumMap<>(ConfidenceFactor.class);
        List<String> evidence = new ArrayList<>();

        for (EvidenceCollector collector : collectors) {
            Optional<EvidenceContribution> contribution = collector.evaluate(input);
            contribution.ifPresent(c -> {
                factors.merge(c.factor(), c.value(), Double::sum);
                evidence.add(c.note());
            });
        }

        double dataConfidence = factors.values().stream().mapToDouble(Double::doubleValue).sum();
        double confidence = dataConfidence;

        SchemaLinkEvidence schemaLink = input.candidate().getSchemaLink();
        if (schemaLink != null) {
            evidence.addAll(schemaLink.notes());
            confidence = thresholds.getSchemaWeight() * schemaLink.confidence()
                    + thresholds.getDataWeight() * dataConfidence;
            evidence.add(String.format("Blended %.2f x schema %.2f + %.2f x data %.2f",
                    thresholds.getSchemaWeight(), schemaLink.confidence(),
                    thresholds.getDataWeight(), dataConfidence));

            if (agrees(schemaLink, input.cardinality().type())) {
                confidence += thresholds.getSchemaAgreementBonus();
                evidence.add(String.format("Schema and data agree on %s (+%.2f)",
                        input.cardinality().type(), thresholds.getSchemaAgreementBonus()));
            } else {
                evidence.add("Schema declaration disagrees with measured " + input.cardinality().type());
            }
            factors.put(ConfidenceFactor.SCHEMA_EVIDENCE, confidence - dataConfidence);
        }

        double clamped = Math.max(thresholds.getMinConfidence(), Math.min(thresholds.getMaxConfidence(), confidence));
        double rounded = Math.round(clamped * 1000.0) / 1000.0;

        log.debug("{} scored {} (raw {})", input.candidate().key(), rounded, confidence);
        return new ScoreResult(rounded, toFactors(factors), List.copyOf(evidence));
    }

    /**
     * The source side is always compared; the target side only when the link declares it.
     */
    private static boolean agrees(SchemaLinkEvidence schemaLink, RelationshipType type) {
        if (schemaLink.impliesManyFromSource() != type.isManyFromSource()) {
            return false;
        }
        return !schemaLink.declaresTargetSide() || schemaLink.impliesManyToTarget() == type.isManyToTarget();
    }

    private static ConfidenceFactors toFactors(Map<ConfidenceFactor, Double> factors) {
        return ConfidenceFactors.builder()
                .schemaEvidence(round(factors.getOrDefault(ConfidenceFactor.SCHEMA_EVIDENCE, 0.0)))
                .referentialIntegrity(round(factors.getOrDefault(ConfidenceFactor.REFERENTIAL_INTEGRITY, 0.0)))
                .namingSimilarity(round(factors.getOrDefault(ConfidenceFactor.NAMING_SIMILARITY, 0.0)))
                .dataVolume(round(factors.getOrDefault(ConfidenceFactor.DATA_VOLUME, 0.0)))
                .cardinalityClarity(round(factors.getOrDefault(ConfidenceFactor.CARDINALITY_CLARITY, 0.0)))
                .build();
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
