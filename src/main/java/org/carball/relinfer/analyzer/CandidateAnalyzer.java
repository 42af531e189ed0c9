package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.analyzer.scoring.ScoreResult;
import org.carball.relinfer.analyzer.scoring.ScoringInput;
import org.carball.relinfer.model.candidate.CandidateAnalysis;
import org.carball.relinfer.model.candidate.CandidateRelationship;
import org.carball.relinfer.model.candidate.CardinalityResult;
import org.carball.relinfer.model.candidate.EvidenceOrigin;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.DatasetProfile;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.source.DataSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Runs one candidate through target resolution, integrity, cardinality and
 * scoring. Any failure is recorded on the returned entry instead of thrown.
 */
@Slf4j
public class CandidateAnalyzer {

    static final String REASON_DETECTED = "relationship detected";
    static final String REASON_NO_VALUES = "no non-null values";
    static final String REASON_TARGET_NOT_FOUND = "target table not found";
    static final String REASON_INSUFFICIENT_EVIDENCE = "insufficient evidence";
    static final String REASON_INSUFFICIENT_INTEGRITY = "insufficient referential integrity";

    private final DataSource dataSource;
    private final TargetTableResolver targetResolver;
    private final ReferentialIntegrityAnalyzer integrityAnalyzer;
    private final CardinalityClassifier cardinalityClassifier;
    private final ConfidenceScorer confidenceScorer;

    public CandidateAnalyzer(DataSource dataSource,
                             TargetTableResolver targetResolver,
                             ReferentialIntegrityAnalyzer integrityAnalyzer,
                             CardinalityClassifier cardinalityClassifier,
                             ConfidenceScorer confidenceScorer) {
        this.dataSource = dataSource;
        this.targetResolver = targetResolver;
        this.integrityAnalyzer = integrityAnalyzer;
        this.cardinalityClassifier = cardinalityClassifier;
        this.confidenceScorer = confidenceScorer;
    }

    public CandidateAnalysis analyze(CandidateRelationship candidate, DatasetProfile profile) {
        List<String> evidence = new ArrayList<>(candidate.getDiscoveryNotes());

        try {
            Table source = profile.findTable(candidate.getSourceTable())
                    .orElseThrow(() -> new IllegalStateException("Unknown source table " + candidate.getSourceTable()));
            Column column = source.findColumn(candidate.getSourceColumn())
                    .orElseThrow(() -> new IllegalStateException("Unknown column " + candidate.key()));

            Optional<String> profilingError = profile.columnError(source.getName(), column.getName());
            if (profilingError.isPresent()) {
                return failure(candidate, "profiling failed: " + profilingError.get(), evidence);
            }

            if (!column.hasValues()) {
                evidence.add("Column " + source.getName() + "." + column.getName() + " has no non-null values");
                return CandidateAnalysis.noRelationship(candidate, REASON_NO_VALUES, evidence);
            }

            CandidateRelationship resolved = candidate;
            Table target;
            OverlapResult overlap;
            if (candidate.isResolved()) {
                target = profile.findTable(candidate.getTargetTable())
                        .orElseThrow(() -> new IllegalStateException("Unknown target table " + candidate.getTargetTable()));
                overlap = integrityAnalyzer.measure(source, column, target);
            } else {
                Optional<TargetTableResolver.ResolvedTarget> probe = targetResolver.resolve(source, column, profile.tables());
                if (probe.isEmpty()) {
                    evidence.add("No table's key set contains any value of " + source.getName() + "." + column.getName());
                    return CandidateAnalysis.noRelationship(candidate, REASON_TARGET_NOT_FOUND, evidence);
                }
                target = probe.get().table();
                overlap = probe.get().overlap();
                resolved = candidate.withTarget(target.getName(), EvidenceOrigin.DATA);
                evidence.add("Target " + target.getName() + " found by matching column values against key sets");
            }

            if (!integrityAnalyzer.hasSufficientSample(overlap)) {
                evidence.add(String.format("Only %d distinct values with %d matches; too few to judge",
                        overlap.distinctSourceValues(), overlap.matched()));
                return rejected(resolved, REASON_INSUFFICIENT_EVIDENCE, overlap, evidence);
            }
            if (!integrityAnalyzer.hasSufficientIntegrity(overlap)) {
                evidence.add(String.format("Referential integrity %.2f%% is below the minimum",
                        overlap.integrityPercent()));
                return rejected(resolved, REASON_INSUFFICIENT_INTEGRITY, overlap, evidence);
            }

            OptionalLong maxLinksTo = dataSource.maxReferencesPerValue(source, column);
            CardinalityResult cardinality = cardinalityClassifier.classify(column, maxLinksTo, resolved.getSchemaLink());

            ScoreResult score = confidenceScorer.score(new ScoringInput(resolved, source, column, overlap, cardinality));
            evidence.addAll(score.evidence());

            log.debug("{}: {} with confidence {}", resolved.key(), cardinality.type(), score.confidence());
            return CandidateAnalysis.builder()
                    .candidate(resolved)
                    .hasRelationship(true)
                    .reason(REASON_DETECTED)
                    .overlap(overlap)
                    .cardinality(cardinality)
                    .confidence(score.confidence())
                    .confidenceFactors(score.factors())
                    .evidence(evidence)
                    .build();
        } catch (RuntimeException e) {
            String message = describe(e);
            log.warn("Analysis of {} failed: {}", candidate.key(), message);
            return failure(candidate, message, evidence);
        }
    }

    private static CandidateAnalysis rejected(CandidateRelationship candidate, String reason,
                                              OverlapResult overlap, List<String> evidence) {
        return CandidateAnalysis.noRelationship(candidate, reason, evidence).toBuilder()
                .overlap(overlap)
                .build();
    }

    static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static CandidateAnalysis failure(CandidateRelationship candidate, String message, List<String> evidence) {
        List<String> trail = new ArrayList<>(evidence);
        trail.add("AnalysisError: " + message);
        return CandidateAnalysis.failed(candidate, message, trail);
    }
}
