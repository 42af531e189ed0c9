package org.carball.relinfer.analyzer.scoring;

import java.util.Optional;

/**
 * Turns one kind of evidence into a contribution. Empty when the evidence does
 * not apply to the candidate.
 */
@FunctionalInterface
public interface EvidenceCollector {

    Optional<EvidenceContribution> evaluate(ScoringInput input);
}
