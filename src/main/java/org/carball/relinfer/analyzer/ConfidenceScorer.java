package org.carball.relinfer.analyzer;

import org.carball.relinfer.analyzer.scoring.EvidenceCollectors;
import org.carball.relinfer.analyzer.scoring.ScoreResult;
import org.carball.relinfer.analyzer.scoring.ScoringInput;
import org.carball.relinfer.analyzer.scoring.ScoringStrategy;
import org.carball.relinfer.analyzer.scoring.WeightedSumScoringStrategy;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.proposal.ConfidenceBucket;

public class ConfidenceScorer {

    private final ScoringStrategy strategy;
    private final InferenceThresholds thresholds;

    public ConfidenceScorer(InferenceThresholds thresholds) {
        this(new WeightedSumScoringStrategy(EvidenceCollectors.standard(thresholds), thresholds), thresholds);
    }

    public ConfidenceScorer(ScoringStrategy strategy, InferenceThresholds thresholds) {
        this.strategy = strategy;
        this.thresholds = thresholds;
    }

    public ScoreResult score(ScoringInput input) {
        return strategy.score(input);
    }

    public boolean isReviewRequired(double confidence) {
        return confidence < thresholds.getReviewThreshold();
    }

    public ConfidenceBucket bucketOf(double confidence) {
        return ConfidenceBucket.of(confidence,
                thresholds.getHighConfidenceThreshold(), thresholds.getMediumConfidenceThreshold());
    }
}
