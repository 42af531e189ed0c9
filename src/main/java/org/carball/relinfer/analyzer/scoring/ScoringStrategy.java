package org.carball.relinfer.analyzer.scoring;

public interface ScoringStrategy {

    ScoreResult score(ScoringInput input);
}
