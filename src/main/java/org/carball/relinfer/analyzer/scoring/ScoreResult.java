package org.carball.relinfer.analyzer.scoring;

import org.carball.relinfer.model.proposal.ConfidenceFactors;

import java.util.List;

public record ScoreResult(double confidence, ConfidenceFactors factors, List<String> evidence) {
}
