package org.carball.relinfer.analyzer.scoring;

/**
 * One bounded contribution to the data confidence, with the note explaining it.
 */
public record EvidenceContribution(ConfidenceFactor factor, double value, String note) {
}
