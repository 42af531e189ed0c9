package org.carball.relinfer.model.proposal;

import lombok.Builder;
import lombok.Value;

/**
 * Named contributions to a confidence value. {@code schemaEvidence} holds the
 * adjustment produced by blending with schema confidence, so the factors add up
 * to the unclamped confidence.
 */
@Value
@Builder(toBuilder = true)
public class ConfidenceFactors {
    double schemaEvidence;
    double referentialIntegrity;
    double namingSimilarity;
    double dataVolume;
    double cardinalityClarity;

    public double total() {
        return schemaEvidence + referentialIntegrity + namingSimilarity + dataVolume + cardinalityClarity;
    }
}
