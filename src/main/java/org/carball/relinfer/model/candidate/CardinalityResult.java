package org.carball.relinfer.model.candidate;

import org.carball.relinfer.model.proposal.RelationshipType;

/**
 * Classified cardinality. {@code measured} is false when {@code maxLinksTo}
 * could not be computed and the type was derived from the column shape.
 */
public record CardinalityResult(
        RelationshipType type,
        long maxLinksFrom,
        long maxLinksTo,
        boolean measured
) {
}
