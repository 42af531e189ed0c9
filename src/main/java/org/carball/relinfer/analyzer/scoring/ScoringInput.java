package org.carball.relinfer.analyzer.scoring;

import org.carball.relinfer.model.candidate.CandidateRelationship;
import org.carball.relinfer.model.candidate.CardinalityResult;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;

/**
 * Everything known about a candidate once integrity and cardinality are measured.
 */
public record ScoringInput(
        CandidateRelationship candidate,
        Table sourceTable,
        Column column,
        OverlapResult overlap,
        CardinalityResult cardinality
) {
}
