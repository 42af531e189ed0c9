package org.carball.relinfer.model.candidate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.proposal.ConfidenceFactors;
import org.carball.relinfer.model.proposal.RelationshipType;

import java.util.List;

/**
 * Entry of the raw candidate trail. Every candidate that entered analysis ends up
 * here, including those without a relationship and those that failed.
 */
@Value
@Builder(toBuilder = true)
public class CandidateAnalysis {
    CandidateRelationship candidate;
    boolean hasRelationship;
    String reason;
    OverlapResult overlap;
    CardinalityResult cardinality;
    Double confidence;
    ConfidenceFactors confidenceFactors;
    @Singular("evidenceEntry")
    List<String> evidence;
    String errorMessage;

    public static CandidateAnalysis noRelationship(CandidateRelationship candidate, String reason,
                                                   List<String> evidence) {
        return CandidateAnalysis.builder()
                .candidate(candidate)
                .hasRelationship(false)
                .reason(reason)
                .evidence(evidence)
                .build();
    }

    public static CandidateAnalysis failed(CandidateRelationship candidate, String errorMessage,
                                           List<String> evidence) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("A failed analysis needs an error message");
        }
        return CandidateAnalysis.builder()
                .candidate(candidate)
                .hasRelationship(false)
                .reason("analysis error")
                .evidence(evidence)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isFailed() {
        return errorMessage != null;
    }

    /** Absent for entries without a relationship. */
    public RelationshipType getRelationshipType() {
        return hasRelationship && cardinality != null ? cardinality.type() : null;
    }

    @JsonIgnore
    public CandidateKey getKey() {
        return candidate.key();
    }
}
