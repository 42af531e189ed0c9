package org.carball.relinfer.model.proposal;

import lombok.Builder;
import lombok.Data;
import org.carball.relinfer.model.candidate.CandidateAnalysis;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class RelationshipProposalReport {
    private String analysisId;
    private Instant createdAt;
    private String sourceId;
    private String profileName;
    private boolean cancelled;
    private ReportSummary summary;
    private List<RelationshipProposal> relationships;
    /** Raw candidate trail, failed and rejected candidates included. */
    private List<CandidateAnalysis> candidates;

    public List<RelationshipProposal> proposalsIn(ConfidenceBucket bucket) {
        return relationships.stream()
                .filter(p -> p.getConfidenceBucket() == bucket)
                .collect(Collectors.toList());
    }

    public List<CandidateAnalysis> failedCandidates() {
        return candidates.stream()
                .filter(CandidateAnalysis::isFailed)
                .collect(Collectors.toList());
    }
}
