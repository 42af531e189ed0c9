package org.carball.relinfer.model.proposal;

import lombok.Builder;
import lombok.Data;
import org.carball.relinfer.model.candidate.CandidateKey;
import org.carball.relinfer.model.candidate.EvidenceOrigin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class RelationshipProposal {
    private String id;
    private String sourceTable;
    private String sourceField;
    private String targetTable;
    private String targetField;
    private RelationshipType relationshipType;
    private double confidence;
    private ConfidenceBucket confidenceBucket;
    private ConfidenceFactors confidenceFactors;
    private EvidenceOrigin origin;
    @Builder.Default
    private List<String> evidence = new ArrayList<>();
    private String proposedAction;
    private String sqlPreview;
    private boolean reviewRequired;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public boolean isHasRelationship() {
        return true;
    }

    public CandidateKey key() {
        return new CandidateKey(sourceTable, sourceField, targetTable);
    }
}
