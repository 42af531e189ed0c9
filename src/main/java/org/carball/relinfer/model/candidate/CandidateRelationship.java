package org.carball.relinfer.model.candidate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.relinfer.model.dataset.ColumnShape;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class CandidateRelationship {
    String sourceTable;
    String sourceColumn;
    String targetTable;
    ColumnShape fieldShape;
    EvidenceOrigin origin;
    NameMatch nameMatch;
    SchemaLinkEvidence schemaLink;
    /** Evidence gathered while discovering the candidate, e.g. schema resolution errors. */
    @Singular
    List<String> discoveryNotes;

    public CandidateKey key() {
        return new CandidateKey(sourceTable, sourceColumn, targetTable);
    }

    public boolean isResolved() {
        return targetTable != null;
    }

    public boolean hasSchemaEvidence() {
        return schemaLink != null;
    }

    public CandidateRelationship withTarget(String resolvedTarget, EvidenceOrigin resolvedBy) {
        return toBuilder()
                .targetTable(resolvedTarget)
                .origin(origin == null ? resolvedBy : origin.merge(resolvedBy))
                .build();
    }
}
