package org.carball.relinfer.model.candidate;

import org.carball.relinfer.model.dataset.ColumnShape;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CandidateAnalysisTest {

    private final CandidateRelationship candidate = CandidateRelationship.builder()
            .sourceTable("orders").sourceColumn("customer_ref").targetTable("customers")
            .fieldShape(ColumnShape.SCALAR).origin(EvidenceOrigin.NAMING).build();

    @Test
    void shouldMarkFailedEntries() {
        // When
        CandidateAnalysis failed = CandidateAnalysis.failed(candidate, "connection reset", List.of());

        // Then
        assertThat(failed.isFailed()).isTrue();
        assertThat(failed.isHasRelationship()).isFalse();
        assertThat(failed.getReason()).isEqualTo("analysis error");
        assertThat(failed.getRelationshipType()).isNull();
    }

    @Test
    void shouldRejectFailureWithoutMessage() {
        // When/Then
        assertThatThrownBy(() -> CandidateAnalysis.failed(candidate, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("error message");
        assertThatThrownBy(() -> CandidateAnalysis.failed(candidate, " ", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
