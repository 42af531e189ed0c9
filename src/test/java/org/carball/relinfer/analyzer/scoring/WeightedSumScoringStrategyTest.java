package org.carball.relinfer.analyzer.scoring;

import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.candidate.CandidateRelationship;
import org.carball.relinfer.model.candidate.CardinalityResult;
import org.carball.relinfer.model.candidate.EvidenceOrigin;
import org.carball.relinfer.model.candidate.LinkDescriptor;
import org.carball.relinfer.model.candidate.NameMatch;
import org.carball.relinfer.model.candidate.NamingRule;
import org.carball.relinfer.model.candidate.SchemaLinkEvidence;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.model.proposal.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class WeightedSumScoringStrategyTest {

    private InferenceThresholds thresholds;
    private WeightedSumScoringStrategy strategy;

    @BeforeEach
    void setUp() {
        thresholds = InferenceThresholds.defaults();
        strategy = new WeightedSumScoringStrategy(EvidenceCollectors.standard(thresholds), thresholds);
    }

    @Test
    void shouldClampStrongMeasuredEvidence() {
        // Given
        ScoringInput input = new ScoringInput(candidate(null, null), table(100), scalar(80),
                new OverlapResult(40, 38),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, 2, true));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.99);
        assertThat(result.factors().getReferentialIntegrity()).isEqualTo(0.3);
        assertThat(result.factors().getCardinalityClarity()).isEqualTo(0.7);
        assertThat(result.factors().getDataVolume()).isEqualTo(0.1);
        assertThat(result.factors().getSchemaEvidence()).isZero();
        assertThat(result.evidence())
                .anyMatch(note -> note.startsWith("Referential integrity 95.00% (38 of 40"))
                .anyMatch(note -> note.startsWith("Clear many-to-one pattern"));
    }

    @Test
    void shouldScoreUnmeasuredWeakEvidenceAtOneHalf() {
        // Given
        ScoringInput input = new ScoringInput(candidate(null, null), table(10), scalar(10),
                new OverlapResult(10, 6),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, -1, false));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.5);
        assertThat(result.factors().getReferentialIntegrity()).isEqualTo(0.15);
        assertThat(result.factors().getCardinalityClarity()).isEqualTo(0.35);
        assertThat(result.evidence())
                .contains("Integrity below 80% (-0.15)")
                .anyMatch(note -> note.contains("inferred without target-side measurement"));
    }

    @Test
    void shouldGiveLessCreditWhenArrayShapeDoesNotMatch() {
        // Given
        Column tags = Column.builder().name("tags").shape(ColumnShape.ARRAY_OF_IDENTIFIERS)
                .nonNullCount(10).distinctCount(10).maxElementsPerRecord(1).avgElementsPerRecord(1.0).build();
        ScoringInput input = new ScoringInput(candidate(null, null), table(10), tags,
                new OverlapResult(10, 10),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, 3, true));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.9);
        assertThat(result.evidence())
                .contains("array-of-identifiers column shape does not match many-to-one (+0.10)");
    }

    @Test
    void shouldRecordNamingMatchWithoutMovingScore() {
        // Given
        NameMatch match = new NameMatch("customers", 0.9, NamingRule.KEY_SUFFIX);
        ScoringInput input = new ScoringInput(candidate(match, null), table(10), scalar(10),
                new OverlapResult(10, 6),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, -1, false));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.5);
        assertThat(result.factors().getNamingSimilarity()).isZero();
        assertThat(result.evidence()).contains("Column name matches table customers by key suffix (similarity 0.90)");
    }

    @Test
    void shouldBlendAgreeingSchemaEvidence() {
        // Given
        LinkDescriptor descriptor = new LinkDescriptor("orders", "customer_ref", "tblCustomers",
                false, false, false, true, null);
        SchemaLinkEvidence link = new SchemaLinkEvidence(descriptor, "customers", 0.65, List.of("Declared link"));
        ScoringInput input = new ScoringInput(candidate(null, link), table(10), scalar(10),
                new OverlapResult(10, 6),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, -1, false));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.645);
        assertThat(result.factors().getSchemaEvidence()).isEqualTo(0.145);
        assertThat(result.evidence())
                .contains("Declared link", "Schema and data agree on many-to-one (+0.10)");
    }

    @Test
    void shouldNoteDisagreeingSchemaEvidence() {
        // Given
        SchemaLinkEvidence link = new SchemaLinkEvidence(
                LinkDescriptor.of("orders", "customer_ref", "tblCustomers", false, false, false),
                "customers", 0.65, List.of());
        ScoringInput input = new ScoringInput(candidate(null, link), table(10), scalar(10),
                new OverlapResult(10, 6),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, -1, false));

        // When
        ScoreResult result = strategy.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.545);
        assertThat(result.evidence()).contains("Schema declaration disagrees with measured many-to-one");
    }

    @Test
    void shouldClampToMinimumConfidence() {
        // Given
        EvidenceCollector penalty = input -> Optional.of(
                new EvidenceContribution(ConfidenceFactor.REFERENTIAL_INTEGRITY, -0.4, "Suspicious values"));
        WeightedSumScoringStrategy custom = new WeightedSumScoringStrategy(List.of(penalty), thresholds);
        ScoringInput input = new ScoringInput(candidate(null, null), table(10), scalar(10),
                new OverlapResult(10, 6),
                new CardinalityResult(RelationshipType.MANY_TO_ONE, 1, -1, false));

        // When
        ScoreResult result = custom.score(input);

        // Then
        assertThat(result.confidence()).isEqualTo(0.1);
        assertThat(result.factors().getReferentialIntegrity()).isEqualTo(-0.4);
        assertThat(result.evidence()).containsExactly("Suspicious values");
    }

    private static CandidateRelationship candidate(NameMatch nameMatch, SchemaLinkEvidence schemaLink) {
        return CandidateRelationship.builder()
                .sourceTable("orders")
                .sourceColumn("customer_ref")
                .targetTable("customers")
                .fieldShape(ColumnShape.SCALAR)
                .origin(schemaLink != null ? EvidenceOrigin.SCHEMA : EvidenceOrigin.NAMING)
                .nameMatch(nameMatch)
                .schemaLink(schemaLink)
                .build();
    }

    private static Table table(long rows) {
        return Table.builder().name("orders").rowCount(rows).build();
    }

    private static Column scalar(long nonNull) {
        return Column.builder().name("customer_ref").nonNullCount(nonNull).distinctCount(nonNull / 2)
                .maxElementsPerRecord(1).avgElementsPerRecord(1.0).build();
    }
}
