package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.model.candidate.CardinalityResult;
import org.carball.relinfer.model.candidate.SchemaLinkEvidence;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.proposal.RelationshipType;

import java.util.OptionalLong;

/**
 * Classifies a relationship from the maximum links per record on both sides.
 * Without a measured target side it uses the declared inverse preference when
 * there is one, and otherwise the column shape: scalars default to many-to-one,
 * arrays to one-to-many.
 */
@Slf4j
public class CardinalityClassifier {

    public CardinalityResult classify(Column column, OptionalLong maxLinksTo, SchemaLinkEvidence schemaLink) {
        long maxLinksFrom = maxLinksFrom(column);

        if (maxLinksTo.isPresent()) {
            RelationshipType type = RelationshipType.of(maxLinksFrom > 1, maxLinksTo.getAsLong() > 1);
            return new CardinalityResult(type, maxLinksFrom, maxLinksTo.getAsLong(), true);
        }

        if (schemaLink != null && schemaLink.declaresTargetSide()) {
            RelationshipType type = RelationshipType.of(maxLinksFrom > 1, schemaLink.impliesManyToTarget());
            log.debug("{}: target side taken from declared link ({})", column.getName(), type);
            return new CardinalityResult(type, maxLinksFrom, -1, false);
        }

        RelationshipType type = column.getShape().isArray() ? RelationshipType.ONE_TO_MANY : RelationshipType.MANY_TO_ONE;
        log.debug("{}: no target-side measurement, falling back to shape ({})", column.getName(), type);
        return new CardinalityResult(type, maxLinksFrom, -1, false);
    }

    private static long maxLinksFrom(Column column) {
        if (column.getShape().isArray()) {
            return column.getMaxElementsPerRecord();
        }
        return column.hasValues() ? 1 : 0;
    }
}
