package org.carball.relinfer.model.candidate;

import java.util.List;

/**
 * A declared link resolved against the known tables, with its schema-only confidence.
 */
public record SchemaLinkEvidence(
        LinkDescriptor descriptor,
        String targetTable,
        double confidence,
        List<String> notes
) {

    /**
     * Multiple links per source record are allowed unless the source system
     * declares a single-record preference.
     */
    public boolean impliesManyFromSource() {
        return !Boolean.TRUE.equals(descriptor.prefersSingleRecordLink());
    }

    public boolean declaresTargetSide() {
        return descriptor.inversePrefersSingleRecordLink() != null;
    }

    public boolean impliesManyToTarget() {
        return !Boolean.TRUE.equals(descriptor.inversePrefersSingleRecordLink());
    }
}
