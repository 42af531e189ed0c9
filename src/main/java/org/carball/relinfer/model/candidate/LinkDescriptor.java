package org.carball.relinfer.model.candidate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A link declared by the source system: {@code sourceTable.sourceField} points
 * at the table whose source-system id is {@code targetTableId}.
 * The two preference flags are optional; {@code null} means not declared.
 */
public record LinkDescriptor(
        String sourceTable,
        String sourceField,
        String targetTableId,
        @JsonProperty("isSymmetric") boolean symmetric,
        @JsonProperty("hasInverseField") boolean inverseField,
        @JsonProperty("isRequired") boolean required,
        Boolean prefersSingleRecordLink,
        Boolean inversePrefersSingleRecordLink
) {

    public static LinkDescriptor of(String sourceTable, String sourceField, String targetTableId,
                                    boolean symmetric, boolean inverseField, boolean required) {
        return new LinkDescriptor(sourceTable, sourceField, targetTableId,
                symmetric, inverseField, required, null, null);
    }
}
