package org.carball.relinfer.model.dataset;

import lombok.Builder;
import lombok.Value;

/**
 * A column of a profiled table. Statistics are zero until the column has been
 * profiled; for array columns {@code distinctCount} is taken over the flattened
 * elements.
 */
@Value
@Builder(toBuilder = true)
public class Column {
    String name;
    @Builder.Default
    ColumnShape shape = ColumnShape.SCALAR;
    @Builder.Default
    boolean nullable = true;
    /** Declared type in the backing store; {@code null} when the store is untyped. */
    String dataType;
    long nonNullCount;
    long distinctCount;
    long maxElementsPerRecord;
    double avgElementsPerRecord;

    public Column withProfile(ColumnProfile profile) {
        return toBuilder()
                .nonNullCount(profile.nonNullCount())
                .distinctCount(profile.distinctCount())
                .maxElementsPerRecord(profile.maxElementsPerRecord())
                .avgElementsPerRecord(profile.avgElementsPerRecord())
                .build();
    }

    public boolean hasValues() {
        return nonNullCount > 0;
    }
}
