package org.carball.relinfer.model.dataset;

public record ColumnProfile(
        long totalRows,
        long nonNullCount,
        long distinctCount,
        long maxElementsPerRecord,
        double avgElementsPerRecord
) {

    public static ColumnProfile empty(long totalRows) {
        return new ColumnProfile(totalRows, 0, 0, 0, 0.0);
    }
}
