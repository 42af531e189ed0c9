package org.carball.relinfer.model.dataset;

/**
 * Overlap between the distinct non-null values of a source column and the key
 * set of a target table.
 */
public record OverlapResult(long distinctSourceValues, long matched) {

    public double integrityRatio() {
        return distinctSourceValues == 0 ? 0.0 : (double) matched / distinctSourceValues;
    }

    public double integrityPercent() {
        return Math.round(integrityRatio() * 10000.0) / 100.0;
    }
}
