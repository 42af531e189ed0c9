package org.carball.relinfer.model.candidate;

import java.util.Comparator;

/**
 * (sourceTable, sourceColumn, targetTable) triple; the target may be {@code null}
 * while unresolved.
 */
public record CandidateKey(String sourceTable, String sourceColumn, String targetTable)
        implements Comparable<CandidateKey> {

    private static final Comparator<CandidateKey> ORDER = Comparator
            .comparing(CandidateKey::sourceTable)
            .thenComparing(CandidateKey::sourceColumn)
            .thenComparing(CandidateKey::targetTable, Comparator.nullsLast(Comparator.naturalOrder()));

    @Override
    public int compareTo(CandidateKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceTable + "." + sourceColumn + " -> " + (targetTable != null ? targetTable : "?");
    }
}
