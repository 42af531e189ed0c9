package org.carball.relinfer.analyzer.scoring;

public enum ConfidenceFactor {
    SCHEMA_EVIDENCE,
    REFERENTIAL_INTEGRITY,
    NAMING_SIMILARITY,
    DATA_VOLUME,
    CARDINALITY_CLARITY
}
