package org.carball.relinfer.progress;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressStage {
    DISCOVERY("discovery"),
    PROFILING("profiling"),
    SCHEMA_EVIDENCE("schema-evidence"),
    CANDIDATE_GENERATION("candidate-generation"),
    ANALYSIS("analysis"),
    DEDUPLICATION("deduplication"),
    COMPLETE("complete"),
    CANCELLED("cancelled");

    private final String displayName;

    ProgressStage(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
