package org.carball.relinfer.model.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceBucket {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String displayName;

    ConfidenceBucket(String displayName) {
        this.displayName = displayName;
    }

    public static ConfidenceBucket of(double confidence, double highThreshold, double mediumThreshold) {
        if (confidence >= highThreshold) {
            return HIGH;
        }
        if (confidence >= mediumThreshold) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
