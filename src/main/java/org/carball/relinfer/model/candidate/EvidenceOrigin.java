package org.carball.relinfer.model.candidate;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceOrigin {
    SCHEMA("schema"),
    NAMING("naming"),
    BOTH("both"),
    /** Target found by probing key sets with the column's values. */
    DATA("data");

    private final String displayName;

    EvidenceOrigin(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public EvidenceOrigin merge(EvidenceOrigin other) {
        if (other == null || other == this) {
            return this;
        }
        if ((this == SCHEMA && other == NAMING) || (this == NAMING && other == SCHEMA)) {
            return BOTH;
        }
        if (this == BOTH || other == BOTH) {
            return BOTH;
        }
        return this == DATA ? other : this;
    }
}
