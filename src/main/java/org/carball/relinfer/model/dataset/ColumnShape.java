package org.carball.relinfer.model.dataset;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColumnShape {
    SCALAR("scalar"),
    ARRAY_OF_IDENTIFIERS("array-of-identifiers");

    private final String displayName;

    ColumnShape(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isArray() {
        return this == ARRAY_OF_IDENTIFIERS;
    }
}
