package org.carball.relinfer.model.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipType {
    ONE_TO_ONE("one-to-one", false, false),
    ONE_TO_MANY("one-to-many", true, false),
    MANY_TO_ONE("many-to-one", false, true),
    MANY_TO_MANY("many-to-many", true, true);

    private final String displayName;
    private final boolean manyFromSource;
    private final boolean manyToTarget;

    RelationshipType(String displayName, boolean manyFromSource, boolean manyToTarget) {
        this.displayName = displayName;
        this.manyFromSource = manyFromSource;
        this.manyToTarget = manyToTarget;
    }

    /**
     * @param manyFromSource a source record links to more than one target
     * @param manyToTarget   a target value is referenced by more than one source record
     */
    public static RelationshipType of(boolean manyFromSource, boolean manyToTarget) {
        if (manyFromSource) {
            return manyToTarget ? MANY_TO_MANY : ONE_TO_MANY;
        }
        return manyToTarget ? MANY_TO_ONE : ONE_TO_ONE;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isManyFromSource() {
        return manyFromSource;
    }

    public boolean isManyToTarget() {
        return manyToTarget;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
