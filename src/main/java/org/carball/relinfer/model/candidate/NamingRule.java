package org.carball.relinfer.model.candidate;

public enum NamingRule {
    EXACT_TABLE_NAME("exact table name"),
    KEY_SUFFIX("key suffix"),
    EDIT_DISTANCE("edit distance");

    private final String description;

    NamingRule(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
