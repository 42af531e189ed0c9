package org.carball.relinfer.config;

import lombok.Getter;

@Getter
public enum InferenceProfile {

    STRICT("strict", "Only propose links backed by large, clean samples",
            10, 5, 0.8, 0.9, false),

    BALANCED("balanced", "Default settings for most imported datasets",
            5, 3, 0.5, 0.8, false),

    DISCOVERY("discovery", "Surface every plausible link, including unhinted scalar columns",
            3, 2, 0.3, 0.7, true);

    private final String name;
    private final String description;
    private final int minDistinctSourceValues;
    private final int minMatchedValues;
    private final double minIntegrityRatio;
    private final double namingSimilarityThreshold;
    private final boolean probeUnhintedScalarColumns;

    InferenceProfile(String name, String description,
                     int minDistinctSourceValues, int minMatchedValues,
                     double minIntegrityRatio, double namingSimilarityThreshold,
                     boolean probeUnhintedScalarColumns) {
        this.name = name;
        this.description = description;
        this.minDistinctSourceValues = minDistinctSourceValues;
        this.minMatchedValues = minMatchedValues;
        this.minIntegrityRatio = minIntegrityRatio;
        this.namingSimilarityThreshold = namingSimilarityThreshold;
        this.probeUnhintedScalarColumns = probeUnhintedScalarColumns;
    }

    public InferenceThresholds buildThresholds() {
        return InferenceThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .minDistinctSourceValues(minDistinctSourceValues)
                .minMatchedValues(minMatchedValues)
                .minIntegrityRatio(minIntegrityRatio)
                .weakIntegrityRatio(Math.max(minIntegrityRatio, 0.8))
                .namingSimilarityThreshold(namingSimilarityThreshold)
                .probeUnhintedScalarColumns(probeUnhintedScalarColumns)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static InferenceProfile fromName(String name) {
        for (InferenceProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown inference profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (InferenceProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Inference Profiles:\n\n");
        for (InferenceProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
