package org.carball.relinfer.analyzer;

import org.carball.relinfer.model.candidate.SchemaLinkEvidence;

import java.util.List;
import java.util.Map;

/**
 * Declared links resolved against the known tables. Links that could not be
 * resolved are kept as error notes keyed by {@code table.column}.
 */
public record SchemaEvidence(
        List<SchemaLinkEvidence> links,
        Map<String, List<String>> resolutionErrors
) {

    public static SchemaEvidence none() {
        return new SchemaEvidence(List.of(), Map.of());
    }

    public List<String> resolutionErrorsFor(String table, String column) {
        return resolutionErrors.getOrDefault(table + "." + column, List.of());
    }

    public int resolutionErrorCount() {
        return resolutionErrors.values().stream().mapToInt(List::size).sum();
    }
}
