package org.carball.relinfer.model.dataset;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Profiled tables of one data source. Columns whose profiling query failed keep
 * empty statistics and are listed in {@code columnErrors} under {@code table.column}.
 */
public record DatasetProfile(
        String sourceId,
        List<Table> tables,
        Map<String, String> columnErrors,
        Instant profiledAt
) {

    public Optional<Table> findTable(String name) {
        return tables.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    public Optional<String> columnError(String table, String column) {
        return Optional.ofNullable(columnErrors.get(table + "." + column));
    }
}
