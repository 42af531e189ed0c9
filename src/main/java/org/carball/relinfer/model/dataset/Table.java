package org.carball.relinfer.model.dataset;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of one table at analysis time.
 */
@Value
@Builder(toBuilder = true)
public class Table {
    String name;
    /** Schema the table lives in; {@code null} for stores without schemas. */
    String schema;
    /** Identifier the source system uses for this table, if any. */
    String sourceTableId;
    @Builder.Default
    String keyColumn = "id";
    long rowCount;
    @Singular
    List<Column> columns;

    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equals(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return columns.stream().anyMatch(c -> c.getName().equalsIgnoreCase(columnName));
    }

    public boolean isKeyColumn(String columnName) {
        return keyColumn.equalsIgnoreCase(columnName);
    }

    public Optional<String> keyColumnType() {
        return findColumn(keyColumn).map(Column::getDataType);
    }
}
