package org.carball.relinfer.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.DataSourceException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Data source over a snapshot held in memory. Values are compared by their
 * string form so that {@code 7} and {@code "7"} are the same identifier.
 */
@Slf4j
public class InMemoryDataSource implements DataSource {

    private final String sourceId;
    private final Map<String, DatasetSnapshot.TableData> tablesByName = new LinkedHashMap<>();

    public InMemoryDataSource(DatasetSnapshot snapshot) {
        this.sourceId = snapshot.getSourceId() != null ? snapshot.getSourceId() : "in-memory";
        for (DatasetSnapshot.TableData table : snapshot.getTables()) {
            tablesByName.put(table.getName(), table);
        }
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public List<Table> listTables() {
        List<Table> tables = new ArrayList<>();
        for (DatasetSnapshot.TableData data : tablesByName.values()) {
            List<Map<String, Object>> rows = rowsOf(data);
            Set<String> columnNames = new LinkedHashSet<>();
            rows.forEach(row -> columnNames.addAll(row.keySet()));

            Table.TableBuilder table = Table.builder()
                    .name(data.getName())
                    .sourceTableId(data.getId())
                    .keyColumn(data.getKeyColumn() != null ? data.getKeyColumn() : "id")
                    .rowCount(rows.size());

            for (String columnName : columnNames) {
                boolean array = rows.stream().map(row -> row.get(columnName)).anyMatch(v -> v instanceof Collection);
                boolean nullable = rows.stream().anyMatch(row -> row.get(columnName) == null);
                table.column(Column.builder()
                        .name(columnName)
                        .shape(array ? ColumnShape.ARRAY_OF_IDENTIFIERS : ColumnShape.SCALAR)
                        .nullable(nullable)
                        .build());
            }
            tables.add(table.build());
        }
        log.debug("Listed {} tables from snapshot '{}'", tables.size(), sourceId);
        return tables;
    }

    @Override
    public ColumnProfile profileColumn(Table table, Column column) {
        List<Map<String, Object>> rows = rowsOf(requireTable(table.getName()));

        long nonNull = 0;
        long totalElements = 0;
        long maxElements = 0;
        Set<String> distinct = new LinkedHashSet<>();

        for (Map<String, Object> row : rows) {
            List<String> elements = elementsOf(row.get(column.getName()));
            if (elements.isEmpty()) {
                continue;
            }
            nonNull++;
            totalElements += elements.size();
            maxElements = Math.max(maxElements, elements.size());
            distinct.addAll(elements);
        }

        if (nonNull == 0) {
            return ColumnProfile.empty(rows.size());
        }
        return new ColumnProfile(rows.size(), nonNull, distinct.size(), maxElements,
                (double) totalElements / nonNull);
    }

    @Override
    public OverlapResult computeOverlap(Table table, Column column, Table targetTable, String targetKeyColumn) {
        Set<String> sourceValues = distinctValues(requireTable(table.getName()), column.getName());
        Set<String> targetKeys = distinctValues(requireTable(targetTable.getName()), targetKeyColumn);

        long matched = sourceValues.stream().filter(targetKeys::contains).count();
        return new OverlapResult(sourceValues.size(), matched);
    }

    @Override
    public OptionalLong maxReferencesPerValue(Table table, Column column) {
        Map<String, Long> references = new HashMap<>();
        for (Map<String, Object> row : rowsOf(requireTable(table.getName()))) {
            for (String value : new LinkedHashSet<>(elementsOf(row.get(column.getName())))) {
                references.merge(value, 1L, Long::sum);
            }
        }
        return OptionalLong.of(references.values().stream().mapToLong(Long::longValue).max().orElse(0));
    }

    private DatasetSnapshot.TableData requireTable(String name) {
        DatasetSnapshot.TableData data = tablesByName.get(name);
        if (data == null) {
            throw new DataSourceException("Table not found in snapshot '" + sourceId + "': " + name);
        }
        return data;
    }

    private Set<String> distinctValues(DatasetSnapshot.TableData table, String columnName) {
        Set<String> values = new LinkedHashSet<>();
        for (Map<String, Object> row : rowsOf(table)) {
            values.addAll(elementsOf(row.get(columnName)));
        }
        return values;
    }

    private static List<Map<String, Object>> rowsOf(DatasetSnapshot.TableData table) {
        return table.getRows() != null ? table.getRows() : List.of();
    }

    private static List<String> elementsOf(Object value) {
        if (value == null) {
            return List.of();
        }
        List<String> elements = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    elements.add(identifierOf(element));
                }
            }
        } else {
            elements.add(identifierOf(value));
        }
        return elements;
    }

    static String identifierOf(Object value) {
        if (value instanceof Number number && !(value instanceof BigDecimal)) {
            double asDouble = number.doubleValue();
            if (asDouble == Math.rint(asDouble) && !Double.isInfinite(asDouble)) {
                return Long.toString(number.longValue());
            }
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
