package org.carball.relinfer.source;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform tabular result returned by every data source query, whatever the
 * backing store hands back.
 */
public final class QueryResult {

    private final List<Map<String, Object>> rows;

    private QueryResult(List<Map<String, Object>> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Drains a JDBC result set. Column labels are lower-cased.
     */
    public static QueryResult from(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(metaData.getColumnLabel(i).toLowerCase(), resultSet.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(rows);
    }

    public int size() {
        return rows.size();
    }

    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Numeric value of the first row; {@code null} and missing rows read as zero.
     */
    public long getLong(String column) {
        return firstRow()
                .map(row -> row.get(column))
                .map(QueryResult::toNumber)
                .map(Number::longValue)
                .orElse(0L);
    }

    public double getDouble(String column) {
        return firstRow()
                .map(row -> row.get(column))
                .map(QueryResult::toNumber)
                .map(Number::doubleValue)
                .orElse(0.0);
    }

    public Optional<String> getString(int rowIndex, String column) {
        if (rowIndex >= rows.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(rowIndex).get(column)).map(Object::toString);
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Expected a numeric value but got '" + value + "'", e);
        }
    }
}
