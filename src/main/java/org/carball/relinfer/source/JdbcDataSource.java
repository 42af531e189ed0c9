package org.carball.relinfer.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.DataSourceException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.carball.relinfer.ddl.SqlIdentifiers.qualified;
import static org.carball.relinfer.ddl.SqlIdentifiers.quote;

/**
 * PostgreSQL adapter. Every statistic is one aggregate query evaluated by the
 * server; no column is ever pulled into memory.
 */
@Slf4j
public class JdbcDataSource implements DataSource {

    private static final String LIST_COLUMNS = """
        SELECT c.table_name, c.column_name, c.data_type, c.udt_name, c.is_nullable
        FROM information_schema.columns c
        JOIN information_schema.tables t
          ON t.table_schema = c.table_schema AND t.table_name = c.table_name
        WHERE c.table_schema = ?
          AND t.table_type = 'BASE TABLE'
        ORDER BY c.table_name, c.ordinal_position
    """;

    private static final String LIST_PRIMARY_KEYS = """
        SELECT kcu.table_name, kcu.column_name
        FROM information_schema.table_constraints tc
        JOIN information_schema.key_column_usage kcu
          ON tc.constraint_name = kcu.constraint_name
         AND tc.table_schema = kcu.table_schema
        WHERE tc.table_schema = ?
          AND tc.constraint_type = 'PRIMARY KEY'
    """;

    /**
     * Opens connections on demand.
     */
    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }

    private final ConnectionProvider connectionProvider;
    private final String schema;
    private final String sourceId;

    public JdbcDataSource(String connectionString, String schema) {
        this(() -> DriverManager.getConnection(connectionString), schema, connectionString + "#" + schema);
    }

    public JdbcDataSource(ConnectionProvider connectionProvider, String schema, String sourceId) {
        this.connectionProvider = connectionProvider;
        this.schema = schema;
        this.sourceId = sourceId;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public List<Table> listTables() {
        QueryResult columns = execute(LIST_COLUMNS, schema);
        QueryResult primaryKeys = execute(LIST_PRIMARY_KEYS, schema);

        Map<String, String> keyColumns = new HashMap<>();
        for (int i = 0; i < primaryKeys.size(); i++) {
            String tableName = primaryKeys.getString(i, "table_name").orElseThrow();
            String columnName = primaryKeys.getString(i, "column_name").orElseThrow();
            keyColumns.putIfAbsent(tableName, columnName);
        }

        Map<String, Table.TableBuilder> builders = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String tableName = columns.getString(i, "table_name").orElseThrow();
            String columnName = columns.getString(i, "column_name").orElseThrow();
            String dataType = columns.getString(i, "data_type").orElse("");
            boolean nullable = !"NO".equalsIgnoreCase(columns.getString(i, "is_nullable").orElse("YES"));

            builders.computeIfAbsent(tableName, name -> Table.builder()
                            .name(name)
                            .schema(schema)
                            .sourceTableId(name)
                            .keyColumn(keyColumns.getOrDefault(name, "id")))
                    .column(Column.builder()
                            .name(columnName)
                            .shape("ARRAY".equalsIgnoreCase(dataType) ? ColumnShape.ARRAY_OF_IDENTIFIERS : ColumnShape.SCALAR)
                            .nullable(nullable)
                            .dataType(declaredType(dataType, columns.getString(i, "udt_name").orElse(null)))
                            .build());
        }

        List<Table> tables = new ArrayList<>();
        for (Map.Entry<String, Table.TableBuilder> entry : builders.entrySet()) {
            long rowCount = execute("SELECT COUNT(*) AS row_count FROM " + qualified(schema, entry.getKey()))
                    .getLong("row_count");
            tables.add(entry.getValue().rowCount(rowCount).build());
        }

        log.debug("Listed {} tables in schema {}", tables.size(), schema);
        return tables;
    }

    @Override
    public ColumnProfile profileColumn(Table table, Column column) {
        String col = quote(column.getName());
        String from = qualified(schema, table.getName());

        if (column.getShape().isArray()) {
            QueryResult result = execute("SELECT COUNT(*) AS total_rows, "
                    + "COUNT(*) FILTER (WHERE cardinality(" + col + ") > 0) AS non_null_count, "
                    + "COALESCE(MAX(cardinality(" + col + ")), 0) AS max_elements, "
                    + "COALESCE(AVG(cardinality(" + col + ")) FILTER (WHERE cardinality(" + col + ") > 0), 0) AS avg_elements, "
                    + "(SELECT COUNT(DISTINCT u.e) FROM " + from + " s CROSS JOIN LATERAL unnest(s." + col + ") AS u(e)) AS distinct_count "
                    + "FROM " + from);
            return new ColumnProfile(
                    result.getLong("total_rows"),
                    result.getLong("non_null_count"),
                    result.getLong("distinct_count"),
                    result.getLong("max_elements"),
                    result.getDouble("avg_elements"));
        }

        QueryResult result = execute("SELECT COUNT(*) AS total_rows, "
                + "COUNT(" + col + ") AS non_null_count, "
                + "COUNT(DISTINCT " + col + ") AS distinct_count "
                + "FROM " + from);
        long nonNull = result.getLong("non_null_count");
        if (nonNull == 0) {
            return ColumnProfile.empty(result.getLong("total_rows"));
        }
        return new ColumnProfile(result.getLong("total_rows"), nonNull, result.getLong("distinct_count"), 1, 1.0);
    }

    @Override
    public OverlapResult computeOverlap(Table table, Column column, Table targetTable, String targetKeyColumn) {
        String sql = "WITH src AS (" + distinctValuesQuery(table, column) + "), "
                + "keys AS (SELECT DISTINCT CAST(" + quote(targetKeyColumn) + " AS TEXT) AS k FROM "
                + qualified(schema, targetTable.getName()) + ") "
                + "SELECT COUNT(*) AS distinct_source_values, COUNT(keys.k) AS matched "
                + "FROM src LEFT JOIN keys ON keys.k = src.v";
        QueryResult result = execute(sql);
        return new OverlapResult(result.getLong("distinct_source_values"), result.getLong("matched"));
    }

    @Override
    public OptionalLong maxReferencesPerValue(Table table, Column column) {
        String col = quote(column.getName());
        String from = qualified(schema, table.getName());
        String grouped = column.getShape().isArray()
                ? "SELECT u.e AS ref_id, COUNT(*) AS ref_count FROM " + from + " s "
                  + "CROSS JOIN LATERAL (SELECT DISTINCT x FROM unnest(s." + col + ") AS x) AS u(e) "
                  + "WHERE u.e IS NOT NULL GROUP BY u.e"
                : "SELECT " + col + " AS ref_id, COUNT(*) AS ref_count FROM " + from
                  + " WHERE " + col + " IS NOT NULL GROUP BY " + col;
        QueryResult result = execute("SELECT COALESCE(MAX(ref_count), 0) AS max_refs FROM (" + grouped + ") refs");
        return OptionalLong.of(result.getLong("max_refs"));
    }

    private String distinctValuesQuery(Table table, Column column) {
        String col = quote(column.getName());
        String from = qualified(schema, table.getName());
        if (column.getShape().isArray()) {
            return "SELECT DISTINCT CAST(u.e AS TEXT) AS v FROM " + from + " s "
                    + "CROSS JOIN LATERAL unnest(s." + col + ") AS u(e) WHERE u.e IS NOT NULL";
        }
        return "SELECT DISTINCT CAST(" + col + " AS TEXT) AS v FROM " + from + " WHERE " + col + " IS NOT NULL";
    }

    /**
     * Type name usable in DDL. Domains and enums report {@code USER-DEFINED}
     * and only carry their name in {@code udt_name}.
     */
    static String declaredType(String dataType, String udtName) {
        if (dataType.isEmpty()) {
            return udtName;
        }
        return "USER-DEFINED".equalsIgnoreCase(dataType) && udtName != null ? udtName : dataType;
    }

    private QueryResult execute(String sql, String... parameters) {
        log.debug("Executing: {}", sql);
        try (Connection conn = connectionProvider.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            for (int i = 0; i < parameters.length; i++) {
                stmt.setString(i + 1, parameters[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return QueryResult.from(rs);
            }
        } catch (SQLException e) {
            throw new DataSourceException("Query failed on " + sourceId + ": " + e.getMessage()
                    + " [" + sql.strip() + "]", e);
        }
    }
}
