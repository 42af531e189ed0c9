package org.carball.relinfer.source;

import org.carball.relinfer.exception.DataSourceException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JdbcDataSourceTest {

    private Connection connection;
    private PreparedStatement statement;
    private JdbcDataSource dataSource;

    private final Table orders = Table.builder().name("orders")
            .column(Column.builder().name("customer_id").build())
            .column(Column.builder().name("tag_ids").shape(ColumnShape.ARRAY_OF_IDENTIFIERS).build())
            .build();
    private final Table customers = Table.builder().name("customers").build();

    @BeforeEach
    void setUp() throws SQLException {
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        dataSource = new JdbcDataSource(() -> connection, "public", "test-db");
    }

    @Test
    void shouldPushOverlapComputationToServer() throws SQLException {
        // Given
        ResultSet resultSet = resultSet(new String[]{"DISTINCT_SOURCE_VALUES", "MATCHED"}, new Object[]{40L, 38L});
        when(statement.executeQuery()).thenReturn(resultSet);

        // When
        OverlapResult overlap = dataSource.computeOverlap(orders, column("customer_id"), customers, "id");

        // Then
        assertThat(overlap).isEqualTo(new OverlapResult(40, 38));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .contains("SELECT DISTINCT CAST(\"customer_id\" AS TEXT) AS v FROM \"public\".\"orders\"")
                .contains("FROM \"public\".\"customers\"")
                .contains("LEFT JOIN keys ON keys.k = src.v");
    }

    @Test
    void shouldUnnestArrayColumnsForOverlap() throws SQLException {
        // Given
        ResultSet resultSet = resultSet(new String[]{"distinct_source_values", "matched"}, new Object[]{18L, 18L});
        when(statement.executeQuery()).thenReturn(resultSet);

        // When
        dataSource.computeOverlap(orders, column("tag_ids"), customers, "id");

        // Then
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue()).contains("CROSS JOIN LATERAL unnest(s.\"tag_ids\") AS u(e)");
    }

    @Test
    void shouldProfileScalarColumn() throws SQLException {
        // Given
        ResultSet resultSet = resultSet(new String[]{"total_rows", "non_null_count", "distinct_count"},
                new Object[]{100L, 80L, 40L});
        when(statement.executeQuery()).thenReturn(resultSet);

        // When
        ColumnProfile profile = dataSource.profileColumn(orders, column("customer_id"));

        // Then
        assertThat(profile).isEqualTo(new ColumnProfile(100, 80, 40, 1, 1.0));
    }

    @Test
    void shouldListTablesFromInformationSchema() throws SQLException {
        // Given
        ResultSet columns = resultSet(new String[]{"table_name", "column_name", "data_type", "udt_name", "is_nullable"},
                new Object[]{"orders", "order_no", "integer", "int4", "NO"},
                new Object[]{"orders", "customer_id", "USER-DEFINED", "customer_code", "YES"},
                new Object[]{"orders", "tag_ids", "ARRAY", "_int4", "YES"});
        ResultSet primaryKeys = resultSet(new String[]{"table_name", "column_name"},
                new Object[]{"orders", "order_no"});
        ResultSet count = resultSet(new String[]{"row_count"}, new Object[]{12L});
        when(statement.executeQuery()).thenReturn(columns, primaryKeys, count);

        // When
        List<Table> tables = dataSource.listTables();

        // Then
        assertThat(tables).singleElement().satisfies(table -> {
            assertThat(table.getName()).isEqualTo("orders");
            assertThat(table.getKeyColumn()).isEqualTo("order_no");
            assertThat(table.getRowCount()).isEqualTo(12);
            assertThat(table.findColumn("tag_ids").orElseThrow().getShape()).isEqualTo(ColumnShape.ARRAY_OF_IDENTIFIERS);
            assertThat(table.findColumn("order_no").orElseThrow().isNullable()).isFalse();
            assertThat(table.getSchema()).isEqualTo("public");
            assertThat(table.keyColumnType()).contains("integer");
            assertThat(table.findColumn("customer_id").orElseThrow().getDataType()).isEqualTo("customer_code");
        });
        verify(statement, times(2)).setString(1, "public");
    }

    @Test
    void shouldWrapSqlErrors() throws SQLException {
        // Given
        when(statement.executeQuery()).thenThrow(new SQLException("relation \"orders\" does not exist"));

        // When/Then
        assertThatThrownBy(() -> dataSource.profileColumn(orders, column("customer_id")))
                .isInstanceOf(DataSourceException.class)
                .hasMessageContaining("Query failed on test-db")
                .hasMessageContaining("does not exist")
                .hasCauseInstanceOf(SQLException.class);
    }

    private Column column(String name) {
        return orders.findColumn(name).orElseThrow();
    }

    private static ResultSet resultSet(String[] labels, Object[]... rows) throws SQLException {
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(labels.length);
        for (int i = 0; i < labels.length; i++) {
            when(metaData.getColumnLabel(i + 1)).thenReturn(labels[i]);
        }

        AtomicInteger cursor = new AtomicInteger(-1);
        when(resultSet.next()).thenAnswer(invocation -> cursor.incrementAndGet() < rows.length);
        when(resultSet.getObject(anyInt())).thenAnswer(invocation -> {
            int index = invocation.getArgument(0);
            return rows[cursor.get()][index - 1];
        });
        return resultSet;
    }
}
