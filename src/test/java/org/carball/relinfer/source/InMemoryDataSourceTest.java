package org.carball.relinfer.source;

import org.carball.relinfer.exception.DataSourceException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.source.DatasetSnapshot.TableData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryDataSourceTest {

    private InMemoryDataSource dataSource;
    private Table items;
    private Table products;

    @BeforeEach
    void setUp() {
        TableData productData = TableData.builder().name("products").id("tblProducts").build()
                .row("id", 7, "name", "Lamp")
                .row("id", 8, "name", "Desk")
                .row("id", 9, "name", "Chair");
        TableData itemData = TableData.builder().name("items").build()
                .row("id", "i1", "product_id", "7", "bundle", List.of(7, 8))
                .row("id", "i2", "product_id", 7L, "bundle", List.of())
                .row("id", "i3", "product_id", new BigDecimal("8.0"), "bundle", List.of(8, 42, 9))
                .row("id", "i4", "product_id", null, "bundle", null);

        dataSource = new InMemoryDataSource(new DatasetSnapshot("catalog", new ArrayList<>(List.of(productData, itemData))));
        List<Table> tables = dataSource.listTables();
        products = tables.get(0);
        items = tables.get(1);
    }

    @Test
    void shouldListTablesWithShapes() {
        assertThat(dataSource.sourceId()).isEqualTo("catalog");
        assertThat(products.getSourceTableId()).isEqualTo("tblProducts");
        assertThat(items.getRowCount()).isEqualTo(4);
        assertThat(items.getColumns()).extracting(Column::getName).containsExactly("id", "product_id", "bundle");
        assertThat(column("bundle").getShape()).isEqualTo(ColumnShape.ARRAY_OF_IDENTIFIERS);
        assertThat(column("product_id").getShape()).isEqualTo(ColumnShape.SCALAR);
        assertThat(column("product_id").isNullable()).isTrue();
        assertThat(column("id").isNullable()).isFalse();
    }

    @Test
    void shouldTreatNumbersAndTheirTextAsSameIdentifier() {
        // When
        ColumnProfile profile = dataSource.profileColumn(items, column("product_id"));

        // Then
        assertThat(profile.totalRows()).isEqualTo(4);
        assertThat(profile.nonNullCount()).isEqualTo(3);
        assertThat(profile.distinctCount()).isEqualTo(2);
        assertThat(profile.maxElementsPerRecord()).isEqualTo(1);
    }

    @Test
    void shouldCountEmptyArraysAsNull() {
        // When
        ColumnProfile profile = dataSource.profileColumn(items, column("bundle"));

        // Then
        assertThat(profile.nonNullCount()).isEqualTo(2);
        assertThat(profile.distinctCount()).isEqualTo(4);
        assertThat(profile.maxElementsPerRecord()).isEqualTo(3);
        assertThat(profile.avgElementsPerRecord()).isEqualTo(2.5);
    }

    @Test
    void shouldComputeOverlapAgainstTargetKeys() {
        // When
        OverlapResult overlap = dataSource.computeOverlap(items, column("bundle"), products, "id");

        // Then
        assertThat(overlap.distinctSourceValues()).isEqualTo(4);
        assertThat(overlap.matched()).isEqualTo(3);
        assertThat(overlap.integrityRatio()).isEqualTo(0.75);
    }

    @Test
    void shouldCountReferencesPerValueOncePerRecord() {
        assertThat(dataSource.maxReferencesPerValue(items, column("product_id"))).hasValue(2);
        assertThat(dataSource.maxReferencesPerValue(items, column("bundle"))).hasValue(2);
    }

    @Test
    void shouldFailForUnknownTable() {
        // Given
        Table ghost = Table.builder().name("ghosts").build();

        // When/Then
        assertThatThrownBy(() -> dataSource.profileColumn(ghost, column("id")))
                .isInstanceOf(DataSourceException.class)
                .hasMessageContaining("ghosts");
    }

    private Column column(String name) {
        return items.findColumn(name).orElseThrow();
    }
}
