package org.carball.relinfer.analyzer;

import org.carball.relinfer.SampleDatasets;
import org.carball.relinfer.exception.DataSourceException;
import org.carball.relinfer.exception.TableEnumerationException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.DatasetProfile;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.progress.ProgressEvent;
import org.carball.relinfer.progress.ProgressSink;
import org.carball.relinfer.progress.ProgressStage;
import org.carball.relinfer.source.DataSource;
import org.carball.relinfer.source.InMemoryDataSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class DatasetProfilerTest {

    private final DatasetProfiler profiler = new DatasetProfiler();

    @Test
    void shouldProfileEveryColumn() {
        // Given
        List<ProgressEvent> events = new ArrayList<>();

        // When
        DatasetProfile profile = profiler.profile(
                new InMemoryDataSource(SampleDatasets.postsAndTags()), events::add);

        // Then
        assertThat(profile.sourceId()).isEqualTo("blog");
        assertThat(profile.columnErrors()).isEmpty();

        Column tags = profile.findTable("posts").flatMap(t -> t.findColumn("tags")).orElseThrow();
        assertThat(tags.getShape()).isEqualTo(ColumnShape.ARRAY_OF_IDENTIFIERS);
        assertThat(tags.getNonNullCount()).isEqualTo(200);
        assertThat(tags.getDistinctCount()).isEqualTo(18);
        assertThat(tags.getMaxElementsPerRecord()).isEqualTo(5);
        assertThat(tags.getAvgElementsPerRecord()).isCloseTo(2.3, within(1e-9));

        assertThat(events).extracting(ProgressEvent::stage)
                .containsExactly(ProgressStage.DISCOVERY, ProgressStage.PROFILING, ProgressStage.PROFILING);
        assertThat(events.get(2).percentComplete()).isEqualTo(100.0);
    }

    @Test
    void shouldRecordFailingColumnAndContinue() {
        // Given
        DataSource source = new FailingColumn(new InMemoryDataSource(SampleDatasets.ordersAndCustomers()), "amount");

        // When
        DatasetProfile profile = profiler.profile(source, ProgressSink.NO_OP);

        // Then
        assertThat(profile.columnError("orders", "amount")).contains("profiling query timed out");
        Column amount = profile.findTable("orders").flatMap(t -> t.findColumn("amount")).orElseThrow();
        assertThat(amount.hasValues()).isFalse();
        Column reference = profile.findTable("orders").flatMap(t -> t.findColumn("customer_ref")).orElseThrow();
        assertThat(reference.getNonNullCount()).isEqualTo(80);
    }

    @Test
    void shouldFailWhenTablesCannotBeListed() {
        // Given
        DataSource source = new FailingColumn(new InMemoryDataSource(SampleDatasets.ordersAndCustomers()), null) {
            @Override
            public List<Table> listTables() {
                throw new DataSourceException("connection refused");
            }
        };

        // When/Then
        assertThatThrownBy(() -> profiler.profile(source, ProgressSink.NO_OP))
                .isInstanceOf(TableEnumerationException.class)
                .hasMessageContaining("shop")
                .hasCauseInstanceOf(DataSourceException.class);
    }

    private static class FailingColumn implements DataSource {
        private final DataSource delegate;
        private final String failingColumn;

        FailingColumn(DataSource delegate, String failingColumn) {
            this.delegate = delegate;
            this.failingColumn = failingColumn;
        }

        @Override
        public String sourceId() {
            return delegate.sourceId();
        }

        @Override
        public List<Table> listTables() {
            return delegate.listTables();
        }

        @Override
        public ColumnProfile profileColumn(Table table, Column column) {
            if (column.getName().equals(failingColumn)) {
                throw new DataSourceException("profiling query timed out");
            }
            return delegate.profileColumn(table, column);
        }

        @Override
        public OverlapResult computeOverlap(Table table, Column column, Table targetTable, String targetKeyColumn) {
            return delegate.computeOverlap(table, column, targetTable, targetKeyColumn);
        }
    }
}
