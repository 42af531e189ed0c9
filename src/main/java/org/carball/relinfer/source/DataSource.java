package org.carball.relinfer.source;

import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;

import java.util.List;
import java.util.OptionalLong;

/**
 * Read-only handle on an imported dataset. Implementations should push the
 * aggregation to the backing store where it can do so. Failures of a single
 * query are reported as {@link org.carball.relinfer.exception.DataSourceException}.
 */
public interface DataSource {

    /**
     * Identifies the dataset, e.g. for caching table discovery.
     */
    String sourceId();

    /**
     * Tables with their row counts and column shapes. Column statistics may be
     * left empty; they are filled in by profiling.
     */
    List<Table> listTables();

    ColumnProfile profileColumn(Table table, Column column);

    OverlapResult computeOverlap(Table table, Column column, Table targetTable, String targetKeyColumn);

    /**
     * Largest number of source rows referencing one single value of the column.
     * Empty when the adapter cannot tell.
     */
    default OptionalLong maxReferencesPerValue(Table table, Column column) {
        return OptionalLong.empty();
    }
}
