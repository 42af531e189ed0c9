package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.TableEnumerationException;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.ColumnProfile;
import org.carball.relinfer.model.dataset.DatasetProfile;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.progress.ProgressEvent;
import org.carball.relinfer.progress.ProgressSink;
import org.carball.relinfer.progress.ProgressStage;
import org.carball.relinfer.source.DataSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes per-column statistics for every table of a data source, one
 * aggregate query per column. A failing column is recorded and left with empty
 * statistics; only a failure to list the tables is fatal.
 */
@Slf4j
public class DatasetProfiler {

    public DatasetProfile profile(DataSource dataSource, ProgressSink progress) {
        List<Table> discovered;
        try {
            discovered = dataSource.listTables();
        } catch (RuntimeException e) {
            log.error("Failed to enumerate tables of {}: {}", dataSource.sourceId(), e.getMessage());
            throw new TableEnumerationException("Failed to enumerate tables of " + dataSource.sourceId(), e);
        }

        progress.report(ProgressEvent.of(ProgressStage.DISCOVERY,
                "Discovered " + discovered.size() + " tables"));
        log.info("Discovered {} tables in {}", discovered.size(), dataSource.sourceId());

        List<Table> profiled = new ArrayList<>();
        Map<String, String> columnErrors = new LinkedHashMap<>();

        for (int i = 0; i < discovered.size(); i++) {
            Table table = discovered.get(i);
            profiled.add(profileTable(dataSource, table, columnErrors));
            progress.report(ProgressEvent.forTable(ProgressStage.PROFILING, table.getName(),
                    "Profiled " + table.getColumns().size() + " columns of " + table.getName(),
                    ProgressEvent.percent(i + 1, discovered.size())));
        }

        return new DatasetProfile(dataSource.sourceId(), List.copyOf(profiled),
                Collections.unmodifiableMap(columnErrors), Instant.now());
    }

    private Table profileTable(DataSource dataSource, Table table, Map<String, String> columnErrors) {
        Table.TableBuilder builder = table.toBuilder().clearColumns();

        for (Column column : table.getColumns()) {
            try {
                ColumnProfile profile = dataSource.profileColumn(table, column);
                builder.column(column.withProfile(profile));
                log.debug("Profiled {}.{}: nonNull={}, distinct={}, maxElements={}",
                        table.getName(), column.getName(), profile.nonNullCount(),
                        profile.distinctCount(), profile.maxElementsPerRecord());
            } catch (RuntimeException e) {
                String message = CandidateAnalyzer.describe(e);
                log.warn("Failed to profile {}.{}: {}", table.getName(), column.getName(), message);
                columnErrors.put(table.getName() + "." + column.getName(), message);
                builder.column(column);
            }
        }

        return builder.build();
    }
}
