package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.source.DataSource;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the target of an unhinted column by testing its values against every
 * table's key set. The table with the most matches wins, ties going to the
 * alphabetically first name.
 */
@Slf4j
public class TargetTableResolver {

    public record ResolvedTarget(Table table, OverlapResult overlap) {
    }

    private final DataSource dataSource;

    public TargetTableResolver(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public Optional<ResolvedTarget> resolve(Table sourceTable, Column column, List<Table> tables) {
        ResolvedTarget best = null;

        for (Table target : tables.stream().sorted(Comparator.comparing(Table::getName)).toList()) {
            if (!target.hasColumn(target.getKeyColumn())) {
                continue;
            }
            OverlapResult overlap = dataSource.computeOverlap(sourceTable, column, target, target.getKeyColumn());
            if (overlap.matched() > 0 && (best == null || overlap.matched() > best.overlap().matched())) {
                best = new ResolvedTarget(target, overlap);
            }
        }

        if (best == null) {
            log.debug("No table holds any value of {}.{}", sourceTable.getName(), column.getName());
            return Optional.empty();
        }
        log.debug("Values of {}.{} resolve to {} ({} matches)",
                sourceTable.getName(), column.getName(), best.table().getName(), best.overlap().matched());
        return Optional.of(best);
    }
}
