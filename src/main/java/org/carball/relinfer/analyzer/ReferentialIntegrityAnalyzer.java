package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.OverlapResult;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.source.DataSource;

/**
 * Measures how many distinct values of a source column exist among the target's
 * keys. Query failures propagate to the caller, which records them on the candidate.
 */
@Slf4j
public class ReferentialIntegrityAnalyzer {

    private final DataSource dataSource;
    private final InferenceThresholds thresholds;

    public ReferentialIntegrityAnalyzer(DataSource dataSource, InferenceThresholds thresholds) {
        this.dataSource = dataSource;
        this.thresholds = thresholds;
    }

    public OverlapResult measure(Table sourceTable, Column column, Table targetTable) {
        OverlapResult overlap = dataSource.computeOverlap(sourceTable, column, targetTable, targetTable.getKeyColumn());
        log.debug("{}.{} -> {}: {}/{} distinct values match ({}%)",
                sourceTable.getName(), column.getName(), targetTable.getName(),
                overlap.matched(), overlap.distinctSourceValues(), overlap.integrityPercent());
        return overlap;
    }

    /**
     * Guards against conclusions drawn from tiny samples.
     */
    public boolean hasSufficientSample(OverlapResult overlap) {
        return overlap.distinctSourceValues() >= thresholds.getMinDistinctSourceValues()
                && overlap.matched() >= thresholds.getMinMatchedValues();
    }

    public boolean hasSufficientIntegrity(OverlapResult overlap) {
        return overlap.integrityRatio() >= thresholds.getMinIntegrityRatio();
    }
}
