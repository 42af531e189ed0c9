package org.carball.relinfer.model.proposal;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ReportSummary {
    private int totalCandidates;
    private int accepted;
    /** Analysis errors plus schema resolution errors. */
    private int errors;
    private int schemaResolutionErrors;
    private int withoutRelationship;
    private Map<String, Long> byType;
    private Map<String, Long> byConfidenceBucket;
}
