package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.candidate.CandidateKey;
import org.carball.relinfer.model.candidate.CandidateRelationship;
import org.carball.relinfer.model.candidate.EvidenceOrigin;
import org.carball.relinfer.model.candidate.NameMatch;
import org.carball.relinfer.model.candidate.SchemaLinkEvidence;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.DatasetProfile;
import org.carball.relinfer.model.dataset.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the candidate list from declared links and naming matches. Columns
 * without any hint become unresolved candidates when their values may still
 * point somewhere: always for array columns, for scalars only on request.
 * Columns without any value are always listed so the trail records them.
 */
@Slf4j
public class CandidateGenerator {

    private final NamingPatternMatcher namingMatcher;
    private final InferenceThresholds thresholds;

    public CandidateGenerator(NamingPatternMatcher namingMatcher, InferenceThresholds thresholds) {
        this.namingMatcher = namingMatcher;
        this.thresholds = thresholds;
    }

    public List<CandidateRelationship> generate(DatasetProfile profile, SchemaEvidence schemaEvidence) {
        Map<CandidateKey, CandidateRelationship> candidates = new TreeMap<>();
        Set<String> hintedColumns = new HashSet<>();

        for (SchemaLinkEvidence link : schemaEvidence.links()) {
            String tableName = link.descriptor().sourceTable();
            String columnName = link.descriptor().sourceField();
            Optional<Column> column = profile.findTable(tableName).flatMap(t -> t.findColumn(columnName));
            if (column.isEmpty()) {
                continue;
            }

            CandidateRelationship candidate = CandidateRelationship.builder()
                    .sourceTable(tableName)
                    .sourceColumn(columnName)
                    .targetTable(link.targetTable())
                    .fieldShape(column.get().getShape())
                    .origin(EvidenceOrigin.SCHEMA)
                    .schemaLink(link)
                    .build();
            candidates.putIfAbsent(candidate.key(), candidate);
            hintedColumns.add(tableName + "." + columnName);
        }

        for (Table table : profile.tables()) {
            for (Column column : table.getColumns()) {
                if (table.isKeyColumn(column.getName())) {
                    continue;
                }
                String columnKey = table.getName() + "." + column.getName();

                Optional<NameMatch> nameMatch = namingMatcher.match(table.getName(), column.getName(), profile.tables());
                if (nameMatch.isPresent()) {
                    CandidateKey key = new CandidateKey(table.getName(), column.getName(), nameMatch.get().targetTable());
                    CandidateRelationship existing = candidates.get(key);
                    if (existing != null) {
                        candidates.put(key, existing.toBuilder()
                                .origin(existing.getOrigin().merge(EvidenceOrigin.NAMING))
                                .nameMatch(nameMatch.get())
                                .build());
                    } else {
                        candidates.put(key, CandidateRelationship.builder()
                                .sourceTable(table.getName())
                                .sourceColumn(column.getName())
                                .targetTable(nameMatch.get().targetTable())
                                .fieldShape(column.getShape())
                                .origin(EvidenceOrigin.NAMING)
                                .nameMatch(nameMatch.get())
                                .build());
                    }
                    hintedColumns.add(columnKey);
                    continue;
                }

                boolean hasResolutionErrors = !schemaEvidence.resolutionErrorsFor(table.getName(), column.getName()).isEmpty();
                // Untyped stores cannot tell an all-null array column from a scalar one.
                boolean emptyAfterProfiling = !column.hasValues()
                        && profile.columnError(table.getName(), column.getName()).isEmpty();
                boolean probe = column.getShape().isArray()
                        || thresholds.isProbeUnhintedScalarColumns()
                        || hasResolutionErrors
                        || emptyAfterProfiling;
                if (!hintedColumns.contains(columnKey) && probe) {
                    CandidateRelationship unresolved = CandidateRelationship.builder()
                            .sourceTable(table.getName())
                            .sourceColumn(column.getName())
                            .fieldShape(column.getShape())
                            .origin(EvidenceOrigin.DATA)
                            .build();
                    candidates.put(unresolved.key(), unresolved);
                }
            }
        }

        List<CandidateRelationship> result = new ArrayList<>();
        for (CandidateRelationship candidate : candidates.values()) {
            List<String> resolutionErrors = schemaEvidence.resolutionErrorsFor(
                    candidate.getSourceTable(), candidate.getSourceColumn());
            result.add(resolutionErrors.isEmpty()
                    ? candidate
                    : candidate.toBuilder().discoveryNotes(resolutionErrors).build());
        }

        log.info("Generated {} candidates ({} unresolved)", result.size(),
                result.stream().filter(c -> !c.isResolved()).count());
        return result;
    }
}
