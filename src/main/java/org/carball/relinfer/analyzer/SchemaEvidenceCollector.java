package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.model.candidate.LinkDescriptor;
import org.carball.relinfer.model.candidate.SchemaLinkEvidence;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves declared links and gives each a schema-only confidence: a base value,
 * boosts for symmetric links and inverse fields, and a cap.
 */
@Slf4j
public class SchemaEvidenceCollector {

    private final InferenceThresholds thresholds;

    public SchemaEvidenceCollector(InferenceThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SchemaEvidence collect(List<LinkDescriptor> descriptors, List<Table> tables) {
        List<SchemaLinkEvidence> links = new ArrayList<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();

        for (LinkDescriptor descriptor : descriptors) {
            String key = descriptor.sourceTable() + "." + descriptor.sourceField();

            Optional<Table> source = findByName(tables, descriptor.sourceTable());
            if (source.isEmpty()) {
                String message = "SchemaResolutionError: declared link " + key + " belongs to unknown table '"
                        + descriptor.sourceTable() + "'";
                log.warn("{}", message);
                errors.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
                continue;
            }
            if (!source.get().hasColumn(descriptor.sourceField())) {
                String message = "SchemaResolutionError: declared link field " + key + " does not exist";
                log.warn("{}", message);
                errors.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
                continue;
            }

            Optional<Table> target = resolveTarget(tables, descriptor.targetTableId());
            if (target.isEmpty()) {
                String message = "SchemaResolutionError: declared link " + key + " references unknown table '"
                        + descriptor.targetTableId() + "'";
                log.warn("{}", message);
                errors.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
                continue;
            }

            links.add(score(canonical(descriptor, source.get()), target.get().getName()));
        }

        log.info("Resolved {} declared links ({} unresolved)", links.size(),
                errors.values().stream().mapToInt(List::size).sum());
        return new SchemaEvidence(List.copyOf(links), errors);
    }

    private SchemaLinkEvidence score(LinkDescriptor descriptor, String targetTable) {
        List<String> notes = new ArrayList<>();
        double confidence = thresholds.getSchemaBaseConfidence();
        notes.add(String.format("Declared link to %s (schema base %.2f)", targetTable, confidence));

        if (descriptor.symmetric()) {
            confidence += thresholds.getSymmetricLinkBoost();
            notes.add(String.format("Symmetric link (+%.2f)", thresholds.getSymmetricLinkBoost()));
        }
        if (descriptor.inverseField()) {
            confidence += thresholds.getInverseFieldBoost();
            notes.add(String.format("Inverse field declared (+%.2f)", thresholds.getInverseFieldBoost()));
        }
        if (confidence > thresholds.getSchemaConfidenceCap()) {
            confidence = thresholds.getSchemaConfidenceCap();
            notes.add(String.format("Schema confidence capped at %.2f", confidence));
        }

        return new SchemaLinkEvidence(descriptor, targetTable, confidence, List.copyOf(notes));
    }

    private static LinkDescriptor canonical(LinkDescriptor descriptor, Table source) {
        String field = source.getColumns().stream()
                .map(Column::getName)
                .filter(name -> name.equalsIgnoreCase(descriptor.sourceField()))
                .findFirst()
                .orElse(descriptor.sourceField());
        return new LinkDescriptor(source.getName(), field, descriptor.targetTableId(),
                descriptor.symmetric(), descriptor.inverseField(), descriptor.required(),
                descriptor.prefersSingleRecordLink(), descriptor.inversePrefersSingleRecordLink());
    }

    private static Optional<Table> resolveTarget(List<Table> tables, String targetTableId) {
        if (targetTableId == null) {
            return Optional.empty();
        }
        Optional<Table> byId = tables.stream()
                .filter(t -> targetTableId.equals(t.getSourceTableId()))
                .findFirst();
        return byId.isPresent() ? byId : findByName(tables, targetTableId);
    }

    private static Optional<Table> findByName(List<Table> tables, String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst();
    }
}
