package org.carball.relinfer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.exception.RelationshipInferenceException;
import org.carball.relinfer.model.candidate.CandidateAnalysis;
import org.carball.relinfer.model.proposal.ConfidenceBucket;
import org.carball.relinfer.model.proposal.RelationshipProposal;
import org.carball.relinfer.model.proposal.RelationshipProposalReport;
import org.carball.relinfer.model.proposal.ReportSummary;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link RelationshipProposalReport} as JSON or Markdown.
 */
@Slf4j
public class RelationshipReport {

    private final RelationshipProposalReport report;
    private final ObjectMapper objectMapper;

    public RelationshipReport(RelationshipProposalReport report) {
        this.report = report;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new RelationshipInferenceException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        ReportSummary summary = report.getSummary();

        // Header
        md.append("# Relationship Proposal Report\n\n");
        md.append("**Source:** ").append(report.getSourceId()).append("  \n");
        md.append("**Analysis ID:** ").append(report.getAnalysisId()).append("  \n");
        md.append("**Generated:** ").append(DateTimeFormatter.ISO_LOCAL_DATE_TIME
                .format(report.getCreatedAt().atOffset(ZoneOffset.UTC))).append(" UTC  \n");
        md.append("**Profile:** ").append(report.getProfileName()).append("  \n\n");

        if (report.isCancelled()) {
            md.append("> **Analysis was cancelled.** The results below cover only the candidates analyzed before cancellation.\n\n");
        }

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Candidates Analyzed | ").append(summary.getTotalCandidates()).append(" |\n");
        md.append("| Relationships Proposed | ").append(summary.getAccepted()).append(" |\n");
        md.append("| Without Relationship | ").append(summary.getWithoutRelationship()).append(" |\n");
        md.append("| Errors | ").append(summary.getErrors()).append(" |\n\n");

        md.append("| Relationship Type | Count |\n");
        md.append("|-------------------|-------|\n");
        summary.getByType().forEach((type, count) ->
                md.append("| ").append(type).append(" | ").append(count).append(" |\n"));
        md.append("\n");

        // Proposals per confidence bucket
        appendBucket(md, ConfidenceBucket.HIGH, "High Confidence (>= 0.8)");
        appendBucket(md, ConfidenceBucket.MEDIUM, "Medium Confidence (0.6 - 0.79)");
        appendBucket(md, ConfidenceBucket.LOW, "Low Confidence (< 0.6)");

        // Rejected candidates
        List<CandidateAnalysis> rejected = report.getCandidates().stream()
                .filter(a -> !a.isHasRelationship() && !a.isFailed())
                .toList();
        if (!rejected.isEmpty()) {
            md.append("## Candidates Without Relationship\n\n");
            md.append("| Column | Target | Reason |\n");
            md.append("|--------|--------|--------|\n");
            for (CandidateAnalysis analysis : rejected) {
                md.append("| `").append(analysis.getCandidate().getSourceTable()).append(".")
                        .append(analysis.getCandidate().getSourceColumn()).append("` | ")
                        .append(analysis.getCandidate().getTargetTable() != null ? analysis.getCandidate().getTargetTable() : "-")
                        .append(" | ").append(analysis.getReason()).append(" |\n");
            }
            md.append("\n");
        }

        // Failed candidates
        List<CandidateAnalysis> failed = report.failedCandidates();
        if (!failed.isEmpty()) {
            md.append("## Analysis Errors\n\n");
            for (CandidateAnalysis analysis : failed) {
                md.append("- `").append(analysis.getKey()).append("`: ").append(analysis.getErrorMessage()).append("\n");
            }
            md.append("\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Proposals marked for review have a confidence below 0.8. Apply SQL previews only after review.*\n");

        return md.toString();
    }

    private void appendBucket(StringBuilder md, ConfidenceBucket bucket, String title) {
        List<RelationshipProposal> proposals = report.proposalsIn(bucket);
        if (proposals.isEmpty()) {
            return;
        }

        md.append("## ").append(title).append("\n\n");
        for (RelationshipProposal proposal : proposals) {
            md.append("### ").append(proposal.getSourceTable()).append(".").append(proposal.getSourceField())
                    .append(" → ").append(proposal.getTargetTable()).append(".").append(proposal.getTargetField())
                    .append("\n\n");
            md.append("- **Type:** ").append(proposal.getRelationshipType()).append("\n");
            md.append("- **Confidence:** ").append(String.format("%.2f", proposal.getConfidence()));
            if (proposal.isReviewRequired()) {
                md.append(" (review required)");
            }
            md.append("\n");
            md.append("- **Evidence origin:** ").append(proposal.getOrigin().getDisplayName()).append("\n");
            md.append("- **Proposed action:** ").append(proposal.getProposedAction()).append("\n\n");

            md.append("**Evidence:**\n");
            proposal.getEvidence().forEach(e -> md.append("- ").append(e).append("\n"));
            md.append("\n");

            if (!proposal.getMetadata().isEmpty()) {
                md.append("| Metric | Value |\n");
                md.append("|--------|-------|\n");
                for (Map.Entry<String, Object> entry : proposal.getMetadata().entrySet()) {
                    md.append("| ").append(entry.getKey()).append(" | ").append(entry.getValue()).append(" |\n");
                }
                md.append("\n");
            }

            if (proposal.getSqlPreview() != null) {
                md.append("```sql\n").append(proposal.getSqlPreview()).append("```\n\n");
            }
        }
    }
}
