package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.cache.TableDiscoveryCache;
import org.carball.relinfer.config.DdlOptions;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.ddl.DdlPreview;
import org.carball.relinfer.ddl.DdlPreviewGenerator;
import org.carball.relinfer.exception.ConfigurationException;
import org.carball.relinfer.exception.RelationshipInferenceException;
import org.carball.relinfer.model.candidate.CandidateAnalysis;
import org.carball.relinfer.model.candidate.CandidateRelationship;
import org.carball.relinfer.model.dataset.Column;
import org.carball.relinfer.model.dataset.DatasetProfile;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.model.proposal.ConfidenceBucket;
import org.carball.relinfer.model.proposal.RelationshipProposal;
import org.carball.relinfer.model.proposal.RelationshipProposalReport;
import org.carball.relinfer.model.proposal.RelationshipType;
import org.carball.relinfer.model.proposal.ReportSummary;
import org.carball.relinfer.progress.CancellationToken;
import org.carball.relinfer.progress.ProgressEvent;
import org.carball.relinfer.progress.ProgressSink;
import org.carball.relinfer.progress.ProgressStage;
import org.carball.relinfer.source.DataSource;
import org.carball.relinfer.source.SchemaMetadataSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole pipeline: profiling, schema evidence, candidate generation,
 * parallel candidate analysis, deduplication and DDL previews.
 */
@Slf4j
public class RelationshipInferenceEngine {

    private final DataSource dataSource;
    private final SchemaMetadataSource schemaMetadataSource;
    private final InferenceThresholds thresholds;
    private final TableDiscoveryCache cache;

    private final DatasetProfiler profiler;
    private final SchemaEvidenceCollector schemaEvidenceCollector;
    private final CandidateGenerator candidateGenerator;
    private final CandidateAnalyzer candidateAnalyzer;
    private final ConfidenceScorer confidenceScorer;
    private final ProposalDeduplicator deduplicator;
    private final DdlPreviewGenerator ddlGenerator;

    public RelationshipInferenceEngine(DataSource dataSource, InferenceThresholds thresholds) {
        this(dataSource, SchemaMetadataSource.NONE, thresholds, DdlOptions.defaults(), null);
    }

    /**
     * @param cache optional; when given, profiled tables are reused per data source id
     */
    public RelationshipInferenceEngine(DataSource dataSource,
                                       SchemaMetadataSource schemaMetadataSource,
                                       InferenceThresholds thresholds,
                                       DdlOptions ddlOptions,
                                       TableDiscoveryCache cache) {
        if (dataSource == null) {
            throw new ConfigurationException("A data source is required");
        }
        if (thresholds == null) {
            throw new ConfigurationException("Inference thresholds are required");
        }
        thresholds.validate();

        this.dataSource = dataSource;
        this.schemaMetadataSource = schemaMetadataSource != null ? schemaMetadataSource : SchemaMetadataSource.NONE;
        this.thresholds = thresholds;
        this.cache = cache;

        this.profiler = new DatasetProfiler();
        this.schemaEvidenceCollector = new SchemaEvidenceCollector(thresholds);
        this.candidateGenerator = new CandidateGenerator(
                new NamingPatternMatcher(thresholds.getNamingSimilarityThreshold()), thresholds);
        this.confidenceScorer = new ConfidenceScorer(thresholds);
        this.candidateAnalyzer = new CandidateAnalyzer(dataSource,
                new TargetTableResolver(dataSource),
                new ReferentialIntegrityAnalyzer(dataSource, thresholds),
                new CardinalityClassifier(),
                confidenceScorer);
        this.deduplicator = new ProposalDeduplicator();
        this.ddlGenerator = new DdlPreviewGenerator(ddlOptions != null ? ddlOptions : DdlOptions.defaults());

        log.info("Initialized relationship inference for {} ({})",
                dataSource.sourceId(), thresholds.getConfigurationSummary());
    }

    public RelationshipProposalReport analyze() {
        return analyze(ProgressSink.NO_OP, CancellationToken.none());
    }

    public RelationshipProposalReport analyze(ProgressSink progress, CancellationToken cancellation) {
        ProgressSink sink = progress != null ? progress : ProgressSink.NO_OP;
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        log.info("Starting relationship analysis of {}", dataSource.sourceId());

        // Step 1: Discover and profile tables
        DatasetProfile profile = loadProfile(sink);

        // Step 2: Resolve declared links
        SchemaEvidence schemaEvidence = schemaEvidenceCollector.collect(
                schemaMetadataSource.listDeclaredLinks(), profile.tables());
        sink.report(ProgressEvent.of(ProgressStage.SCHEMA_EVIDENCE,
                "Resolved " + schemaEvidence.links().size() + " declared links"));

        // Step 3: Generate candidates
        List<CandidateRelationship> candidates = candidateGenerator.generate(profile, schemaEvidence);
        sink.report(ProgressEvent.of(ProgressStage.CANDIDATE_GENERATION,
                "Generated " + candidates.size() + " candidates"));

        // Step 4: Analyze candidates in parallel
        List<CandidateAnalysis> analyses = analyzeCandidates(candidates, profile, sink, token);
        boolean cancelled = token.isCancelled() && analyses.size() < candidates.size();

        // Step 5: Build, deduplicate and render proposals
        List<RelationshipProposal> proposals = new ArrayList<>();
        for (CandidateAnalysis analysis : analyses) {
            if (analysis.isHasRelationship()) {
                proposals.add(toProposal(analysis, profile));
            }
        }
        List<RelationshipProposal> relationships = deduplicator.deduplicate(proposals);
        sink.report(ProgressEvent.of(ProgressStage.DEDUPLICATION,
                relationships.size() + " relationships after deduplication"));

        RelationshipProposalReport report = RelationshipProposalReport.builder()
                .analysisId(UUID.randomUUID().toString())
                .createdAt(Instant.now())
                .sourceId(dataSource.sourceId())
                .profileName(thresholds.getProfileName())
                .cancelled(cancelled)
                .summary(summarize(analyses, relationships, schemaEvidence))
                .relationships(relationships)
                .candidates(analyses)
                .build();

        if (cancelled) {
            log.warn("Analysis of {} cancelled after {} of {} candidates",
                    dataSource.sourceId(), analyses.size(), candidates.size());
            sink.report(ProgressEvent.of(ProgressStage.CANCELLED,
                    "Cancelled after " + analyses.size() + " of " + candidates.size() + " candidates"));
        } else {
            sink.report(ProgressEvent.of(ProgressStage.COMPLETE,
                    "Found " + relationships.size() + " relationships"));
        }
        log.info("Analysis complete: {} candidates, {} accepted, {} errors",
                report.getSummary().getTotalCandidates(), report.getSummary().getAccepted(),
                report.getSummary().getErrors());
        return report;
    }

    private DatasetProfile loadProfile(ProgressSink sink) {
        if (cache == null) {
            return profiler.profile(dataSource, sink);
        }
        boolean cached = cache.getIfPresent(dataSource.sourceId()).isPresent();
        DatasetProfile profile = cache.get(dataSource.sourceId(), id -> profiler.profile(dataSource, sink));
        if (cached) {
            sink.report(ProgressEvent.of(ProgressStage.DISCOVERY,
                    "Using cached profile of " + profile.tables().size() + " tables"));
        }
        return profile;
    }

    private List<CandidateAnalysis> analyzeCandidates(List<CandidateRelationship> candidates,
                                                      DatasetProfile profile,
                                                      ProgressSink sink,
                                                      CancellationToken token) {
        List<CandidateAnalysis> results = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(thresholds.getConcurrency(), workerThreadFactory());

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (CandidateRelationship candidate : candidates) {
                futures.add(executor.submit(() -> {
                    if (token.isCancelled()) {
                        return;
                    }
                    CandidateAnalysis analysis = candidateAnalyzer.analyze(candidate, profile);
                    results.add(analysis);
                    int done = completed.incrementAndGet();
                    sink.report(ProgressEvent.forTable(ProgressStage.ANALYSIS, candidate.getSourceTable(),
                            "Analyzed " + candidate.key() + ": " + analysis.getReason(),
                            ProgressEvent.percent(done, candidates.size())));
                }));
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            log.warn("Interrupted while analyzing candidates; returning partial results");
        } catch (ExecutionException e) {
            throw new RelationshipInferenceException("Candidate analysis failed unexpectedly", e.getCause());
        } finally {
            executor.shutdownNow();
        }

        List<CandidateAnalysis> ordered;
        synchronized (results) {
            ordered = new ArrayList<>(results);
        }
        ordered.sort(Comparator.comparing(CandidateAnalysis::getKey));
        return ordered;
    }

    private RelationshipProposal toProposal(CandidateAnalysis analysis, DatasetProfile profile) {
        CandidateRelationship candidate = analysis.getCandidate();
        Table source = profile.findTable(candidate.getSourceTable()).orElseThrow();
        Table target = profile.findTable(candidate.getTargetTable()).orElseThrow();
        Column column = source.findColumn(candidate.getSourceColumn()).orElseThrow();
        double confidence = analysis.getConfidence();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalRows", source.getRowCount());
        metadata.put("nonNullCount", column.getNonNullCount());
        metadata.put("distinctSourceValues", analysis.getOverlap().distinctSourceValues());
        metadata.put("matchedValues", analysis.getOverlap().matched());
        metadata.put("integrityPercent", analysis.getOverlap().integrityPercent());
        metadata.put("maxLinksFrom", analysis.getCardinality().maxLinksFrom());
        if (analysis.getCardinality().measured()) {
            metadata.put("maxLinksTo", analysis.getCardinality().maxLinksTo());
        }
        metadata.put("cardinalityMeasured", analysis.getCardinality().measured());
        if (column.getShape().isArray()) {
            metadata.put("avgElementsPerRecord", Math.round(column.getAvgElementsPerRecord() * 100.0) / 100.0);
        }
        if (candidate.hasSchemaEvidence()) {
            metadata.put("schemaConfidence", candidate.getSchemaLink().confidence());
        }
        if (candidate.getNameMatch() != null) {
            metadata.put("namingSimilarity", candidate.getNameMatch().similarity());
        }

        RelationshipProposal proposal = RelationshipProposal.builder()
                .id(UUID.nameUUIDFromBytes(candidate.key().toString().getBytes(StandardCharsets.UTF_8)).toString())
                .sourceTable(source.getName())
                .sourceField(column.getName())
                .targetTable(target.getName())
                .targetField(target.getKeyColumn())
                .relationshipType(analysis.getRelationshipType())
                .confidence(confidence)
                .confidenceBucket(confidenceScorer.bucketOf(confidence))
                .confidenceFactors(analysis.getConfidenceFactors())
                .origin(candidate.getOrigin())
                .evidence(new ArrayList<>(analysis.getEvidence()))
                .reviewRequired(confidenceScorer.isReviewRequired(confidence))
                .metadata(metadata)
                .build();

        try {
            DdlPreview preview = ddlGenerator.generate(proposal, source, target, column.getShape(), profile.tables());
            proposal.setProposedAction(preview.proposedAction());
            proposal.setSqlPreview(preview.toSql());
        } catch (RuntimeException e) {
            String message = CandidateAnalyzer.describe(e);
            log.warn("No DDL preview for {}: {}", candidate.key(), message);
            proposal.setProposedAction("Review manually, no DDL preview could be generated: " + message);
            proposal.getEvidence().add("AnalysisError: DDL preview failed: " + message);
        }
        return proposal;
    }

    private ReportSummary summarize(List<CandidateAnalysis> analyses,
                                    List<RelationshipProposal> relationships,
                                    SchemaEvidence schemaEvidence) {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (RelationshipType type : RelationshipType.values()) {
            byType.put(type.getDisplayName(), relationships.stream()
                    .filter(p -> p.getRelationshipType() == type).count());
        }

        Map<String, Long> byBucket = new LinkedHashMap<>();
        for (ConfidenceBucket bucket : ConfidenceBucket.values()) {
            byBucket.put(bucket.getDisplayName(), relationships.stream()
                    .filter(p -> p.getConfidenceBucket() == bucket).count());
        }

        int analysisErrors = (int) analyses.stream().filter(CandidateAnalysis::isFailed).count();
        int withoutRelationship = (int) analyses.stream()
                .filter(a -> !a.isHasRelationship() && !a.isFailed())
                .count();

        return ReportSummary.builder()
                .totalCandidates(analyses.size())
                .accepted(relationships.size())
                .errors(analysisErrors + schemaEvidence.resolutionErrorCount())
                .schemaResolutionErrors(schemaEvidence.resolutionErrorCount())
                .withoutRelationship(withoutRelationship)
                .byType(byType)
                .byConfidenceBucket(byBucket)
                .build();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "relinfer-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
