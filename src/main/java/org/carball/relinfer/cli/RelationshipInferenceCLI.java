package org.carball.relinfer.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.analyzer.RelationshipInferenceEngine;
import org.carball.relinfer.config.ConfigurationLoader;
import org.carball.relinfer.config.DdlOptions;
import org.carball.relinfer.config.InferenceConfig;
import org.carball.relinfer.config.InferenceProfile;
import org.carball.relinfer.config.InferenceThresholds;
import org.carball.relinfer.config.OutputFormat;
import org.carball.relinfer.exception.ConfigurationException;
import org.carball.relinfer.exception.RelationshipInferenceException;
import org.carball.relinfer.model.candidate.LinkDescriptor;
import org.carball.relinfer.model.proposal.ConfidenceBucket;
import org.carball.relinfer.model.proposal.RelationshipProposalReport;
import org.carball.relinfer.model.proposal.ReportSummary;
import org.carball.relinfer.output.RelationshipReport;
import org.carball.relinfer.progress.AsyncProgressSink;
import org.carball.relinfer.progress.CancellationToken;
import org.carball.relinfer.progress.LoggingProgressSink;
import org.carball.relinfer.source.DatasetSnapshotLoader;
import org.carball.relinfer.source.DdlSchemaMetadataSource;
import org.carball.relinfer.source.InMemoryDataSource;
import org.carball.relinfer.source.JsonLinkDescriptorSource;
import org.carball.relinfer.source.SchemaMetadataSource;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class RelationshipInferenceCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Relationship Inference Engine v%s                ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private final ConfigurationLoader configurationLoader;
    private final PrintStream out;
    private final PrintStream err;

    public RelationshipInferenceCLI() {
        this(new ConfigurationLoader(), System.out, System.err);
    }

    public RelationshipInferenceCLI(ConfigurationLoader configurationLoader, PrintStream out, PrintStream err) {
        this.configurationLoader = configurationLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new RelationshipInferenceCLI().run(args));
    }

    /**
     * Runs one analysis and returns the process exit code.
     */
    public int run(String[] args) {
        out.printf(BANNER + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            InferenceConfig config = parseArgs(args);
            InferenceThresholds thresholds = configurationLoader.loadConfiguration(
                    config.getProfileName(), config.getThresholdsFile(), args);

            out.println("\n🔍 Starting relationship inference...");
            out.println("   Snapshot: " + config.getSnapshotFile());
            if (config.getLinksFile() != null) {
                out.println("   Declared links: " + config.getLinksFile());
            }
            if (config.getDdlFile() != null) {
                out.println("   Existing DDL: " + config.getDdlFile());
            }
            out.println("   Thresholds: " + thresholds.getConfigurationSummary());
            out.println();

            out.print("📦 Loading snapshot... ");
            InMemoryDataSource dataSource = new InMemoryDataSource(
                    new DatasetSnapshotLoader().load(config.getSnapshotFile()));
            SchemaMetadataSource schemaMetadata = schemaMetadataFor(config);
            out.println("✓");

            out.print("🔗 Inferring relationships... ");
            RelationshipProposalReport report;
            try (AsyncProgressSink progress = new AsyncProgressSink(new LoggingProgressSink())) {
                RelationshipInferenceEngine engine = new RelationshipInferenceEngine(
                        dataSource, schemaMetadata, thresholds, DdlOptions.defaults(), null);
                report = engine.analyze(progress, new CancellationToken());
            }
            out.println("✓");

            out.print("📝 Writing results... ");
            List<Path> written = outputResults(report, config);
            out.println("✓");

            printSummary(report, config.isVerbose());

            out.println("\n✅ Inference complete!");
            out.println("   Output files:");
            written.forEach(path -> out.println("     - " + path));
            return 0;

        } catch (ConfigurationException | IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (RelationshipInferenceException e) {
            err.println("\n❌ Inference failed: " + e.getMessage());
            log.debug("Inference error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar relinfer.jar <snapshot-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  snapshot-file       JSON dataset snapshot (tables with their rows)");
        out.println();
        out.println("Options:");
        out.println("  --links             JSON file with declared link descriptors");
        out.println("  --ddl               Existing DDL whose FOREIGN KEY clauses are used as declared links");
        out.println("  --output, -o        Output file base name (default: relationship-report)");
        out.println("  --format, -f        Output format: json|markdown|both (default: both)");
        out.println("  --profile, -p       Threshold profile: " + InferenceProfile.getAvailableProfiles());
        out.println("  --thresholds        YAML file with custom thresholds (optional)");
        out.println("  --concurrency       Number of candidates analyzed in parallel");
        out.println("  --verbose, -v       List every proposal in the summary");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(InferenceProfile.getProfileHelp());
        out.println(ConfigurationLoader.getThresholdHelp());
        out.println("Examples:");
        out.println("  java -jar relinfer.jar snapshot.json");
        out.println("  java -jar relinfer.jar snapshot.json --links links.json --profile strict");
        out.println("  java -jar relinfer.jar snapshot.json --ddl schema.sql --format markdown -o out/report");
    }

    InferenceConfig parseArgs(String[] args) {
        InferenceConfig config = new InferenceConfig();
        config.setSnapshotFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--links":
                    config.setLinksFile(Paths.get(requireValue(args, i++, "Links file not specified")));
                    break;

                case "--ddl":
                    config.setDdlFile(Paths.get(requireValue(args, i++, "DDL file not specified")));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                case "-p":
                    config.setProfileName(requireValue(args, i++, "Profile name not specified"));
                    break;

                case "--thresholds":
                    config.setThresholdsFile(Paths.get(requireValue(args, i++, "Thresholds file not specified")));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    // threshold overrides are read by ConfigurationLoader
                    if (args[i].equals("--concurrency") || args[i].startsWith("--thresholds.")) {
                        String option = args[i];
                        requireValue(args, i++, "Value not specified for " + option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        config.setOutputFile(removeFileExtension(config.getOutputFile()));
        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int optionIndex, String message) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[optionIndex + 1];
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(InferenceConfig config) {
        if (!Files.isRegularFile(config.getSnapshotFile())) {
            throw new IllegalArgumentException("Snapshot file not found: " + config.getSnapshotFile());
        }
        if (config.getLinksFile() != null && !Files.isRegularFile(config.getLinksFile())) {
            throw new IllegalArgumentException("Links file not found: " + config.getLinksFile());
        }
        if (config.getDdlFile() != null && !Files.isRegularFile(config.getDdlFile())) {
            throw new IllegalArgumentException("DDL file not found: " + config.getDdlFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static SchemaMetadataSource schemaMetadataFor(InferenceConfig config) {
        List<SchemaMetadataSource> sources = new ArrayList<>();
        if (config.getLinksFile() != null) {
            sources.add(new JsonLinkDescriptorSource(config.getLinksFile()));
        }
        if (config.getDdlFile() != null) {
            sources.add(DdlSchemaMetadataSource.fromFile(config.getDdlFile()));
        }
        if (sources.isEmpty()) {
            return SchemaMetadataSource.NONE;
        }
        return () -> {
            List<LinkDescriptor> links = new ArrayList<>();
            sources.forEach(source -> links.addAll(source.listDeclaredLinks()));
            return links;
        };
    }

    private static List<Path> outputResults(RelationshipProposalReport report, InferenceConfig config) throws IOException {
        RelationshipReport output = new RelationshipReport(report);
        String baseFileName = config.getOutputFile();
        List<Path> written = new ArrayList<>();

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Path jsonFile = Paths.get(baseFileName + ".json");
            Files.writeString(jsonFile, output.toJson());
            written.add(jsonFile);
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Path markdownFile = Paths.get(baseFileName + ".md");
            Files.writeString(markdownFile, output.toMarkdown());
            written.add(markdownFile);
        }
        return written;
    }

    private void printSummary(RelationshipProposalReport report, boolean verbose) {
        ReportSummary summary = report.getSummary();

        out.println("\n" + "=".repeat(60));
        out.println("📊 INFERENCE SUMMARY");
        out.println("=".repeat(60));

        out.println("\nCandidates analyzed: " + summary.getTotalCandidates());
        out.println("Relationships proposed: " + summary.getAccepted());
        out.println("Without relationship: " + summary.getWithoutRelationship());
        out.println("Errors: " + summary.getErrors());
        if (report.isCancelled()) {
            out.println("⚠️  Run was cancelled, the report is partial");
        }

        out.println("\nConfidence breakdown:");
        out.println("  🟢 High: " + report.proposalsIn(ConfidenceBucket.HIGH).size());
        out.println("  🟡 Medium: " + report.proposalsIn(ConfidenceBucket.MEDIUM).size());
        out.println("  🔴 Low: " + report.proposalsIn(ConfidenceBucket.LOW).size());

        if (report.getRelationships().isEmpty()) {
            out.println("\n💡 No relationships found.");
            return;
        }

        out.println("\n🎯 Top Proposals:");
        out.println("-".repeat(60));
        report.getRelationships().stream()
                .limit(verbose ? Long.MAX_VALUE : 3)
                .forEach(proposal -> {
                    out.printf("%-30s → %-20s%n",
                            proposal.getSourceTable() + "." + proposal.getSourceField(),
                            proposal.getTargetTable());
                    out.printf("  └─ %s, confidence %.2f%s%n",
                            proposal.getRelationshipType().getDisplayName(),
                            proposal.getConfidence(),
                            proposal.isReviewRequired() ? " (review required)" : "");
                });
    }
}
