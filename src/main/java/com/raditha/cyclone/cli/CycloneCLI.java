package com.raditha.cyclone.cli;

import com.raditha.cyclone.analyzer.CloneDetector;
import com.raditha.cyclone.analyzer.CloneReport;
import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.config.CloneDetectorSettings;
import com.raditha.cyclone.metrics.ReportExporter;
import com.raditha.cyclone.model.SourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the clone detector.
 * <p>
 * Usage:
 * java -jar cyclone.jar [options] &lt;repoA&gt; &lt;repoB&gt;
 * <p>
 * Configuration priority: CLI arguments > config file > preset defaults
 */
@Command(name = "cyclone", mixinStandardHelpOptions = true, version = "Cyclone v1.0.0",
        description = "Finds Type 1, 2 and 3 code clones between two source trees")
@SuppressWarnings("java:S106")
public class CycloneCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CycloneCLI.class);

    static final String REPORT_BASE_NAME = "cyclone-report";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "First source tree (its patterns are looked up)", paramLabel = "<repoA>")
    private Path repoA;

    @Parameters(index = "1", description = "Second source tree (it is indexed)", paramLabel = "<repoB>")
    private Path repoB;

    @Option(names = "--config-file", description = "YAML configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--output", description = "Directory for exported reports (default: current directory)",
            paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--min-nodes", description = "Minimum pattern size in nodes (default: 8)", paramLabel = "<n>")
    private int minNodes = 0; // 0 = use YAML/default

    @Option(names = "--max-depth", description = "Maximum pattern depth (default: 12)", paramLabel = "<n>")
    private int maxDepth = 0; // 0 = use YAML/default

    @Option(names = "--threshold", description = "Type 3 similarity threshold 0-100 (default: 70)",
            paramLabel = "<n>")
    private int threshold = 0; // 0 = use YAML/default

    @Option(names = "--top-k", description = "Type 3 matches kept per pattern (default: 5)", paramLabel = "<n>")
    private int topK = 0; // 0 = use YAML/default

    @Option(names = "--exhaustive", description = "Look for Type 3 matches even after an exact match")
    private boolean exhaustive = false;

    @Option(names = "--strict", description = "Strict preset (85%% threshold, 20 nodes)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (60%% threshold, 6 nodes)")
    private boolean lenient = false;

    @Option(names = "--threads", description = "Worker threads (default: available processors)",
            paramLabel = "<n>")
    private int threads = 0; // 0 = use YAML/default

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export the report (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws IOException, InterruptedException {
        validateConfiguration();

        CloneDetectionConfig config = CloneDetectorSettings.loadConfig(configFile, overrides());
        SourceCollector collector = new SourceCollector(".java", config::shouldExclude);
        SourceRepository a = collector.collect(repositoryId(repoA), repoA);
        SourceRepository b = collector.collect(repositoryId(repoB), repoB);

        CloneReport report = new CloneDetector(config).detect(a, b);

        PrintWriter out = spec.commandLine().getOut();
        ReportExporter exporter = new ReportExporter();
        if (jsonOutput) {
            out.println(exporter.toJson(report));
        } else {
            out.print(report.getDetailedReport());
        }
        out.flush();

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportReport(exporter, report);
        }
        return 0;
    }

    private CloneDetectorSettings.Overrides overrides() {
        String preset = null;
        if (strict) {
            preset = "strict";
        } else if (lenient) {
            preset = "lenient";
        }
        return new CloneDetectorSettings.Overrides(preset, minNodes, maxDepth, threshold, topK, exhaustive, threads);
    }

    /**
     * Directory name as repository id, falling back to the full path.
     */
    static String repositoryId(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        Path name = normalized.getFileName();
        return name != null ? name.toString() : normalized.toString();
    }

    private void exportReport(ReportExporter exporter, CloneReport report) throws IOException {
        Path dir = outputPath != null ? outputPath : Path.of(".");
        Files.createDirectories(dir);
        String format = exportFormat.toLowerCase();
        if (format.equals("csv") || format.equals("both")) {
            Path csv = dir.resolve(REPORT_BASE_NAME + ".csv");
            exporter.exportToCsv(report, csv);
            logger.info("CSV report written to {}", csv);
        }
        if (format.equals("json") || format.equals("both")) {
            Path json = dir.resolve(REPORT_BASE_NAME + ".json");
            exporter.exportToJson(report, json);
            logger.info("JSON report written to {}", json);
        }
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        // Validate threshold range
        if (threshold != 0 && (threshold < 0 || threshold > 100)) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
        }
        if (minNodes < 0) {
            throw new IllegalArgumentException("Min-nodes must be positive, got: " + minNodes);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max-depth must be positive, got: " + maxDepth);
        }
        if (topK < 0) {
            throw new IllegalArgumentException("Top-k must be positive, got: " + topK);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        // Validate export format
        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        // Validate mutually exclusive presets
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }

        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (!Files.isDirectory(repoA)) {
            throw new IllegalArgumentException("Repository not found: " + repoA);
        }
        if (!Files.isDirectory(repoB)) {
            throw new IllegalArgumentException("Repository not found: " + repoB);
        }
        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    /**
     * Command line with the exit code mapping installed.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CycloneCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            // Handle execution exceptions with appropriate exit codes
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
