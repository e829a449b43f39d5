package com.loopcost.estimator.evaluation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.model.FunctionReport;
import com.loopcost.estimator.model.LoopNode;
import com.loopcost.estimator.render.CostExpressionFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects statistics over a batch run: timing, files, functions, loops and the
 * distribution of module-level cost expressions.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;

    // File and code metrics
    private int totalFiles = 0;
    private int failedFiles = 0;
    private int totalFunctions = 0;
    private int totalLinesOfCode = 0;

    // Loop metrics
    private int forLoops = 0;
    private int whileLoops = 0;
    private int maxNestingDepth = 0;
    private int filesWithoutLoops = 0;

    private final Map<String, Integer> complexityDistribution = new TreeMap<>();
    private final Map<String, Integer> languageCounts = new TreeMap<>();

    private final CostExpressionFormatter formatter = new CostExpressionFormatter();

    /**
     * Start timing the analysis.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the analysis.
     */
    public void endAnalysis() {
        if (startTime == null) {
            throw new IllegalStateException("endAnalysis() called before startAnalysis()");
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    /**
     * Record the outcome of processing one file.
     */
    public void recordFile(FileReport report) {
        totalFiles++;
        languageCounts.merge(report.getLanguage().name().toLowerCase(), 1, Integer::sum);
        if (report.isFailed()) {
            failedFiles++;
            return;
        }

        totalLinesOfCode += report.getLineCount();
        ComplexityReport module = report.getModuleReport().orElseThrow();
        LoopNode tree = module.getLoopTree();
        forLoops += tree.count(LoopNode.Kind.FOR);
        whileLoops += tree.count(LoopNode.Kind.WHILE);
        maxNestingDepth = Math.max(maxNestingDepth, tree.depth());
        if (tree.getChildren().isEmpty()) {
            filesWithoutLoops++;
        }
        complexityDistribution.merge(formatter.format(module.getCost()), 1, Integer::sum);

        for (FunctionReport function : report.getFunctionReports()) {
            recordFunction(function);
        }
    }

    private void recordFunction(FunctionReport function) {
        totalFunctions++;
        logger.debug("Recorded function {} with cost {}", function.getQualifiedName(),
                formatter.format(function.getCost()));
    }

    /**
     * Generate a metrics report from what has been recorded so far.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        // Timing
        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFile = totalFiles > 0 ? (double) totalAnalysisTimeMs / totalFiles : 0;

        // Code metrics
        report.totalFiles = totalFiles;
        report.analyzedFiles = totalFiles - failedFiles;
        report.failedFiles = failedFiles;
        report.totalFunctions = totalFunctions;
        report.totalLinesOfCode = totalLinesOfCode;
        report.languageCounts = new TreeMap<>(languageCounts);

        // Loops
        report.forLoops = forLoops;
        report.whileLoops = whileLoops;
        report.maxNestingDepth = maxNestingDepth;
        report.filesWithoutLoops = filesWithoutLoops;

        report.complexityDistribution = new TreeMap<>(complexityDistribution);
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        MetricsReport report = generateReport();
        Gson gson = new GsonBuilder().setPrettyPrinting().create();

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            gson.toJson(report, writer);
        }

        logger.info("Metrics exported to: {}", outputPath);
    }

    /**
     * Print a human-readable report.
     */
    public void printReport(PrintStream out) {
        MetricsReport report = generateReport();

        out.println("\n" + "=".repeat(80));
        out.println("LOOP COST ESTIMATION - METRICS REPORT");
        out.println("=".repeat(80));

        out.println("\n[TIMING METRICS]");
        out.printf("  Total Analysis Time: %.2f seconds%n", report.totalAnalysisTimeMs / 1000.0);
        out.printf("  Average Time per File: %.2f ms%n", report.averageTimePerFile);

        out.println("\n[CODE METRICS]");
        out.printf("  Total Files: %d%n", report.totalFiles);
        out.printf("  Files Analyzed: %d%n", report.analyzedFiles);
        out.printf("  Files Failed: %d%n", report.failedFiles);
        out.printf("  Total Functions: %d%n", report.totalFunctions);
        out.printf("  Total Lines of Code: %d%n", report.totalLinesOfCode);
        report.languageCounts.forEach((language, count) ->
                out.printf("  %-10s files: %,6d%n", language, count));

        out.println("\n[LOOP METRICS]");
        out.printf("  For Loops:   %,6d%n", report.forLoops);
        out.printf("  While Loops: %,6d%n", report.whileLoops);
        out.printf("  Max Nesting Depth: %d%n", report.maxNestingDepth);
        out.printf("  Files Without Loops: %d (%.1f%%)%n", report.filesWithoutLoops,
                calculatePercentage(report.filesWithoutLoops, report.analyzedFiles));

        out.println("\n[COMPLEXITY DISTRIBUTION]");
        report.complexityDistribution.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .forEach(entry -> out.printf("  %-30s: %,6d files%n", entry.getKey(), entry.getValue()));

        out.println("\n" + "=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFile;

        // Code metrics
        public int totalFiles;
        public int analyzedFiles;
        public int failedFiles;
        public int totalFunctions;
        public int totalLinesOfCode;
        public Map<String, Integer> languageCounts;

        // Loops
        public int forLoops;
        public int whileLoops;
        public int maxNestingDepth;
        public int filesWithoutLoops;

        // Complexity
        public Map<String, Integer> complexityDistribution;
    }
}
