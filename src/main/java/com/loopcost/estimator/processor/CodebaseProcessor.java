package com.loopcost.estimator.processor;

import com.loopcost.estimator.analysis.ComplexityAnalyzer;
import com.loopcost.estimator.config.AnalyzerConfiguration;
import com.loopcost.estimator.config.OutputFormat;
import com.loopcost.estimator.evaluation.MetricsCollector;
import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.model.FunctionReport;
import com.loopcost.estimator.render.CostExpressionFormatter;
import com.loopcost.estimator.render.ReportPrinter;
import com.loopcost.estimator.render.ReportWriter;
import com.loopcost.estimator.syntax.ParsedModule;
import com.loopcost.estimator.syntax.SourceLanguage;
import com.loopcost.estimator.syntax.SourceParseException;
import com.loopcost.estimator.syntax.SourceParser;
import com.loopcost.estimator.syntax.java.JavaSourceParser;
import com.loopcost.estimator.syntax.python.PythonSourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Estimates loop costs for a single source file or every supported file under a directory.
 */
public class CodebaseProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseProcessor.class);

    private final AnalyzerConfiguration config;
    private final PrintStream out;
    private final Map<SourceLanguage, SourceParser> parsers = new EnumMap<>(SourceLanguage.class);
    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
    private final MetricsCollector metricsCollector;
    private final ReportPrinter reportPrinter = new ReportPrinter();
    private final ReportWriter reportWriter = new ReportWriter();
    private final CostExpressionFormatter formatter = new CostExpressionFormatter();

    public CodebaseProcessor() {
        this(AnalyzerConfiguration.defaults(), System.out);
    }

    public CodebaseProcessor(AnalyzerConfiguration config, PrintStream out) {
        this.config = config;
        this.out = out;
        this.metricsCollector = config.isCollectMetrics() ? new MetricsCollector() : null;
        register(new PythonSourceParser());
        register(new JavaSourceParser());
    }

    private void register(SourceParser parser) {
        parsers.put(parser.getLanguage(), parser);
    }

    /**
     * Processes every supported source file at the given path.
     *
     * @param codebasePath a source file or the root directory of a source tree
     * @return one report per file, in path order; files that failed to parse are included
     * @throws IOException if the path does not exist or the directory cannot be walked
     */
    public List<FileReport> processCodebase(Path codebasePath) throws IOException {
        if (!Files.exists(codebasePath)) {
            throw new IOException("Path does not exist: " + codebasePath);
        }

        if (metricsCollector != null) {
            metricsCollector.startAnalysis();
        }

        List<Path> sourceFiles = collectSourceFiles(codebasePath);
        logger.info("Found {} source files under {}", sourceFiles.size(), codebasePath);

        List<FileReport> reports = new ArrayList<>();
        for (Path sourceFile : sourceFiles) {
            FileReport report = processFile(sourceFile, originOf(codebasePath, sourceFile));
            reports.add(report);
            if (metricsCollector != null) {
                metricsCollector.recordFile(report);
            }
            if (config.getOutputFormat() == OutputFormat.TEXT) {
                reportPrinter.print(report, out);
            }
        }

        if (config.getOutputFormat() == OutputFormat.JSON) {
            out.println(reportWriter.toJson(reports));
        }

        config.getReportPath().ifPresent(reportPath -> {
            try {
                reportWriter.write(reports, reportPath);
            } catch (IOException e) {
                logger.error("Failed to write report to {}", reportPath, e);
            }
        });

        if (metricsCollector != null) {
            metricsCollector.endAnalysis();
            // JSON output on stdout must stay parseable
            if (config.getOutputFormat() == OutputFormat.TEXT) {
                metricsCollector.printReport(out);
            }
            config.getMetricsPath().ifPresent(metricsPath -> {
                try {
                    metricsCollector.exportJSON(metricsPath);
                } catch (IOException e) {
                    logger.error("Failed to export metrics to JSON", e);
                }
            });
        }

        long failed = reports.stream().filter(FileReport::isFailed).count();
        logger.info("Processed {} files ({} failed)", reports.size(), failed);
        return reports;
    }

    /**
     * Parses and analyzes one file. Parse and read failures are logged and turned into
     * a failed report.
     */
    FileReport processFile(Path sourceFile, String origin) {
        SourceLanguage language = SourceLanguage.fromPath(sourceFile)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported source file: " + sourceFile));
        try {
            String source = Files.readString(sourceFile);
            return analyze(source, origin, language);
        } catch (SourceParseException e) {
            logger.error("Error parsing file: {}", origin, e);
            return FileReport.failed(origin, language, e.getMessage());
        } catch (IOException e) {
            logger.error("Error reading file: {}", origin, e);
            return FileReport.failed(origin, language, "I/O error: " + e.getMessage());
        }
    }

    /**
     * Analyzes source text that did not come from a file.
     */
    public FileReport analyze(String source, String origin, SourceLanguage language) throws SourceParseException {
        ParsedModule module = parsers.get(language).parse(source, origin);
        ComplexityReport moduleReport = analyzer.analyze(module.getBody());
        List<FunctionReport> functionReports = config.isPerFunction()
                ? analyzer.analyzeFunctions(module.getBody())
                : List.of();
        logger.debug("Analyzed {}: {} ({} functions)", origin, formatter.format(moduleReport.getCost()),
                functionReports.size());
        return FileReport.analyzed(origin, language, module.getLineCount(), moduleReport, functionReports);
    }

    private List<Path> collectSourceFiles(Path codebasePath) throws IOException {
        if (Files.isRegularFile(codebasePath)) {
            Optional<SourceLanguage> language = SourceLanguage.fromPath(codebasePath);
            if (language.isEmpty() || !config.accepts(language.get())) {
                logger.warn("Skipping unsupported file: {}", codebasePath);
                return List.of();
            }
            return List.of(codebasePath);
        }
        try (Stream<Path> paths = Files.walk(codebasePath)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> SourceLanguage.fromPath(path).map(config::accepts).orElse(false))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String originOf(Path codebasePath, Path sourceFile) {
        if (sourceFile.equals(codebasePath)) {
            return String.valueOf(sourceFile.getFileName());
        }
        return codebasePath.relativize(sourceFile).toString().replace('\\', '/');
    }

    /**
     * Get the metrics collector for external access; null when metrics are disabled.
     */
    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }
}
