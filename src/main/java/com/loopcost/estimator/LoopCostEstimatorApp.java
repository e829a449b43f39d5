package com.loopcost.estimator;

import com.loopcost.estimator.config.AnalyzerConfiguration;
import com.loopcost.estimator.config.OutputFormat;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.processor.CodebaseProcessor;
import com.loopcost.estimator.syntax.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Main application entry point for the loop cost estimator.
 * Estimates the time complexity of Python and Java sources from their loop nesting.
 */
public class LoopCostEstimatorApp {

    private static final Logger logger = LoggerFactory.getLogger(LoopCostEstimatorApp.class);

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar loop-cost-estimator.jar [options] <file-or-directory>",
            "Options:",
            "  --format text|json       output format (default: text)",
            "  --no-functions           skip per-function analysis",
            "  --no-metrics             do not collect run metrics",
            "  --language python|java   only analyze the given language (repeatable)",
            "  --report <file>          also write the JSON report to <file>",
            "  --metrics <file>         export run metrics as JSON to <file>");

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            logger.error("Error processing codebase", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static List<FileReport> run(String[] args, PrintStream out) throws IOException {
        Invocation invocation = parseArguments(args);
        logger.info("Starting loop cost estimation");
        logger.info("Target: {}", invocation.target);

        CodebaseProcessor processor = new CodebaseProcessor(invocation.config, out);
        List<FileReport> reports = processor.processCodebase(invocation.target);

        logger.info("Processing complete!");
        logger.info("Total files processed: {}", reports.size());
        return reports;
    }

    static Invocation parseArguments(String[] args) {
        AnalyzerConfiguration.Builder builder = AnalyzerConfiguration.builder();
        Set<SourceLanguage> languages = EnumSet.noneOf(SourceLanguage.class);
        String target = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--format" -> builder.outputFormat(parseFormat(requireNext(args, i++, "--format")));
                case "--no-functions" -> builder.perFunction(false);
                case "--no-metrics" -> builder.collectMetrics(false);
                case "--language" -> languages.add(parseLanguage(requireNext(args, i++, "--language")));
                case "--report" -> builder.reportPath(Paths.get(requireNext(args, i++, "--report")));
                case "--metrics" -> builder.metricsPath(Paths.get(requireNext(args, i++, "--metrics")));
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (target != null) {
                        throw new UsageException("Only one path may be given, got " + target + " and " + args[i]);
                    }
                    target = args[i];
                }
            }
        }

        if (target == null) {
            throw new UsageException("No file or directory specified");
        }
        if (!languages.isEmpty()) {
            builder.languages(languages);
        }
        return new Invocation(Paths.get(target), builder.build());
    }

    private static OutputFormat parseFormat(String value) {
        try {
            return OutputFormat.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException("Unknown format: " + value);
        }
    }

    private static SourceLanguage parseLanguage(String value) {
        try {
            return SourceLanguage.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException("Unknown language: " + value);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    /** A parsed command line: what to analyze and how. */
    static final class Invocation {
        final Path target;
        final AnalyzerConfiguration config;

        Invocation(Path target, AnalyzerConfiguration config) {
            this.target = target;
            this.config = config;
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
