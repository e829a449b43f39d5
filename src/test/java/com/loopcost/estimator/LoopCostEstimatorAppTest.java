package com.loopcost.estimator;

import com.loopcost.estimator.config.OutputFormat;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.syntax.SourceLanguage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoopCostEstimatorAppTest {

    @Test
    void parsesOptions() {
        LoopCostEstimatorApp.Invocation invocation = LoopCostEstimatorApp.parseArguments(new String[] {
                "--format", "json", "--no-functions", "--no-metrics", "--language", "java",
                "--report", "out/r.json", "src"});
        assertEquals(Paths.get("src"), invocation.target);
        assertEquals(OutputFormat.JSON, invocation.config.getOutputFormat());
        assertFalse(invocation.config.isPerFunction());
        assertFalse(invocation.config.isCollectMetrics());
        assertTrue(invocation.config.accepts(SourceLanguage.JAVA));
        assertFalse(invocation.config.accepts(SourceLanguage.PYTHON));
        assertEquals(Paths.get("out/r.json"), invocation.config.getReportPath().orElseThrow());
    }

    @Test
    void usageErrors() {
        assertUsageError("No file or directory specified");
        assertUsageError("Unknown flag: --verbose", "--verbose", "src");
        assertUsageError("--format requires an argument", "src", "--format");
        assertUsageError("Unknown format: xml", "--format", "xml", "src");
        assertUsageError("Unknown language: rust", "--language", "rust", "src");
        assertUsageError("Only one path may be given, got a and b", "a", "b");
    }

    private static void assertUsageError(String message, String... args) {
        LoopCostEstimatorApp.UsageException e = assertThrows(LoopCostEstimatorApp.UsageException.class,
                () -> LoopCostEstimatorApp.parseArguments(args));
        assertEquals(message, e.getMessage());
    }

    @Test
    void runsOnAFile(@TempDir Path tempDir) throws Exception {
        Path source = tempDir.resolve("scan.py");
        Files.writeString(source, "for i in range(1, n):\n    for j in ['a', 'b']:\n        print(i, j)\n"
                + "for i in num:\n    print(1)\n");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        List<FileReport> reports = LoopCostEstimatorApp.run(new String[] {"--no-metrics", source.toString()},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(1, reports.size());
        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Complexity: len(n) + len(num)"));
        assertTrue(text.contains("    For (iterable: len(n))\n        For (iterable: c)\n"));
    }
}
