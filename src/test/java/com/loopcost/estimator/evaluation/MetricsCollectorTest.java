package com.loopcost.estimator.evaluation;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.CostExpression;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.model.FunctionReport;
import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.model.LoopNode;
import com.loopcost.estimator.syntax.SourceLanguage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private static FileReport nestedLoops() {
        LoopNode inner = LoopNode.whileLoop(List.of(), 3);
        LoopNode outer = LoopNode.forLoop(IterationFactor.lengthOf("xs"), List.of(inner), 2);
        CostExpression cost = CostExpression.product(CostExpression.lengthOf("xs"), CostExpression.unknown());
        ComplexityReport report = new ComplexityReport(LoopNode.root(List.of(outer)), cost);
        return FileReport.analyzed("a.py", SourceLanguage.PYTHON, 10, report,
                List.of(new FunctionReport("f", 1, report), new FunctionReport("g", 5, report)));
    }

    private static FileReport noLoops(String origin) {
        ComplexityReport report = new ComplexityReport(LoopNode.root(List.of()), CostExpression.identity());
        return FileReport.analyzed(origin, SourceLanguage.JAVA, 4, report, List.of());
    }

    private static MetricsCollector collect() {
        MetricsCollector collector = new MetricsCollector();
        collector.startAnalysis();
        collector.recordFile(nestedLoops());
        collector.recordFile(noLoops("A.java"));
        collector.recordFile(noLoops("B.java"));
        collector.recordFile(FileReport.failed("bad.py", SourceLanguage.PYTHON, "bad.py:1:1: oops"));
        collector.endAnalysis();
        return collector;
    }

    @Test
    void aggregatesRecordedFiles() {
        MetricsCollector.MetricsReport report = collect().generateReport();
        assertEquals(4, report.totalFiles);
        assertEquals(3, report.analyzedFiles);
        assertEquals(1, report.failedFiles);
        assertEquals(2, report.totalFunctions);
        assertEquals(18, report.totalLinesOfCode);
        assertEquals(1, report.forLoops);
        assertEquals(1, report.whileLoops);
        assertEquals(2, report.maxNestingDepth);
        assertEquals(2, report.filesWithoutLoops);
        assertEquals(2, report.languageCounts.get("python"));
        assertEquals(2, report.languageCounts.get("java"));
        assertEquals(2, report.complexityDistribution.get("1"));
        assertEquals(1, report.complexityDistribution.get("len(xs)*(?)"));
        assertTrue(report.totalAnalysisTimeMs >= 0);
    }

    @Test
    void endWithoutStartFails() {
        assertThrows(IllegalStateException.class, () -> new MetricsCollector().endAnalysis());
    }

    @Test
    void printsReport() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        collect().printReport(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("LOOP COST ESTIMATION - METRICS REPORT"));
        assertTrue(text.contains("Files Failed: 1"));
        assertTrue(text.contains("len(xs)*(?)"));
    }

    @Test
    void exportsJson(@TempDir Path tempDir) throws Exception {
        Path output = tempDir.resolve("metrics/run.json");
        collect().exportJSON(output);

        JsonObject json = JsonParser.parseString(Files.readString(output)).getAsJsonObject();
        assertEquals(4, json.get("totalFiles").getAsInt());
        assertEquals(2, json.get("maxNestingDepth").getAsInt());
        assertEquals(2, json.getAsJsonObject("complexityDistribution").get("1").getAsInt());
    }
}
