package com.loopcost.estimator.config;

import com.loopcost.estimator.syntax.SourceLanguage;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerConfigurationTest {

    @Test
    void defaults() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults();
        assertEquals(OutputFormat.TEXT, config.getOutputFormat());
        assertTrue(config.isPerFunction());
        assertTrue(config.isCollectMetrics());
        assertTrue(config.accepts(SourceLanguage.PYTHON));
        assertTrue(config.accepts(SourceLanguage.JAVA));
        assertTrue(config.getReportPath().isEmpty());
        assertTrue(config.getMetricsPath().isEmpty());
    }

    @Test
    void builderOverrides() {
        AnalyzerConfiguration config = AnalyzerConfiguration.builder()
                .outputFormat(OutputFormat.JSON)
                .perFunction(false)
                .collectMetrics(false)
                .languages(EnumSet.of(SourceLanguage.JAVA))
                .reportPath(Paths.get("out/report.json"))
                .build();
        assertEquals(OutputFormat.JSON, config.getOutputFormat());
        assertFalse(config.isPerFunction());
        assertFalse(config.isCollectMetrics());
        assertFalse(config.accepts(SourceLanguage.PYTHON));
        assertEquals(Paths.get("out/report.json"), config.getReportPath().orElseThrow());
    }

    @Test
    void rejectsEmptyLanguageSet() {
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfiguration.builder().languages(Set.of()));
    }

    @Test
    void outputFormatNames() {
        assertEquals(OutputFormat.JSON, OutputFormat.fromName(" json "));
        assertEquals(OutputFormat.TEXT, OutputFormat.fromName("Text"));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromName("xml"));
    }
}
