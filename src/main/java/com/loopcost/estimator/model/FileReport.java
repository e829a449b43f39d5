package com.loopcost.estimator.model;

import com.loopcost.estimator.syntax.SourceLanguage;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one source file: either the module and per-function reports,
 * or the reason the file could not be analyzed.
 */
public final class FileReport {

    private final String origin;
    private final SourceLanguage language;
    private final int lineCount;
    private final ComplexityReport moduleReport;
    private final List<FunctionReport> functionReports;
    private final String error;

    private FileReport(String origin, SourceLanguage language, int lineCount, ComplexityReport moduleReport,
                       List<FunctionReport> functionReports, String error) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.language = Objects.requireNonNull(language, "language");
        this.lineCount = lineCount;
        this.moduleReport = moduleReport;
        this.functionReports = List.copyOf(functionReports);
        this.error = error;
    }

    public static FileReport analyzed(String origin, SourceLanguage language, int lineCount,
                                      ComplexityReport moduleReport, List<FunctionReport> functionReports) {
        Objects.requireNonNull(moduleReport, "moduleReport");
        return new FileReport(origin, language, lineCount, moduleReport, functionReports, null);
    }

    public static FileReport failed(String origin, SourceLanguage language, String error) {
        return new FileReport(origin, language, 0, null, List.of(), Objects.requireNonNull(error, "error"));
    }

    public String getOrigin() {
        return origin;
    }

    public SourceLanguage getLanguage() {
        return language;
    }

    public int getLineCount() {
        return lineCount;
    }

    public Optional<ComplexityReport> getModuleReport() {
        return Optional.ofNullable(moduleReport);
    }

    public List<FunctionReport> getFunctionReports() {
        return functionReports;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
