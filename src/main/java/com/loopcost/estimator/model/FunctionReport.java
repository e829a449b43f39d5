package com.loopcost.estimator.model;

import java.util.Objects;

/**
 * Analysis of a single function or method body.
 */
public final class FunctionReport {

    private final String qualifiedName;
    private final int line;
    private final ComplexityReport report;

    public FunctionReport(String qualifiedName, int line, ComplexityReport report) {
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        this.line = line;
        this.report = Objects.requireNonNull(report, "report");
    }

    /** Enclosing class and function names joined with dots, e.g. {@code Outer.method}. */
    public String getQualifiedName() {
        return qualifiedName;
    }

    public int getLine() {
        return line;
    }

    public ComplexityReport getReport() {
        return report;
    }

    public CostExpression getCost() {
        return report.getCost();
    }

    @Override
    public String toString() {
        return qualifiedName + "@" + line;
    }
}
