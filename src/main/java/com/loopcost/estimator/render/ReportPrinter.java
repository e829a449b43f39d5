package com.loopcost.estimator.render;

import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.model.FunctionReport;

import java.io.PrintStream;

/**
 * Human-readable console output for one analyzed file.
 */
public class ReportPrinter {

    private final CostExpressionFormatter formatter = new CostExpressionFormatter();
    private final LoopTreePrinter treePrinter = new LoopTreePrinter();

    public void print(FileReport report, PrintStream out) {
        out.println("== " + report.getOrigin() + " (" + report.getLanguage().name().toLowerCase() + ") ==");
        if (report.isFailed()) {
            out.println("Error: " + report.getError().orElseThrow());
            out.println();
            return;
        }
        ComplexityReport module = report.getModuleReport().orElseThrow();
        out.print(treePrinter.print(module.getLoopTree()));
        out.println("Complexity: " + formatter.format(module.getCost()));

        if (!report.getFunctionReports().isEmpty()) {
            out.println("Functions:");
            for (FunctionReport function : report.getFunctionReports()) {
                out.printf("  %-40s line %-5d %s%n", function.getQualifiedName(), function.getLine(),
                        formatter.format(function.getCost()));
            }
        }
        out.println();
    }
}
