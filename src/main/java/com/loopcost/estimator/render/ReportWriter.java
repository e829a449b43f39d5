package com.loopcost.estimator.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.loopcost.estimator.model.ComplexityReport;
import com.loopcost.estimator.model.FileReport;
import com.loopcost.estimator.model.FunctionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes the results of a batch run to a JSON document.
 */
public class ReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    private final CostExpressionFormatter formatter = new CostExpressionFormatter();
    private final LoopTreeJsonWriter treeWriter = new LoopTreeJsonWriter();

    public String toJson(List<FileReport> reports) {
        return gson.toJson(toJsonTree(reports));
    }

    /**
     * Writes the document to {@code outputPath}, creating parent directories as needed.
     */
    public void write(List<FileReport> reports, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            gson.toJson(toJsonTree(reports), writer);
        }
        logger.info("Report written to: {}", outputPath);
    }

    JsonObject toJsonTree(List<FileReport> reports) {
        JsonArray files = new JsonArray();
        for (FileReport report : reports) {
            files.add(fileToJson(report));
        }
        JsonObject document = new JsonObject();
        document.add("files", files);
        return document;
    }

    private JsonObject fileToJson(FileReport report) {
        JsonObject json = new JsonObject();
        json.addProperty("origin", report.getOrigin());
        json.addProperty("language", report.getLanguage().name());
        if (report.isFailed()) {
            json.addProperty("error", report.getError().orElseThrow());
            return json;
        }
        ComplexityReport module = report.getModuleReport().orElseThrow();
        json.addProperty("lines", report.getLineCount());
        json.addProperty("cost", formatter.format(module.getCost()));
        json.add("loopTree", treeWriter.toJsonTree(module.getLoopTree()));

        JsonArray functions = new JsonArray();
        for (FunctionReport function : report.getFunctionReports()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", function.getQualifiedName());
            entry.addProperty("line", function.getLine());
            entry.addProperty("cost", formatter.format(function.getCost()));
            entry.addProperty("depth", function.getReport().getLoopTree().depth());
            functions.add(entry);
        }
        json.add("functions", functions);
        json.add("error", JsonNull.INSTANCE);
        return json;
    }
}
