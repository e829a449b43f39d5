package com.loopcost.estimator.config;

import com.loopcost.estimator.syntax.SourceLanguage;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for a batch run. Instances are immutable; use {@link #builder()}.
 */
public final class AnalyzerConfiguration {

    private final OutputFormat outputFormat;
    private final boolean perFunction;
    private final boolean collectMetrics;
    private final Set<SourceLanguage> languages;
    private final Path reportPath;
    private final Path metricsPath;

    private AnalyzerConfiguration(Builder builder) {
        this.outputFormat = builder.outputFormat;
        this.perFunction = builder.perFunction;
        this.collectMetrics = builder.collectMetrics;
        this.languages = Set.copyOf(builder.languages);
        this.reportPath = builder.reportPath;
        this.metricsPath = builder.metricsPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalyzerConfiguration defaults() {
        return builder().build();
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    /** Whether each function is also analyzed on its own. */
    public boolean isPerFunction() {
        return perFunction;
    }

    public boolean isCollectMetrics() {
        return collectMetrics;
    }

    public Set<SourceLanguage> getLanguages() {
        return languages;
    }

    public boolean accepts(SourceLanguage language) {
        return languages.contains(language);
    }

    /** Where the JSON report of the whole run is written, if anywhere. */
    public Optional<Path> getReportPath() {
        return Optional.ofNullable(reportPath);
    }

    public Optional<Path> getMetricsPath() {
        return Optional.ofNullable(metricsPath);
    }

    public static final class Builder {
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private boolean perFunction = true;
        private boolean collectMetrics = true;
        private Set<SourceLanguage> languages = EnumSet.allOf(SourceLanguage.class);
        private Path reportPath;
        private Path metricsPath;

        private Builder() {
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
            return this;
        }

        public Builder perFunction(boolean perFunction) {
            this.perFunction = perFunction;
            return this;
        }

        public Builder collectMetrics(boolean collectMetrics) {
            this.collectMetrics = collectMetrics;
            return this;
        }

        public Builder languages(Set<SourceLanguage> languages) {
            if (languages.isEmpty()) {
                throw new IllegalArgumentException("At least one language is required");
            }
            this.languages = EnumSet.copyOf(languages);
            return this;
        }

        public Builder reportPath(Path reportPath) {
            this.reportPath = reportPath;
            return this;
        }

        public Builder metricsPath(Path metricsPath) {
            this.metricsPath = metricsPath;
            return this;
        }

        public AnalyzerConfiguration build() {
            return new AnalyzerConfiguration(this);
        }
    }
}
