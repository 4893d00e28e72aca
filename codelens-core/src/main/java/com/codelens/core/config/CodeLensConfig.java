package com.codelens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Root configuration for CodeLens.
 *
 * <p>Loaded from {@code codelens.yaml}. Sections or fields left out of the file fall back
 * to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * execution:
 *   enabled: true
 *   entryPoint: Main
 *   timeoutSeconds: 10
 *
 * visualization:
 *   enabled: true
 *   generator: dot
 *   format: png
 *   dpi: 300
 *   size: "10,10"
 *   outputDirectory: ./static
 *
 * report:
 *   format: json
 * }</pre>
 *
 * @param execution execution collaborator settings
 * @param visualization visualization collaborator settings
 * @param report report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeLensConfig(
    @JsonProperty("execution") ExecutionSettings execution,
    @JsonProperty("visualization") VisualizationSettings visualization,
    @JsonProperty("report") ReportSettings report
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public CodeLensConfig {
        execution = execution == null ? ExecutionSettings.defaults() : execution;
        visualization = visualization == null ? VisualizationSettings.defaults() : visualization;
        report = report == null ? ReportSettings.defaults() : report;
    }

    /**
     * Creates the default configuration: execution and visualization enabled, JSON reports.
     *
     * @return default configuration
     */
    public static CodeLensConfig defaults() {
        return new CodeLensConfig(null, null, null);
    }

    /**
     * Returns a copy with execution switched on or off.
     *
     * @param enabled whether to run the execution collaborator
     * @return updated configuration
     */
    public CodeLensConfig withExecutionEnabled(boolean enabled) {
        return new CodeLensConfig(
            new ExecutionSettings(enabled, execution.entryPoint(), execution.javaHome(), execution.timeoutSeconds()),
            visualization,
            report);
    }

    /**
     * Returns a copy with visualization switched on or off.
     *
     * @param enabled whether to run the visualization collaborator
     * @return updated configuration
     */
    public CodeLensConfig withVisualizationEnabled(boolean enabled) {
        return new CodeLensConfig(
            execution,
            new VisualizationSettings(enabled, visualization.generator(), visualization.format(),
                visualization.dpi(), visualization.size(), visualization.outputDirectory(),
                visualization.dotExecutable(), visualization.timeoutSeconds()),
            report);
    }

    /**
     * Execution collaborator settings.
     *
     * @param enabled whether sources with a correct structure are compiled and run
     * @param entryPoint class name the source is saved and run as
     * @param javaHome JDK home whose {@code bin/javac} and {@code bin/java} are used; PATH lookup when null
     * @param timeoutSeconds per-process timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExecutionSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("entryPoint") String entryPoint,
        @JsonProperty("javaHome") String javaHome,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public ExecutionSettings {
            enabled = enabled == null || enabled;
            entryPoint = entryPoint == null || entryPoint.isBlank() ? "Main" : entryPoint;
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds <= 0 ? 10 : timeoutSeconds;
        }

        public static ExecutionSettings defaults() {
            return new ExecutionSettings(null, null, null, null);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Visualization collaborator settings.
     *
     * @param enabled whether the syntax tree is rendered
     * @param generator diagram generator id ({@code dot} renders an image, {@code mermaid} writes Markdown)
     * @param format image format passed to Graphviz
     * @param dpi image resolution
     * @param size Graphviz size attribute in inches, e.g. {@code 10,10}
     * @param outputDirectory directory receiving rendered artifacts
     * @param dotExecutable Graphviz {@code dot} binary
     * @param timeoutSeconds renderer process timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VisualizationSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("generator") String generator,
        @JsonProperty("format") String format,
        @JsonProperty("dpi") Integer dpi,
        @JsonProperty("size") String size,
        @JsonProperty("outputDirectory") String outputDirectory,
        @JsonProperty("dotExecutable") String dotExecutable,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public VisualizationSettings {
            enabled = enabled == null || enabled;
            generator = generator == null || generator.isBlank() ? "dot" : generator;
            format = format == null || format.isBlank() ? "png" : format;
            dpi = dpi == null || dpi <= 0 ? 300 : dpi;
            size = size == null || size.isBlank() ? "10,10" : size;
            outputDirectory = outputDirectory == null || outputDirectory.isBlank() ? "./static" : outputDirectory;
            dotExecutable = dotExecutable == null || dotExecutable.isBlank() ? "dot" : dotExecutable;
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds <= 0 ? 10 : timeoutSeconds;
        }

        public static VisualizationSettings defaults() {
            return new VisualizationSettings(null, null, null, null, null, null, null, null);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Report settings.
     *
     * @param format report generator id ({@code json} or {@code markdown})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportSettings(
        @JsonProperty("format") String format
    ) {
        public ReportSettings {
            format = format == null || format.isBlank() ? "json" : format;
        }

        public static ReportSettings defaults() {
            return new ReportSettings(null);
        }
    }
}
