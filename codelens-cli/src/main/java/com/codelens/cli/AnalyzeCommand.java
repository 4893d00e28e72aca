package com.codelens.cli;

import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.config.ConfigLoader;
import com.codelens.core.model.AnalysisResult;
import com.codelens.core.pipeline.AnalysisPipeline;
import com.codelens.core.renderer.GeneratedFile;
import com.codelens.core.renderer.OutputRenderer;
import com.codelens.core.renderer.RenderContext;
import com.codelens.core.renderer.impl.ConsoleRenderer;
import com.codelens.core.report.GeneratedReport;
import com.codelens.core.report.ReportGenerator;
import com.codelens.core.visualization.GeneratorConfig;
import com.codelens.core.visualization.TreeDiagramGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to run the full analysis pipeline over one source.
 *
 * <p>Steps:
 * <ol>
 *   <li>Load {@code codelens.yaml} and apply command line overrides</li>
 *   <li>Run the pipeline (tokens, structure, execution, syntax tree, summary, complexity)</li>
 *   <li>Generate the report in the requested format</li>
 *   <li>Print the report, or write report and diagram source to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codelens analyze Main.java
 * codelens analyze -f markdown --no-execute Main.java
 * codelens analyze -o build/analysis Main.java
 * cat Main.java | codelens analyze -
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a source file and report tokens, structure, syntax tree, summary and complexity",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file, or '-' for standard input")
    private String source;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codelens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-f", "--format"},
        description = "Report format: json, markdown (overrides config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write report and diagram source to this directory instead of the console"
    )
    private Path outputDir;

    @Option(names = {"--no-execute"}, description = "Do not compile and run the source")
    private boolean noExecute;

    @Option(names = {"--no-visualize"}, description = "Do not render the syntax tree")
    private boolean noVisualize;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = SourceInput.read(source, System.in);
        } catch (IOException e) {
            log.error("Failed to read source {}: {}", SourceInput.describe(source), e.getMessage());
            err.println("Failed to read source " + SourceInput.describe(source) + ": " + e.getMessage());
            return 1;
        }

        try {
            CodeLensConfig config = loadConfiguration();
            String reportFormat = format != null ? format : config.report().format();
            ReportGenerator reportGenerator = Plugins.find(ReportGenerator.class, ReportGenerator::getId, reportFormat)
                .orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + reportFormat));

            AnalysisResult result = AnalysisPipeline.fromConfig(config).analyze(text);
            GeneratedReport report = reportGenerator.generate(result);

            if (outputDir != null) {
                writeToDirectory(result, report, config);
            } else {
                new ConsoleRenderer(spec.commandLine().getOut())
                    .render(List.of(GeneratedFile.of(report)), RenderContext.of(Paths.get(".")));
            }
            return 0;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Analysis failed", e);
            err.println("Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private CodeLensConfig loadConfiguration() {
        CodeLensConfig config = ConfigLoader.load(configPath);
        if (noExecute) {
            config = config.withExecutionEnabled(false);
        }
        if (noVisualize) {
            config = config.withVisualizationEnabled(false);
        }
        log.debug("Execution enabled: {}, visualization enabled: {}",
            config.execution().enabled(), config.visualization().enabled());
        return config;
    }

    private void writeToDirectory(AnalysisResult result, GeneratedReport report, CodeLensConfig config) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.of(report));

        String generatorId = config.visualization().generator();
        Plugins.find(TreeDiagramGenerator.class, TreeDiagramGenerator::getId, generatorId)
            .map(generator -> generator.generate(result.syntaxTree(), GeneratorConfig.from(config.visualization())))
            .ifPresentOrElse(
                diagram -> files.add(GeneratedFile.of(diagram, "ast-" + result.sourceId())),
                () -> log.warn("Diagram generator not found: {}", generatorId));

        OutputRenderer renderer = Plugins.find(OutputRenderer.class, OutputRenderer::getId, "filesystem")
            .orElseThrow(() -> new IllegalStateException("FileSystemRenderer not found"));
        renderer.render(files, RenderContext.of(outputDir));
        spec.commandLine().getOut().println("Wrote " + files.size() + " file(s) to " + outputDir.toAbsolutePath());
    }
}
