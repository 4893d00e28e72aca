package com.codelens.cli;

import com.codelens.core.renderer.OutputRenderer;
import com.codelens.core.report.ReportGenerator;
import com.codelens.core.visualization.TreeDiagramGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list available diagram generators, report generators or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codelens list generators
 * codelens list reports
 * codelens list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available diagram generators, report generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "What to list: generators, reports, renderers",
        defaultValue = "generators"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase()) {
            case "generators", "generator" -> listGenerators(out);
            case "reports", "report" -> listReports(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: generators, reports, or renderers", type);
                spec.commandLine().getErr().println("Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listGenerators(PrintWriter out) {
        out.println("Available Diagram Generators:");
        out.println();
        List<TreeDiagramGenerator> generators = Plugins.discover(TreeDiagramGenerator.class);
        for (TreeDiagramGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }
        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listReports(PrintWriter out) {
        out.println("Available Report Generators:");
        out.println();
        List<ReportGenerator> generators = Plugins.discover(ReportGenerator.class);
        for (ReportGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }
        if (generators.isEmpty()) {
            out.println("  No report generators found.");
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();
        List<OutputRenderer> renderers = Plugins.discover(OutputRenderer.class);
        for (OutputRenderer renderer : renderers) {
            out.printf("  • %s%n", renderer.getId());
        }
        if (renderers.isEmpty()) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
