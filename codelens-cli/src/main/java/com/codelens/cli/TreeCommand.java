package com.codelens.cli;

import com.codelens.core.analysis.SyntaxTreeBuilder;
import com.codelens.core.model.SyntaxTree;
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
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to print the heuristic syntax tree of a source.
 *
 * <p>{@code text} prints an indented outline; any other format names a registered
 * diagram generator, e.g. {@code dot} or {@code mermaid}.
 */
@Command(
    name = "tree",
    description = "Print the heuristic syntax tree",
    mixinStandardHelpOptions = true
)
public class TreeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TreeCommand.class);

    private static final String TEXT_FORMAT = "text";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file, or '-' for standard input")
    private String source;

    @Option(
        names = {"--format"},
        description = "Output format: text, dot, mermaid (default: ${DEFAULT-VALUE})",
        defaultValue = TEXT_FORMAT
    )
    private String format;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String text;
        try {
            text = SourceInput.read(source, System.in);
        } catch (IOException e) {
            log.error("Failed to read source {}: {}", SourceInput.describe(source), e.getMessage());
            err.println("Failed to read source: " + e.getMessage());
            return 1;
        }

        SyntaxTree tree = new SyntaxTreeBuilder().build(text);
        if (TEXT_FORMAT.equals(format)) {
            out.print(tree.toOutline());
            out.flush();
            return 0;
        }

        Optional<TreeDiagramGenerator> generator =
            Plugins.find(TreeDiagramGenerator.class, TreeDiagramGenerator::getId, format);
        if (generator.isEmpty()) {
            err.println("Unknown tree format: " + format);
            return 1;
        }
        out.print(generator.get().generate(tree, GeneratorConfig.defaults()).content());
        out.flush();
        return 0;
    }
}
