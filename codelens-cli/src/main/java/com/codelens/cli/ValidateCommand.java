package com.codelens.cli;

import com.codelens.core.analysis.StructureValidator;
import com.codelens.core.model.StructureReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command to check bracket balance and statement terminators of a source.
 *
 * <p>Exits with 0 for a {@code Correct} verdict and 1 otherwise.
 */
@Command(
    name = "validate",
    description = "Check bracket balance and statement terminators",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file, or '-' for standard input")
    private String source;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        String text;
        try {
            text = SourceInput.read(source, System.in);
        } catch (IOException e) {
            log.error("Failed to read source {}: {}", SourceInput.describe(source), e.getMessage());
            spec.commandLine().getErr().println("Failed to read source: " + e.getMessage());
            return 1;
        }

        StructureReport report = new StructureValidator().validate(text);
        log.info("Validated {}: {}", SourceInput.describe(source), report.verdict().label());

        out.println("Syntax: " + report.verdict().label());
        for (String message : report.messages()) {
            out.println("  " + message);
        }
        return report.isCorrect() ? 0 : 1;
    }
}
