package com.codelens.cli;

import com.codelens.core.analysis.Tokenizer;
import com.codelens.core.model.TokenReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to print token frequencies and invalid tokens of a source.
 */
@Command(
    name = "tokens",
    description = "Print token frequencies and invalid tokens",
    mixinStandardHelpOptions = true
)
public class TokensCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokensCommand.class);

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

        TokenReport report = new Tokenizer().tokenize(text);
        int width = report.frequencies().keySet().stream().mapToInt(String::length).max().orElse(0);
        width = Math.max(width, "TOKEN".length());

        out.printf("%-" + width + "s  %s%n", "TOKEN", "COUNT");
        for (Map.Entry<String, Integer> entry : report.frequencies().entrySet()) {
            out.printf("%-" + width + "s  %d%n", entry.getKey(), entry.getValue());
        }
        out.println();
        out.printf("Total: %d tokens, %d distinct%n", report.totalTokens(), report.distinctTokens());
        out.println("Invalid tokens: "
            + (report.invalidTokens().isEmpty() ? "none" : String.join(" ", report.invalidTokens())));
        return 0;
    }
}
