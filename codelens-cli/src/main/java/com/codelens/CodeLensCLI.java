package com.codelens;

import com.codelens.cli.AnalyzeCommand;
import com.codelens.cli.ListCommand;
import com.codelens.cli.TokensCommand;
import com.codelens.cli.TreeCommand;
import com.codelens.cli.ValidateCommand;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for CodeLens.
 *
 * <p>CodeLens analyzes a single C-family or Java source text: token frequencies, bracket
 * and terminator structure, a heuristic syntax tree, descriptive summary, improvement
 * suggestions and a loop-based complexity estimate. Sources with a correct structure are
 * compiled and run, and the syntax tree is rendered as an image.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Run the full analysis and print or write a report</li>
 *   <li>{@code tokens} - Print token frequencies and invalid tokens</li>
 *   <li>{@code validate} - Check bracket balance and statement terminators</li>
 *   <li>{@code tree} - Print the heuristic syntax tree</li>
 *   <li>{@code list} - List available diagram generators, report generators or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * codelens analyze Main.java
 * codelens -v analyze --no-execute -f markdown Main.java
 * cat Main.java | codelens validate -
 * codelens tree --format dot Main.java
 * }</pre>
 */
@Command(
    name = "codelens",
    mixinStandardHelpOptions = true,
    version = "CodeLens 1.0.0-SNAPSHOT",
    description = "Heuristic source code analyzer",
    subcommands = {
        AnalyzeCommand.class,
        TokensCommand.class,
        ValidateCommand.class,
        TreeCommand.class,
        ListCommand.class
    }
)
public class CodeLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeLensCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodeLens - Heuristic Source Code Analyzer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codelens --help' to see available commands");
        System.out.println("Use 'codelens <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options before the selected subcommand runs.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        CodeLensCLI cli = new CodeLensCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
