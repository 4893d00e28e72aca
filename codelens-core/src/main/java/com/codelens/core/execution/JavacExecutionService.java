package com.codelens.core.execution;

import com.codelens.core.model.ExecutionOutcome;
import com.codelens.core.model.ExecutionStatus;
import com.codelens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiles the source with {@code javac} and runs it with {@code java}.
 *
 * <p>Every invocation works in its own temporary directory, deleted afterwards, so
 * concurrent invocations never share {@code Main.java} or {@code Main.class}.
 * Each process is bounded by the configured timeout.
 *
 * <p><b>Outcomes:</b>
 * <ul>
 *   <li>javac exits non-zero - {@code Compilation Error} with compiler stderr</li>
 *   <li>java exits non-zero - {@code Runtime Error} with program stderr</li>
 *   <li>either exceeds the timeout - {@code Execution Timed Out}</li>
 *   <li>otherwise - {@code Execution Success} with program stdout</li>
 * </ul>
 */
public class JavacExecutionService implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(JavacExecutionService.class);

    static final String COLLABORATOR = "execution";

    private static final Pattern CLASS_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final String TEMP_DIR_PREFIX = "codelens-exec-";

    private final CommandExecutor executor;
    private final String javacCommand;
    private final String javaCommand;
    private final Duration timeout;

    /**
     * @param executor process runner
     * @param javaHome JDK home; {@code null} resolves {@code javac}/{@code java} from the PATH
     * @param timeout per-process timeout
     */
    public JavacExecutionService(CommandExecutor executor, String javaHome, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.javacCommand = resolveTool(javaHome, "javac");
        this.javaCommand = resolveTool(javaHome, "java");
    }

    @Override
    public ExecutionOutcome execute(String source, String entryPoint) {
        Objects.requireNonNull(source, "source must not be null");
        requireValidEntryPoint(entryPoint);

        Path workDir = createWorkDirectory();
        try {
            Path sourceFile = workDir.resolve(entryPoint + ".java");
            writeSource(sourceFile, source);

            CommandResult compile = executor.execute(
                List.of(javacCommand, sourceFile.getFileName().toString()), workDir, timeout);
            if (compile.timedOut()) {
                return timedOut("Compilation", compile);
            }
            if (compile.exitCode() != 0) {
                log.debug("Compilation of {} failed with exit code {}", entryPoint, compile.exitCode());
                return ExecutionOutcome.compilationError(compile.stderr());
            }

            CommandResult run = executor.execute(
                List.of(javaCommand, "-cp", workDir.toAbsolutePath().toString(), entryPoint), workDir, timeout);
            if (run.timedOut()) {
                return timedOut("Execution", run);
            }
            if (run.exitCode() != 0) {
                log.debug("Run of {} failed with exit code {}", entryPoint, run.exitCode());
                return ExecutionOutcome.runtimeError(run.stderr());
            }

            log.info("Executed {} successfully", entryPoint);
            return ExecutionOutcome.success(run.stdout());
        } finally {
            FileUtils.deleteRecursively(workDir);
        }
    }

    /**
     * Checks that the entry point is a plain class name, usable as {@code <name>.java}.
     *
     * @param entryPoint configured entry point class
     * @return the entry point
     * @throws IllegalArgumentException if it is null or not a simple Java identifier
     */
    public static String requireValidEntryPoint(String entryPoint) {
        if (entryPoint == null || !CLASS_NAME.matcher(entryPoint).matches()) {
            throw new IllegalArgumentException("Invalid entry point class name: " + entryPoint);
        }
        return entryPoint;
    }

    private ExecutionOutcome timedOut(String phase, CommandResult result) {
        log.warn("{} exceeded timeout of {}s", phase, timeout.toSeconds());
        String message = phase + " exceeded the timeout of " + timeout.toSeconds() + " seconds.";
        if (!result.stderr().isBlank()) {
            message = message + "\n" + result.stderr();
        }
        return new ExecutionOutcome(ExecutionStatus.TIMED_OUT, message);
    }

    private Path createWorkDirectory() {
        try {
            return Files.createTempDirectory(TEMP_DIR_PREFIX);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                "Failed to create working directory: " + e.getMessage(), e);
        }
    }

    private void writeSource(Path sourceFile, String source) {
        try {
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                "Failed to write " + sourceFile.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static String resolveTool(String javaHome, String tool) {
        if (javaHome == null || javaHome.isBlank()) {
            return tool;
        }
        return Paths.get(javaHome, "bin", tool).toString();
    }
}
