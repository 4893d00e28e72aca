package com.codelens.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}.
 *
 * <p>Takes the command as a list (not a shell string) so paths with spaces need no quoting.
 * Standard output and standard error are redirected to temporary files, so reading them
 * never blocks on pipes a background child process may still hold open.
 *
 * <p>On timeout the process and all of its descendants are killed forcibly; the call
 * returns after at most the timeout plus {@link #KILL_GRACE}.
 */
public class SystemCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(SystemCommandExecutor.class);

    /** Upper bound on waiting for a killed process to be reaped. */
    static final Duration KILL_GRACE = Duration.ofSeconds(1);

    private static final String CAPTURE_PREFIX = "codelens-proc-";

    private final String collaborator;

    /**
     * @param collaborator name reported in {@link CollaboratorUnavailableException}s
     */
    public SystemCommandExecutor(String collaborator) {
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator must not be null");
    }

    @Override
    public CommandResult execute(List<String> command, Path workingDirectory, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        Path stdoutFile = createCaptureFile(".out");
        Path stderrFile = null;
        try {
            stderrFile = createCaptureFile(".err");
            return run(command, workingDirectory, timeout, stdoutFile, stderrFile);
        } finally {
            deleteCaptureFile(stdoutFile);
            if (stderrFile != null) {
                deleteCaptureFile(stderrFile);
            }
        }
    }

    private CommandResult run(List<String> command, Path workingDirectory, Duration timeout,
                              Path stdoutFile, Path stderrFile) {
        log.debug("Executing in {}: {}", workingDirectory, String.join(" ", command));
        long start = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile())
                .start();
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(collaborator,
                "Failed to start '" + command.get(0) + "': " + e.getMessage(), e);
        }

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                log.warn("Command '{}' exceeded timeout of {}", command.get(0), timeout);
                return new CommandResult(-1, read(stdoutFile), read(stderrFile), true, elapsedSince(start));
            }

            int exitCode = process.exitValue();
            log.debug("Command '{}' finished with exit code {}", command.get(0), exitCode);
            return new CommandResult(exitCode, read(stdoutFile), read(stderrFile), false, elapsedSince(start));

        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(collaborator,
                "Interrupted while waiting for '" + command.get(0) + "'", e);
        }
    }

    private static void kill(Process process) throws InterruptedException {
        destroyTree(process);
        if (!process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Process {} did not terminate within {} after kill", process.pid(), KILL_GRACE);
        }
    }

    /**
     * Descendants go first; once the parent is gone they are reparented and can no
     * longer be found through it.
     */
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private Path createCaptureFile(String suffix) {
        try {
            return Files.createTempFile(CAPTURE_PREFIX, suffix);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(collaborator,
                "Failed to create output capture file: " + e.getMessage(), e);
        }
    }

    private String read(Path captureFile) {
        try {
            return new String(Files.readAllBytes(captureFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(collaborator,
                "Failed to read process output: " + e.getMessage(), e);
        }
    }

    private static void deleteCaptureFile(Path captureFile) {
        try {
            Files.deleteIfExists(captureFile);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", captureFile, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
