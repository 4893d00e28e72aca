package com.codelens.core.execution;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a finished (or timed-out) external process.
 *
 * @param exitCode process exit code; meaningless when {@code timedOut}
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param timedOut whether the process was killed after exceeding its timeout
 * @param elapsed wall-clock duration of the process
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    Duration elapsed
) {
    /**
     * Compact constructor with defaults.
     */
    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr) {
        return new CommandResult(exitCode, stdout, stderr, false, Duration.ZERO);
    }

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(-1, stdout, stderr, true, Duration.ZERO);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
