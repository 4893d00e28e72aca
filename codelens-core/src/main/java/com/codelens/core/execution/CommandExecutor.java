package com.codelens.core.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion, bounded by a timeout.
 *
 * @see SystemCommandExecutor
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * Executes a command and waits for it to finish.
     *
     * <p>A process exceeding the timeout is killed and reported with
     * {@link CommandResult#timedOut()} set; that is not an exception.
     *
     * @param command command and arguments (e.g. {@code ["javac", "Main.java"]})
     * @param workingDirectory working directory of the process
     * @param timeout maximum run time
     * @return captured result
     * @throws CollaboratorUnavailableException if the process cannot be started or waited for
     */
    CommandResult execute(List<String> command, Path workingDirectory, Duration timeout);
}
