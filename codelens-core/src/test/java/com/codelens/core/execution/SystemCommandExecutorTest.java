package com.codelens.core.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SystemCommandExecutor}.
 */
class SystemCommandExecutorTest {

    @TempDir
    Path tempDir;

    @Test
    void execute_missingBinary_throwsCollaboratorUnavailable() {
        SystemCommandExecutor executor = new SystemCommandExecutor("visualization");

        assertThatThrownBy(() -> executor.execute(
            List.of("codelens-no-such-binary-" + System.nanoTime()), tempDir, Duration.ofSeconds(1)))
            .isInstanceOf(CollaboratorUnavailableException.class)
            .satisfies(e -> assertThat(((CollaboratorUnavailableException) e).getCollaborator())
                .isEqualTo("visualization"));
    }

    @Test
    void execute_emptyCommand_throwsException() {
        SystemCommandExecutor executor = new SystemCommandExecutor("execution");

        assertThatThrownBy(() -> executor.execute(List.of(), tempDir, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_successfulCommand_capturesStdoutAndExitCode() {
        SystemCommandExecutor executor = new SystemCommandExecutor("execution");

        CommandResult result = executor.execute(List.of("echo", "hello"), tempDir, Duration.ofSeconds(5));

        assertThat(result.exitCode()).isZero();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.stdout()).isEqualTo("hello\n");
        assertThat(result.stderr()).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_failingCommand_capturesStderrAndExitCode() {
        SystemCommandExecutor executor = new SystemCommandExecutor("execution");

        CommandResult result = executor.execute(
            List.of("sh", "-c", "echo broken >&2; exit 3"), tempDir, Duration.ofSeconds(5));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).isEqualTo("broken\n");
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_slowCommand_timesOutPromptly() {
        SystemCommandExecutor executor = new SystemCommandExecutor("execution");
        long start = System.nanoTime();

        CommandResult result = executor.execute(List.of("sleep", "5"), tempDir, Duration.ofMillis(200));

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertThat(result.timedOut()).isTrue();
        assertThat(result.isSuccess()).isFalse();
        assertThat(elapsedMs).isLessThan(2000);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_backgroundChildHoldingOutput_stillTimesOutPromptly() {
        SystemCommandExecutor executor = new SystemCommandExecutor("execution");
        long start = System.nanoTime();

        CommandResult result = executor.execute(
            List.of("sh", "-c", "echo started; sleep 15 & sleep 15"), tempDir, Duration.ofSeconds(1));

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertThat(result.timedOut()).isTrue();
        assertThat(result.stdout()).isEqualTo("started\n");
        assertThat(elapsedMs).isLessThan(5000);
    }

    @Test
    void commandResult_isSuccessOnlyForZeroExitWithoutTimeout() {
        assertThat(CommandResult.completed(0, "out", "").isSuccess()).isTrue();
        assertThat(CommandResult.completed(2, "", "err").isSuccess()).isFalse();
        assertThat(CommandResult.timeout(null, null).isSuccess()).isFalse();
        assertThat(CommandResult.timeout(null, null).stdout()).isEmpty();
    }
}
