package com.codelens.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new ValidateCommand());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    void execute_withBalancedSource_exitsZero() throws IOException {
        Path file = write("int x = 5;\nif (x > 1) {\n  x = x - 1;\n}\n");

        int exitCode = cmd.execute(file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Syntax: Correct");
    }

    @Test
    void execute_withUnclosedBrace_reportsMessageAndExitsOne() throws IOException {
        Path file = write("class A {\n  int x = 1;\n");

        int exitCode = cmd.execute(file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("Syntax: Incorrect")
            .contains("Unmatched opening '{' at position 8");
    }

    @Test
    void execute_withMissingFile_exitsOne() {
        int exitCode = cmd.execute(tempDir.resolve("missing.java").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Failed to read source");
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("Main.java");
        Files.writeString(file, content);
        return file;
    }
}
