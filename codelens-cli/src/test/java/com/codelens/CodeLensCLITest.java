package com.codelens;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

class CodeLensCLITest {

    @Test
    void commandLine_registersAllSubcommands() {
        CommandLine cmd = CodeLensCLI.commandLine();

        assertThat(cmd.getSubcommands()).containsKeys("analyze", "tokens", "validate", "tree", "list");
    }

    @Test
    void execute_withVersion_printsVersion() {
        CommandLine cmd = CodeLensCLI.commandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("CodeLens");
    }

    @Test
    void execute_withQuietSubcommand_runsSubcommand() {
        CommandLine cmd = CodeLensCLI.commandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("-q", "list", "reports");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Available Report Generators:");
    }
}
