package com.codelens.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class AnalyzeCommandTest {

    private static final String SOURCE = """
        public class Main {
            public static void main(String[] args) {
                int x = 5;
                System.out.println(x);
            }
        }
        """;

    @TempDir
    Path tempDir;

    private Path sourceFile;
    private Path configFile;
    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        sourceFile = tempDir.resolve("Main.java");
        Files.writeString(sourceFile, SOURCE);
        configFile = tempDir.resolve("absent.yaml");
        cmd = new CommandLine(new AnalyzeCommand());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    void execute_withDefaults_printsJsonReport() throws IOException {
        int exitCode = cmd.execute("-c", configFile.toString(), "--no-execute", "--no-visualize",
            sourceFile.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("syntax_result").asText()).isEqualTo("Correct");
        assertThat(json.get("execution_status").asText()).isEqualTo("Execution Skipped");
        assertThat(json.get("time_complexity").asText()).isEqualTo("O(1)");
        assertThat(json.get("ast_image").isNull()).isTrue();
        assertThat(json.get("lexical").get("int").asInt()).isEqualTo(1);
    }

    @Test
    void execute_withMarkdownFormat_printsMarkdownReport() {
        int exitCode = cmd.execute("-c", configFile.toString(), "-f", "markdown",
            "--no-execute", "--no-visualize", sourceFile.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("# Code Analysis Report")
            .contains("## Summary");
    }

    @Test
    void execute_withOutputDirectory_writesReportAndDiagram() throws IOException {
        Path outputDir = tempDir.resolve("out");

        int exitCode = cmd.execute("-c", configFile.toString(), "-o", outputDir.toString(),
            "--no-execute", "--no-visualize", sourceFile.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Wrote 2 file(s)");
        try (Stream<Path> files = Files.list(outputDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .hasSize(2)
                .anyMatch(name -> name.startsWith("analysis-") && name.endsWith(".json"))
                .anyMatch(name -> name.startsWith("ast-") && name.endsWith(".dot"));
        }
    }

    @Test
    void execute_withConfigFile_usesConfiguredReportFormat() throws IOException {
        Files.writeString(configFile, """
            report:
              format: markdown
            execution:
              enabled: false
            visualization:
              enabled: false
            """);

        int exitCode = cmd.execute("-c", configFile.toString(), sourceFile.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("# Code Analysis Report");
    }

    @Test
    void execute_withUnknownFormat_exitsOne() {
        int exitCode = cmd.execute("-c", configFile.toString(), "-f", "pdf",
            "--no-execute", "--no-visualize", sourceFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown report format: pdf");
    }

    @Test
    void execute_withMissingSource_exitsOne() {
        int exitCode = cmd.execute("-c", configFile.toString(), tempDir.resolve("nope.java").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Failed to read source");
    }
}
