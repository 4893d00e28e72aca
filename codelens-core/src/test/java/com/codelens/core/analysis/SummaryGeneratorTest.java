package com.codelens.core.analysis;

import com.codelens.core.model.AnalysisSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SummaryGenerator}.
 */
class SummaryGeneratorTest {

    private static final String PROGRAM = """
        public class Greeter {
            public static void main(String[] args) {
                int count = 3;
                String name = "world";
                for (int i = 0; i < count; i++) {
                    if (i > 0) {
                        System.out.println("Hello " + name);
                    }
                }
            }

            public int twice(int value) {
                return value * 2;
            }
        }
        """;

    private SummaryGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SummaryGenerator();
    }

    @Test
    void summarize_completeProgram_describesEveryFeatureInOrder() {
        AnalysisSummary summary = generator.summarize(PROGRAM);

        assertThat(summary.sentences()).containsExactly(
            "This code defines a class named 'Greeter'.",
            "This program contains a main method, which is the entry point of the program.",
            "The program defines the following methods: main, twice.",
            "The program declares the following variables: count, name.",
            "The program uses loops to iterate over data.",
            "The program uses conditional statements (e.g., 'if' statements) for decision-making.",
            "The program contains print statements to display the output.");
    }

    @Test
    void summarize_completeProgram_suggestsInOrder() {
        AnalysisSummary summary = generator.summarize(PROGRAM);

        assertThat(summary.suggestions()).containsExactly(
            SummaryGenerator.NESTING_SUGGESTION,
            SummaryGenerator.ENHANCED_FOR_SUGGESTION,
            SummaryGenerator.CONCATENATION_SUGGESTION,
            SummaryGenerator.EXCEPTION_HANDLING_SUGGESTION,
            SummaryGenerator.SPLIT_METHODS_SUGGESTION);
    }

    @Test
    void summarize_declarationAndPrint_includesExceptionAndFinalHints() {
        AnalysisSummary summary = generator.summarize("int x = 5; System.out.println(x);");

        assertThat(summary.sentences()).containsExactly(
            "The program declares the following variables: x.",
            "The program contains print statements to display the output.");
        assertThat(summary.suggestions()).containsExactly(
            SummaryGenerator.EXCEPTION_HANDLING_SUGGESTION,
            SummaryGenerator.SPLIT_METHODS_SUGGESTION);
    }

    @Test
    void summarize_loopWithBraceOnSameLine_triggersNestingSuggestion() {
        AnalysisSummary summary = generator.summarize("if (x > 0) { for (int i=0;i<n;i++) { } }");

        assertThat(summary.suggestions()).startsWith(
            SummaryGenerator.NESTING_SUGGESTION,
            SummaryGenerator.ENHANCED_FOR_SUGGESTION);
    }

    @Test
    void summarize_tryCatchPresent_omitsExceptionHint() {
        AnalysisSummary summary = generator.summarize("try { run(); } catch (Exception e) { }");

        assertThat(summary.suggestions()).containsExactly(SummaryGenerator.SPLIT_METHODS_SUGGESTION);
    }

    @Test
    void summarize_emptyInput_returnsOnlyMandatoryHints() {
        AnalysisSummary summary = generator.summarize("");

        assertThat(summary.sentences()).isEmpty();
        assertThat(summary.suggestions()).containsExactly(
            SummaryGenerator.EXCEPTION_HANDLING_SUGGESTION,
            SummaryGenerator.SPLIT_METHODS_SUGGESTION);
    }

    @Test
    void extractClassName_stopsAtNextClassKeyword() {
        assertThat(SummaryGenerator.extractClassName("class A class B {")).isEqualTo("A");
        assertThat(SummaryGenerator.extractClassName("public class Main{}")).isEqualTo("Main");
    }

    @Test
    void extractMethodNames_skipsClassLinesAndLinesWithoutParentheses() {
        List<String> methods = SummaryGenerator.extractMethodNames(List.of(
            "public class Main {",
            "  public void run() {",
            "  public int size;",
            "  private void hidden() {"));

        assertThat(methods).containsExactly("run");
    }

    @Test
    void extractVariableNames_requiresSpaceAfterTypeKeyword() {
        List<String> variables = SummaryGenerator.extractVariableNames(List.of(
            "int a = 1;",
            "integer b = 2;",
            "  float c;",
            "int"));

        assertThat(variables).containsExactly("a", "c");
    }
}
