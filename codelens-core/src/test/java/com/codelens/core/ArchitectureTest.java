package com.codelens.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Analysis phases do not depend on external collaborators</li>
 *   <li>Layered architecture is respected</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codelens.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the analysis phases are pure functions of the source text.
     */
    @Test
    void analysis_shouldNotDependOnCollaborators() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analysis..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..execution..", "..visualization..", "..report..", "..renderer..", "..pipeline..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies model layer has no dependencies on other packages of the project.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..analysis..", "..pipeline..", "..execution..", "..visualization..", "..report..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay low-level.
     */
    @Test
    void utilClasses_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..pipeline..", "..analysis..", "..report..");

        rule.check(classes);
    }

    /**
     * Verifies only the pipeline wires collaborators together.
     */
    @Test
    void collaborators_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..execution..", "..visualization..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

        rule.check(classes);
    }
}
