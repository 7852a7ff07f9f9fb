package com.comparchitect.core;

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
 *   <li>Value types in the model package are immutable records</li>
 *   <li>The model and the composition graph stay independent of validation and output layers</li>
 *   <li>Checks are implemented against the CompositionCheck interface</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.comparchitect.core");
    }

    /**
     * Verifies all value types in the model package are implemented as Java records.
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
     * Verifies the model layer has no dependencies on the layers built on top of it.
     */
    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..composition..", "..graph..", "..validation..", "..export..", "..renderer..", "..report..");

        rule.check(classes);
    }

    /**
     * Verifies the composition and its graph do not know how they are validated or written out.
     */
    @Test
    void compositionAndGraph_shouldNotDependOnValidationOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.composition..", "..core.graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..validation..", "..export..", "..renderer..", "..report..", "..config..");

        rule.check(classes);
    }

    @Test
    void checks_shouldImplementCompositionCheck() {
        ArchRule rule = classes()
            .that().resideInAPackage("..validation.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.comparchitect.core.validation.CompositionCheck");

        rule.check(classes);
    }

    /**
     * Verifies validation does not depend on serialization or rendering.
     */
    @Test
    void validation_shouldNotDependOnOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validation..")
            .should().dependOnClassesThat().resideInAnyPackage("..export..", "..renderer..", "..report..");

        rule.check(classes);
    }
}
