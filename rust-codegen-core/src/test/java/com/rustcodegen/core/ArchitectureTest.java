package com.rustcodegen.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the core module.
 *
 * <p>The rendering layers ({@code format}, {@code model}) know nothing about files,
 * definitions or configuration, and do not log.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.rustcodegen.core");
    }

    @Test
    void format_shouldOnlyDependOnJdk() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.format..")
            .should().onlyDependOnClassesThat().resideInAnyPackage("..core.format..", "java..");

        rule.check(classes);
    }

    @Test
    void model_shouldNotDependOnOuterLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.file..", "..core.renderer..", "..core.definition..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void renderingLayers_shouldNotLog() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.format..", "..core.model..")
            .should().dependOnClassesThat().resideInAPackage("org.slf4j..");

        rule.check(classes);
    }

    @Test
    void renderer_shouldNotDependOnDefinitions() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.definition..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void definitionRecords_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.definition..")
            .and().haveSimpleNameEndingWith("Definition")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void persistenceAndDefinitionExceptions_shouldBeChecked() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..core.file..", "..core.definition..")
            .and().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(Exception.class)
            .andShould().notBeAssignableTo(RuntimeException.class);

        rule.check(classes);
    }
}
