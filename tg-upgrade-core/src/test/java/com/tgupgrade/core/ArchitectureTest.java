package com.tgupgrade.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the layering of the upgrade engine.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The HCL 1 reader and HCL 2 writer do not depend on the upgrade engine</li>
 *   <li>Renderer implementations are only reached through the SPI</li>
 *   <li>The core module stays free of CLI concerns</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.tgupgrade.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void syntaxPackages_shouldNotDependOnUpgradeEngine() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.ast..", "..core.hcl2..", "..core.writer..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.upgrade..", "..core.batch..", "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void rendererImplementations_shouldNotBeUsedDirectly() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..renderer.impl..")
            .should().dependOnClassesThat().resideInAPackage("..renderer.impl..");

        rule.check(classes);
    }

    /**
     * Verifies the core module does not know about the command line front end.
     */
    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .should().dependOnClassesThat().resideInAnyPackage("picocli..", "com.tgupgrade.cli..");

        rule.check(classes);
    }

    @Test
    void exceptions_shouldExtendUpgradeException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.exception..")
            .should().beAssignableTo("com.tgupgrade.core.exception.UpgradeException");

        rule.check(classes);
    }
}
