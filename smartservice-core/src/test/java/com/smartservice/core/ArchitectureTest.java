package com.smartservice.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Provider strategies and visualization contracts implement their SPI</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Compiler stages depend on earlier stages only</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.smartservice.core");
    }

    /**
     * Verifies provider strategy implementations extend AbstractProviderStrategy.
     */
    @Test
    void providerStrategies_shouldExtendAbstractProviderStrategy() {
        ArchRule rule = classes()
            .that().resideInAPackage("..query.impl..")
            .and().haveSimpleNameEndingWith("ProviderStrategy")
            .should().beAssignableTo("com.smartservice.core.query.AbstractProviderStrategy");

        rule.check(classes);
    }

    @Test
    void visualizationContracts_shouldImplementSpi() {
        ArchRule rule = classes()
            .that().resideInAPackage("..visualization.impl..")
            .should().implement("com.smartservice.core.visualization.VisualizationContract");

        rule.check(classes);
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
     * Verifies the model layer does not depend on compiler stages.
     */
    @Test
    void models_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..extract..", "..resolve..", "..query..", "..visualization..", "..ir..", "..pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies SPI base types don't depend on their implementations.
     */
    @Test
    void spiTypes_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("com.smartservice.core.query", "com.smartservice.core.visualization")
            .should().dependOnClassesThat().resideInAnyPackage("..query.impl..", "..visualization.impl..");

        rule.check(classes);
    }

    @Test
    void onlyPipeline_shouldDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..pipeline..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..model..", "..parser..", "..diagnostic..");

        rule.check(classes);
    }
}
