package com.taxledger;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common are leaves, the engine never reads Spring configuration, and nothing below
 * the report layer depends on it.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.taxledger");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..asset..", "..pricing..", "..costbasis..", "..config..", "..report..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..asset..", "..pricing..", "..costbasis..", "..config..", "..report..");
        rule.check(classes);
    }

    @Test
    void asset_must_not_depend_on_engine_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..asset..")
                .should().dependOnClassesThat().resideInAnyPackage("..pricing..", "..costbasis..", "..config..", "..report..");
        rule.check(classes);
    }

    @Test
    void pricing_must_not_depend_on_asset_costbasis_report() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..pricing..")
                .should().dependOnClassesThat().resideInAnyPackage("..asset..", "..costbasis..", "..report..");
        rule.check(classes);
    }

    @Test
    void costbasis_must_not_depend_on_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..costbasis..")
                .should().dependOnClassesThat().resideInAPackage("..config..");
        rule.check(classes);
    }

    @Test
    void costbasis_must_not_depend_on_report() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..costbasis..")
                .should().dependOnClassesThat().resideInAPackage("..report..");
        rule.check(classes);
    }

    @Test
    void ledger_must_not_depend_on_engine_or_offsetting() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..costbasis.ledger..")
                .should().dependOnClassesThat().resideInAnyPackage("..costbasis.engine..", "..costbasis.offsetting..", "..costbasis.ordering..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.taxledger.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_inside_costbasis() {
        ArchRule rule = slices()
                .matching("com.taxledger.costbasis.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
