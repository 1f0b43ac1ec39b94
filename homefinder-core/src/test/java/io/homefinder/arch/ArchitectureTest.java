package io.homefinder.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.homefinder.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.homefinder.kernel..",
                        "io.homefinder.storage..",
                        "io.homefinder.index..",
                        "io.homefinder.query..",
                        "io.homefinder.benchmarks..");
        rule.check(importedMainClasses());
    }

    @Test
    void kernelShouldStayDomainFree() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.homefinder.kernel..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.homefinder.core..",
                        "io.homefinder.storage..",
                        "io.homefinder.index..",
                        "io.homefinder.query..",
                        "io.homefinder.benchmarks..");
        rule.check(importedMainClasses());
    }

    @Test
    void storageShouldNotDependOnIndexOrQuery() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.homefinder.storage..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.homefinder.index..", "io.homefinder.query..", "io.homefinder.benchmarks..");
        rule.check(importedMainClasses());
    }

    @Test
    void indexShouldNotDependOnQuery() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.homefinder.index..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.homefinder.query..", "io.homefinder.benchmarks..");
        rule.check(importedMainClasses());
    }

    @Test
    void queryShouldNotDependOnBenchmarks() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.homefinder.query..")
                .should().dependOnClassesThat().resideInAPackage("io.homefinder.benchmarks..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAnyPackage("..test..", "io.homefinder.logging..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.homefinder..");
    }
}
