package io.sourcexform.cli;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "io.sourcexform.cli", importOptions = ImportOption.DoNotIncludeTests.class)
class CliArchitectureTest {

    @ArchTest
    static final ArchRule configIndependentOfApp = noClasses()
            .that()
            .resideInAPackage("io.sourcexform.cli.config..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.sourcexform.cli.app..", "io.sourcexform.core.engine..")
            .because("configuration is plain data loaded before the engine is built");

    @ArchTest
    static final ArchRule logbackOnlyInConfigurator = noClasses()
            .that()
            .doNotHaveSimpleName("LogbackConfigurator")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("ch.qos.logback..")
            .because("everything else logs through SLF4J");
}
