package io.sheetcompiler.runtime;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaModifier;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Boundary rules for the runtime library. Generated programs link against this module alone,
 * so it must never reach back into the compiler.
 */
@AnalyzeClasses(
        packages = "io.sheetcompiler.runtime",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class RuntimeArchitectureTest {

    @ArchTest
    static final ArchRule noCompilerDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.sheetcompiler.core..")
            .because("generated programs ship with the runtime only");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("spreadsheet semantics are plain static code");

    @ArchTest
    static final ArchRule helperLibrariesAreFinal = classes()
            .that()
            .haveNameMatching(".*\\.(Operators|Functions|Values|Criteria)")
            .should()
            .haveModifier(JavaModifier.FINAL)
            .because("Operators, Functions, Values and Criteria are static utility classes");
}
