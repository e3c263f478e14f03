package com.iudex.cograg.architecture;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Retrieval and reasoning code talks to models and indexes only through the capability
 * interfaces; the Spring AI bindings stay swappable.
 */
class LayerBoundaryTest {

    private static final JavaClasses CLASSES = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.iudex.cograg");

    // ─── Capability Isolation ──────────────────────────────────────

    @Test
    @DisplayName("rag package must not depend on the Spring AI bindings")
    void ragShouldNotDependOnSpringAiBindings() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..rag..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..capability.springai..", "org.springframework.ai..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("service package must not depend on the Spring AI bindings")
    void serviceShouldNotDependOnSpringAiBindings() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..cograg.service..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..capability.springai..", "org.springframework.ai..");
        rule.check(CLASSES);
    }

    // ─── Layer Boundaries ──────────────────────────────────────────

    @Test
    @DisplayName("consultation memory depends only on the planner's tree snapshot")
    void memoryShouldNotDependOnReasoningStages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..rag.memory..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..rag.cograg", "..rag.cograg.reasoner..", "..rag.cograg.refiner..", "..rag.cograg.verifier..",
                        "..rag.cograg.integrator..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("shared building blocks must not depend on pipeline stages")
    void foundationShouldNotDependOnStages() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..cograg.util..", "..cograg.model..", "..cograg.context..",
                        "..cograg.constant..", "..cograg.exception..", "..cograg.reasoning..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..cograg.rag..", "..cograg.service..");
        rule.check(CLASSES);
    }
}
