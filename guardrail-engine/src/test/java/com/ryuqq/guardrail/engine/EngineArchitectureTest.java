package com.ryuqq.guardrail.engine;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Engine 모듈 경계 규칙.
 *
 * <p>Engine은 SPI로만 저장소와 술어에 접근하며 어댑터 구현에 의존하지 않습니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
class EngineArchitectureTest {

    private static final JavaClasses ENGINE = new ClassFileImporter()
        .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
        .importPackages("com.ryuqq.guardrail.engine");

    @Test
    void engine_DoesNotDependOnAdapters() {
        noClasses().that().resideInAPackage("com.ryuqq.guardrail.engine..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.ryuqq.guardrail.adapter..",
                "com.ryuqq.guardrail.testkit.."
            )
            .check(ENGINE);
    }

    @Test
    void gateway_EvaluationPathDoesNotLog() {
        noClasses().that().haveSimpleName("DefaultEnforcementGateway")
            .should().dependOnClassesThat().resideInAPackage("org.slf4j..")
            .check(ENGINE);
    }
}
