package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.core.architecture.ArchitectureValidator;
import com.ryuqq.guardrail.core.architecture.DependencyEdge;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.decision.Violation;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.validation.ViolationCode;
import com.ryuqq.guardrail.testkit.fixture.ContractFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * ArchitectureLintRunner 유닛 테스트.
 *
 * <p>판정 규칙을 검증합니다:</p>
 * <ul>
 *   <li>위반 없음 → 통과</li>
 *   <li>BLOCK 위반 → 실패</li>
 *   <li>WARN 위반만 → failOnWarn 설정에 따라 결정</li>
 *   <li>수정 제안 수집</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ArchitectureLintRunnerTest {

    private static final LayerDependencyRule RULE = ContractFixtures.layeringRule(Severity.BLOCK);
    private static final List<DependencyEdge> EDGES = List.of(DependencyEdge.of("db", "api"));

    @Mock
    private ArchitectureValidator validator;

    private ArchitectureLintRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ArchitectureLintRunner(validator, new LintConfig());
    }

    // ============================================================
    // 1. 판정
    // ============================================================

    @Test
    void lint_위반이_없으면_통과하고_종료코드_0() {
        // given
        when(validator.validateAll(RULE, EDGES)).thenReturn(List.of());

        // when
        LintResult result = runner.lint(RULE, EDGES);

        // then
        assertThat(result.passed()).isTrue();
        assertThat(result.exitCode()).isZero();
        assertThat(result.report().isValid()).isTrue();
        verify(validator).validateAll(RULE, EDGES);
    }

    @Test
    void lint_BLOCK_위반이_있으면_실패하고_종료코드_1() {
        // given
        when(validator.validateAll(RULE, EDGES)).thenReturn(List.of(violation(Severity.BLOCK, null)));

        // when
        LintResult result = runner.lint(RULE, EDGES);

        // then
        assertThat(result.passed()).isFalse();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.report().violations()).hasSize(1);
    }

    @Test
    void lint_WARN_위반만_있으면_기본_설정에서는_통과() {
        // given
        when(validator.validateAll(RULE, EDGES)).thenReturn(List.of(violation(Severity.WARN, null)));

        // when
        LintResult result = runner.lint(RULE, EDGES);

        // then
        assertThat(result.passed()).isTrue();
        assertThat(result.report().violations()).hasSize(1);
    }

    @Test
    void lint_WARN_위반만_있어도_failOnWarn이면_실패() {
        // given
        ArchitectureLintRunner strict = new ArchitectureLintRunner(validator, new LintConfig().withFailOnWarn(true));
        when(validator.validateAll(RULE, EDGES)).thenReturn(List.of(violation(Severity.WARN, null)));

        // when
        LintResult result = strict.lint(RULE, EDGES);

        // then
        assertThat(result.passed()).isFalse();
    }

    // ============================================================
    // 2. 보고서
    // ============================================================

    @Test
    void lint_수정_제안은_중복_없이_수집됨() {
        // given
        String hint = "Move shared code to a lower layer";
        when(validator.validateAll(RULE, EDGES)).thenReturn(List.of(
            violation(Severity.BLOCK, hint),
            violation(Severity.BLOCK, hint),
            violation(Severity.BLOCK, null)
        ));

        // when
        LintResult result = runner.lint(RULE, EDGES);

        // then
        assertThat(result.report().violations()).hasSize(3);
        assertThat(result.report().suggestions()).containsExactly(hint);
    }

    @Test
    void lint_로그_한도를_넘어도_보고서에는_모든_위반이_남음() {
        // given
        ArchitectureLintRunner quiet = new ArchitectureLintRunner(validator,
            new LintConfig().withMaxLoggedViolations(1));
        List<Violation> violations = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            violations.add(violation(Severity.BLOCK, null));
        }
        when(validator.validateAll(RULE, EDGES)).thenReturn(violations);

        // when
        LintResult result = quiet.lint(RULE, EDGES);

        // then
        assertThat(result.report().violations()).hasSize(5);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void lint_실제_검증기로_스냅샷을_검사하면_금지된_의존만_보고됨() {
        // given
        ArchitectureLintRunner real = new ArchitectureLintRunner(new ArchitectureValidator(), new LintConfig());
        List<DependencyEdge> snapshot = List.of(
            DependencyEdge.of("api", "db"),
            DependencyEdge.of("db", "api"),
            DependencyEdge.of("db", "api")
        );

        // when
        LintResult result = real.lint(RULE, snapshot);

        // then
        assertThat(result.passed()).isFalse();
        assertThat(result.report().violations()).hasSize(1);
        assertThat(result.report().violations().get(0).code()).isEqualTo(ViolationCode.FORBIDDEN_LAYER_EDGE);
        assertThat(result.report().suggestions()).containsExactly("Move shared code to a lower layer");
        verifyNoInteractions(validator);
    }

    // ============================================================
    // 3. 인자 검증
    // ============================================================

    @Test
    void 생성자와_lint는_null을_거부함() {
        assertThatThrownBy(() -> new ArchitectureLintRunner(null, new LintConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArchitectureLintRunner(validator, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> runner.lint(null, EDGES))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> runner.lint(RULE, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Violation violation(Severity severity, String hint) {
        Map<String, String> context = hint == null
            ? Map.of("source", "db", "target", "api")
            : Map.of("source", "db", "target", "api", "hint", hint);
        return new Violation(RuleId.of("layering"), severity, ViolationCode.FORBIDDEN_LAYER_EDGE,
            "Module 'db' (data) must not depend on 'api' (web)", context);
    }
}
