package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.core.architecture.ArchitectureReport;
import com.ryuqq.guardrail.core.architecture.ArchitectureValidator;
import com.ryuqq.guardrail.core.architecture.DependencyEdge;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.decision.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CI 파이프라인용 일괄 아키텍처 검사기.
 *
 * <p>코드베이스의 의존성 스냅샷 전체를 레이어 의존 규칙으로 검사하고 결과를 로그로 남깁니다.
 * 프로세스를 종료하지 않으며, 종료 코드는 {@link LintResult#exitCode()}를 참고해 호스트가 결정합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. validator.validateAll(rule, edges) → 위반 시퀀스 (지연 평가)
 * 2. ArchitectureReport.of(...) → 위반 + 수정 제안 수집
 * 3. 위반별 로그 (maxLoggedViolations까지) + 수정 제안 로그
 * 4. 판정:
 *    - BLOCK 위반 존재 → 실패
 *    - WARN 위반만 존재 → failOnWarn이면 실패, 아니면 통과
 * 5. 요약 로그
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ArchitectureLintRunner {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureLintRunner.class);
    private final ArchitectureValidator validator;
    private final LintConfig config;

    /**
     * 생성자.
     *
     * @param validator 아키텍처 검증기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ArchitectureLintRunner(ArchitectureValidator validator, LintConfig config) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.validator = validator;
        this.config = config;
    }

    /**
     * 의존성 스냅샷 검사.
     *
     * @param rule 레이어 의존 규칙
     * @param edges 의존성 스냅샷
     * @return 린트 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public LintResult lint(LayerDependencyRule rule, Iterable<DependencyEdge> edges) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        if (edges == null) {
            throw new IllegalArgumentException("edges cannot be null");
        }
        log.info("Architecture lint started: rule={}", rule.ruleId());

        ArchitectureReport report = ArchitectureReport.of(validator.validateAll(rule, edges));

        int logged = 0;
        for (Violation violation : report.violations()) {
            if (logged >= config.maxLoggedViolations()) {
                log.warn("... {} more violation(s) not shown", report.violations().size() - logged);
                break;
            }
            if (violation.isBlocking()) {
                log.error("{}", violation);
            } else {
                log.warn("{}", violation);
            }
            logged++;
        }
        for (String suggestion : report.suggestions()) {
            log.info("Suggestion: {}", suggestion);
        }

        boolean passed = !report.hasBlockingViolations() && (report.isValid() || !config.failOnWarn());
        if (passed) {
            log.info("Architecture lint passed: rule={}, violations={}", rule.ruleId(), report.violations().size());
        } else {
            log.error("Architecture lint failed: rule={}, violations={}", rule.ruleId(), report.violations().size());
        }
        return new LintResult(report, passed);
    }
}
