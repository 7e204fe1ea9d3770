package com.ryuqq.guardrail.core.architecture;

import com.ryuqq.guardrail.core.decision.Violation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 일괄 아키텍처 검증 보고서.
 *
 * <p>위반 목록과, 위반 간선에 대한 수정 제안(hint)을 중복 없이 등장 순서대로 담습니다.</p>
 *
 * <pre>
 * ArchitectureReport report = ArchitectureReport.of(validator.validateAll(rule, edges));
 * if (!report.isValid()) {
 *     report.suggestions().forEach(System.out::println);
 * }
 * </pre>
 *
 * @param violations 위반 목록
 * @param suggestions 수정 제안 목록
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record ArchitectureReport(List<Violation> violations, List<String> suggestions) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ArchitectureReport {
        if (violations == null) {
            throw new IllegalArgumentException("violations cannot be null");
        }
        if (suggestions == null) {
            throw new IllegalArgumentException("suggestions cannot be null");
        }
        violations = List.copyOf(violations);
        suggestions = List.copyOf(suggestions);
    }

    /**
     * 위반 시퀀스를 소비하여 보고서 생성.
     *
     * @param violations 위반 시퀀스
     * @return ArchitectureReport 인스턴스
     */
    public static ArchitectureReport of(Iterable<Violation> violations) {
        if (violations == null) {
            throw new IllegalArgumentException("violations cannot be null");
        }
        List<Violation> collected = new ArrayList<>();
        Set<String> suggestions = new LinkedHashSet<>();
        for (Violation violation : violations) {
            collected.add(violation);
            String hint = violation.context().get("hint");
            if (hint != null) {
                suggestions.add(hint);
            }
        }
        return new ArchitectureReport(collected, new ArrayList<>(suggestions));
    }

    /**
     * 위반이 없는지 확인.
     *
     * @return 위반이 없으면 true
     */
    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * 차단(BLOCK) 위반이 있는지 확인.
     *
     * @return 차단 위반이 있으면 true
     */
    public boolean hasBlockingViolations() {
        return violations.stream().anyMatch(Violation::isBlocking);
    }
}
