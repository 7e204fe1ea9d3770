package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.architecture.ArchitectureGraph;
import com.ryuqq.guardrail.core.model.RuleId;

/**
 * 모듈 간 의존을 레이어 허용 간선으로 검증하는 규칙.
 *
 * @param ruleId 규칙 ID
 * @param severity 심각도
 * @param description 설명
 * @param graph 아키텍처 그래프
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record LayerDependencyRule(
    RuleId ruleId,
    Severity severity,
    String description,
    ArchitectureGraph graph
) implements Rule {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 description이 빈 문자열인 경우
     */
    public LayerDependencyRule {
        RuleFields.require(ruleId, severity, description);
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
    }
}
