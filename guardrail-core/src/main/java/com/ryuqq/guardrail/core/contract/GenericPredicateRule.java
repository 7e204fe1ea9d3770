package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;

/**
 * 이름으로 등록된 술어를 요청 입력에 대해 평가하는 일반 규칙.
 *
 * @param ruleId 규칙 ID
 * @param severity 심각도
 * @param description 설명
 * @param predicate 술어 이름 (게시 시점에 레지스트리에서 검증됨)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record GenericPredicateRule(
    RuleId ruleId,
    Severity severity,
    String description,
    PredicateName predicate
) implements Rule {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 description이 빈 문자열인 경우
     */
    public GenericPredicateRule {
        RuleFields.require(ruleId, severity, description);
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
    }
}
