package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.statemachine.StateMachine;

/**
 * 엔티티 유형의 상태 전이를 선언된 상태 머신으로 검증하는 규칙.
 *
 * @param ruleId 규칙 ID
 * @param severity 심각도
 * @param description 설명
 * @param entityType 적용 대상 엔티티 유형
 * @param machine 상태 머신
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record StateTransitionRule(
    RuleId ruleId,
    Severity severity,
    String description,
    EntityType entityType,
    StateMachine machine
) implements Rule {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 description이 빈 문자열인 경우
     */
    public StateTransitionRule {
        RuleFields.require(ruleId, severity, description);
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
    }
}
