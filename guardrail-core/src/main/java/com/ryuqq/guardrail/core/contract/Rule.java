package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.RuleId;

/**
 * 계약을 구성하는 강제 규칙.
 *
 * <p>Rule은 세 가지 종류의 태그드 변형입니다:</p>
 * <ul>
 *   <li>{@link StateTransitionRule}: 엔티티 상태 전이의 합법성</li>
 *   <li>{@link LayerDependencyRule}: 모듈 간 레이어 의존 규칙</li>
 *   <li>{@link GenericPredicateRule}: 이름으로 등록된 일반 술어</li>
 * </ul>
 *
 * <p>모든 규칙은 심각도(severity)와 진단에 사용되는 설명(description)을 가집니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public sealed interface Rule permits StateTransitionRule, LayerDependencyRule, GenericPredicateRule {

    /**
     * 규칙 식별자.
     *
     * @return 규칙 ID
     */
    RuleId ruleId();

    /**
     * 위반 심각도.
     *
     * @return BLOCK 또는 WARN
     */
    Severity severity();

    /**
     * 사람이 읽을 수 있는 규칙 설명.
     *
     * @return 설명
     */
    String description();
}
