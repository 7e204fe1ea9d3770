package com.ryuqq.guardrail.core.validation;

/**
 * 위반 유형 코드.
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>미확인 참조 (요청이 계약에 없는 식별자를 참조): UNKNOWN_STATE, UNKNOWN_ENTITY, UNKNOWN_MODULE
 *       - 규칙 심각도와 관계없이 항상 차단</li>
 *   <li>일반 위반 (예상 가능한 1급 결과): ILLEGAL_TRANSITION, GUARD_REJECTED,
 *       FORBIDDEN_LAYER_EDGE, FORBIDDEN_DEPENDENCY, PREDICATE_REJECTED</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public enum ViolationCode {

    /**
     * 상태 머신에 선언되지 않은 상태.
     */
    UNKNOWN_STATE,

    /**
     * 계약에 상태 전이 규칙이 없는 엔티티 유형.
     */
    UNKNOWN_ENTITY,

    /**
     * 아키텍처 그래프에 선언되지 않은 모듈.
     */
    UNKNOWN_MODULE,

    /**
     * (from, to) 전이가 선언되지 않음.
     */
    ILLEGAL_TRANSITION,

    /**
     * 전이 guard가 false를 반환했거나 실패함.
     */
    GUARD_REJECTED,

    /**
     * (source 레이어, target 레이어) 의존이 허용 목록에 없음.
     */
    FORBIDDEN_LAYER_EDGE,

    /**
     * 금지 대상 모듈(외부 패키지 포함)에 대한 의존. 레이어 배치와 관계없이 위반.
     */
    FORBIDDEN_DEPENDENCY,

    /**
     * 일반 술어 규칙이 false를 반환했거나 실패함.
     */
    PREDICATE_REJECTED;

    /**
     * 미확인 참조 유형인지 확인.
     *
     * <p>미확인 참조는 조용히 무시되지 않고 항상 Deny로 표면화됩니다.</p>
     *
     * @return UNKNOWN_STATE, UNKNOWN_ENTITY, UNKNOWN_MODULE인 경우 true
     */
    public boolean isUnknownReference() {
        return this == UNKNOWN_STATE || this == UNKNOWN_ENTITY || this == UNKNOWN_MODULE;
    }
}
