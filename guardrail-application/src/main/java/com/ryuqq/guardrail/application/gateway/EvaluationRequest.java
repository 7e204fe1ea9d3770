package com.ryuqq.guardrail.application.gateway;

import com.ryuqq.guardrail.core.model.ContractName;

/**
 * 평가 요청.
 *
 * <p>요청 종류에 따라 계약 안에서 실행되는 규칙이 달라집니다:</p>
 * <ul>
 *   <li>{@link TransitionRequest}: entityType이 일치하는 상태 전이 규칙</li>
 *   <li>{@link DependencyRequest}: 레이어 의존 규칙</li>
 *   <li>{@link GenericRequest}: 일반 술어 규칙</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public sealed interface EvaluationRequest permits TransitionRequest, DependencyRequest, GenericRequest {

    /**
     * 평가할 계약 이름.
     *
     * @return 계약 이름
     */
    ContractName contract();
}
