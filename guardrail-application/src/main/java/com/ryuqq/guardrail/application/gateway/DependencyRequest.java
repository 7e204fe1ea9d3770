package com.ryuqq.guardrail.application.gateway;

import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.ModuleId;

/**
 * 모듈 간 의존 평가 요청.
 *
 * @param contract 계약 이름
 * @param source 의존하는 모듈
 * @param target 의존받는 모듈
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record DependencyRequest(ContractName contract, ModuleId source, ModuleId target) implements EvaluationRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public DependencyRequest {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    public static DependencyRequest of(String contract, String source, String target) {
        return new DependencyRequest(ContractName.of(contract), ModuleId.of(source), ModuleId.of(target));
    }
}
