package com.ryuqq.guardrail.application.gateway;

import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.spi.PredicateContext;

/**
 * 일반 술어 평가 요청.
 *
 * <p>계약의 모든 일반 술어 규칙이 같은 입력으로 평가됩니다.</p>
 *
 * @param contract 계약 이름
 * @param predicateInput 술어 입력
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record GenericRequest(ContractName contract, PredicateContext predicateInput) implements EvaluationRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public GenericRequest {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (predicateInput == null) {
            throw new IllegalArgumentException("predicateInput cannot be null");
        }
    }

    public static GenericRequest of(String contract, PredicateContext predicateInput) {
        return new GenericRequest(ContractName.of(contract), predicateInput);
    }
}
