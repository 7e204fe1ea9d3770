package com.ryuqq.guardrail.application.gateway;

import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.StateId;
import com.ryuqq.guardrail.core.spi.PredicateContext;

/**
 * 엔티티 상태 전이 평가 요청.
 *
 * <pre>
 * EvaluationRequest request = TransitionRequest.of("payments", "payment", "pay-42", "paid", "refunded",
 *     PredicateContext.of(Map.of("daysSincePayment", 3)));
 * </pre>
 *
 * @param contract 계약 이름
 * @param entityType 엔티티 유형
 * @param entityId 엔티티 식별자 (진단용)
 * @param from 현재 상태
 * @param to 목표 상태
 * @param guardContext Guard에 전달할 컨텍스트
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record TransitionRequest(
    ContractName contract,
    EntityType entityType,
    String entityId,
    StateId from,
    StateId to,
    PredicateContext guardContext
) implements EvaluationRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 entityId가 빈 문자열인 경우
     */
    public TransitionRequest {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        if (guardContext == null) {
            throw new IllegalArgumentException("guardContext cannot be null");
        }
    }

    /**
     * 문자열로 TransitionRequest 생성.
     */
    public static TransitionRequest of(String contract, String entityType, String entityId,
                                       String from, String to, PredicateContext guardContext) {
        return new TransitionRequest(
            ContractName.of(contract),
            EntityType.of(entityType),
            entityId,
            StateId.of(from),
            StateId.of(to),
            guardContext
        );
    }

    /**
     * Guard 컨텍스트 없이 TransitionRequest 생성.
     */
    public static TransitionRequest of(String contract, String entityType, String entityId,
                                       String from, String to) {
        return of(contract, entityType, entityId, from, to, PredicateContext.empty());
    }
}
