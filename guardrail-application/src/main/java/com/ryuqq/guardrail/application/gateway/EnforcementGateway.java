package com.ryuqq.guardrail.application.gateway;

import com.ryuqq.guardrail.core.decision.Decision;
import com.ryuqq.guardrail.core.model.TenantId;

/**
 * 정책 평가 진입점.
 *
 * <p>테넌트의 활성 계약을 한 번 조회하고, 요청 종류에 맞는 모든 규칙을 선언 순서대로 실행하여
 * 하나의 {@link Decision}으로 집계합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Decision decision = gateway.evaluate(tenantId,
 *     TransitionRequest.of("payments", "payment", "pay-42", "pending", "paid"));
 *
 * if (decision.isPermitted(UnconfiguredPolicy.FAIL_CLOSED)) {
 *     // 전이 수행 (영속화는 호스트 책임)
 * } else {
 *     // 409 Conflict + decision.violations()
 * }
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>위반은 예외가 아니라 Decision에 담겨 반환</li>
 *   <li>계약이 없으면 DENY가 아닌 UNCONFIGURED</li>
 *   <li>저장소가 변경되지 않았다면 같은 입력에 대해 동등한 Decision</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public interface EnforcementGateway {

    /**
     * 요청 평가.
     *
     * @param tenantId 인증된 테넌트 ID
     * @param request 평가 요청
     * @return 결정 (ALLOW / DENY / UNCONFIGURED)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.guardrail.core.exception.ContractIntegrityException 계약이 참조하는 술어가 사라진 경우
     */
    Decision evaluate(TenantId tenantId, EvaluationRequest request);
}
