package com.ryuqq.guardrail.core.decision;

/**
 * 결정 결과.
 *
 * <ul>
 *   <li>ALLOW: 차단 위반 없음 (경고 위반은 있을 수 있음)</li>
 *   <li>DENY: 하나 이상의 차단 위반</li>
 *   <li>UNCONFIGURED: 테넌트에 계약이 없음 - Deny와 구분되며, 호스트가 fail-open/fail-closed를 결정</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public enum DecisionOutcome {

    ALLOW,

    DENY,

    UNCONFIGURED
}
