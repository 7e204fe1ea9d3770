package com.ryuqq.guardrail.core.decision;

/**
 * 계약이 없는 테넌트에 대한 호스트의 기본 정책.
 *
 * <p>엔진은 UNCONFIGURED를 스스로 허용/거부로 바꾸지 않습니다. 호스트가 이 정책을 구성하고
 * {@link Decision#isPermitted(UnconfiguredPolicy)}로 최종 허용 여부를 판단합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public enum UnconfiguredPolicy {

    /**
     * 계약이 없으면 허용.
     */
    FAIL_OPEN,

    /**
     * 계약이 없으면 거부.
     */
    FAIL_CLOSED
}
