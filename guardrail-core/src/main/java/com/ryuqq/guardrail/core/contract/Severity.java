package com.ryuqq.guardrail.core.contract;

/**
 * 규칙 위반의 심각도.
 *
 * <ul>
 *   <li>BLOCK: 위반 시 결정이 Deny</li>
 *   <li>WARN: 위반이 기록되지만 결정은 Allow (호스트가 경고로 로깅/표시)</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public enum Severity {

    /**
     * 차단.
     */
    BLOCK,

    /**
     * 경고.
     */
    WARN
}
