package com.ryuqq.guardrail.core.decision;

import com.ryuqq.guardrail.core.contract.Rule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.validation.ValidationResult;
import com.ryuqq.guardrail.core.validation.ViolationCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단일 규칙 실패와 진단 컨텍스트.
 *
 * <p>위반은 항상 반환되며 절대 예외로 던져지지 않습니다.</p>
 *
 * <p><strong>심각도 규칙:</strong> 미확인 참조 코드(UNKNOWN_STATE, UNKNOWN_ENTITY, UNKNOWN_MODULE)는
 * 규칙의 선언 심각도와 관계없이 BLOCK으로 기록됩니다.</p>
 *
 * @param ruleId 실패한 규칙 ID
 * @param severity 심각도
 * @param code 위반 코드
 * @param message 진단 메시지
 * @param context 진단 컨텍스트 (엔티티 ID, from/to 상태, 위반 간선 등, 순서 유지)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record Violation(
    RuleId ruleId,
    Severity severity,
    ViolationCode code,
    String message,
    Map<String, String> context
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 message가 빈 문자열인 경우
     */
    public Violation {
        if (ruleId == null) {
            throw new IllegalArgumentException("ruleId cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * 검증 실패 결과를 규칙에 결합.
     *
     * @param rule 실패한 규칙
     * @param invalid 검증 실패 결과
     * @return Violation 인스턴스
     */
    public static Violation of(Rule rule, ValidationResult.Invalid invalid) {
        return of(rule.ruleId(), rule.severity(), invalid);
    }

    /**
     * 검증 실패 결과를 규칙 ID/심각도에 결합.
     *
     * @param ruleId 규칙 ID
     * @param declared 규칙에 선언된 심각도
     * @param invalid 검증 실패 결과
     * @return Violation 인스턴스
     */
    public static Violation of(RuleId ruleId, Severity declared, ValidationResult.Invalid invalid) {
        Severity effective = invalid.code().isUnknownReference() ? Severity.BLOCK : declared;
        return new Violation(ruleId, effective, invalid.code(), invalid.message(), invalid.context());
    }

    /**
     * 차단 위반인지 확인.
     *
     * @return severity가 BLOCK이면 true
     */
    public boolean isBlocking() {
        return severity == Severity.BLOCK;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + ruleId + " " + code + ": " + message;
    }
}
