package com.ryuqq.guardrail.core.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 검증기(validator)의 순수 결과.
 *
 * <p>ValidationResult는 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Valid}: 검증 통과</li>
 *   <li>{@link Invalid}: 위반 코드, 메시지, 진단 컨텍스트를 포함한 실패</li>
 * </ul>
 *
 * <p>아직 특정 규칙(ruleId, severity)에 결합되지 않은 결과이며, Gateway가
 * 규칙 정보와 결합하여 {@code Violation}으로 변환합니다.</p>
 *
 * <pre>
 * ValidationResult result = validator.validateTransition(machine, from, to, context);
 * if (result instanceof ValidationResult.Invalid invalid) {
 *     log(invalid.code() + ": " + invalid.message());
 * }
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    /**
     * 검증 통과 결과 (싱글톤).
     *
     * @return Valid 인스턴스
     */
    static ValidationResult valid() {
        return Valid.INSTANCE;
    }

    /**
     * 검증 실패 결과 생성.
     *
     * @param code 위반 코드
     * @param message 사람이 읽을 수 있는 진단 메시지
     * @param context 진단 컨텍스트 (순서 유지)
     * @return Invalid 인스턴스
     */
    static ValidationResult invalid(ViolationCode code, String message, Map<String, String> context) {
        return new Invalid(code, message, context);
    }

    /**
     * 검증 통과 여부.
     *
     * @return 통과이면 true
     */
    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * 검증 통과.
     */
    final class Valid implements ValidationResult {

        private static final Valid INSTANCE = new Valid();

        private Valid() {
        }

        @Override
        public String toString() {
            return "Valid";
        }
    }

    /**
     * 검증 실패.
     *
     * @param code 위반 코드
     * @param message 진단 메시지
     * @param context 진단 컨텍스트 (불변, 삽입 순서 유지)
     */
    record Invalid(ViolationCode code, String message, Map<String, String> context) implements ValidationResult {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException code 또는 message가 null/빈 문자열인 경우
         */
        public Invalid {
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
    }
}
