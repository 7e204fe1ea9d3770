package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 규칙 식별자.
 *
 * <p>위반(Violation) 진단에서 어떤 규칙이 실패했는지를 가리킵니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 하이픈, 언더스코어, 점, 콜론(:), 샵(#)만 허용</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class RuleId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.:#]+$");

    private final String value;

    private RuleId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RuleId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("RuleId length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("RuleId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * RuleId 생성.
     *
     * @param value RuleId 값 (예: payment-lifecycle)
     * @return RuleId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RuleId of(String value) {
        return new RuleId(value);
    }

    /**
     * RuleId 값 조회.
     *
     * @return RuleId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuleId that = (RuleId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
