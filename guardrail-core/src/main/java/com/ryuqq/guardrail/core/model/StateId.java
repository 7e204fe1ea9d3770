package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 상태 머신의 상태 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 공백 문자 없는 임의 문자열</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class StateId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^\\S+$");

    private final String value;

    private StateId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StateId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("StateId length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("StateId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * StateId 생성.
     *
     * @param value StateId 값 (예: pending)
     * @return StateId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StateId of(String value) {
        return new StateId(value);
    }

    /**
     * StateId 값 조회.
     *
     * @return StateId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateId that = (StateId) o;
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
