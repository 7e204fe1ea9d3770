package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 술어(predicate) 이름.
 *
 * <p>상태 전이 guard와 일반 술어 규칙이 이 이름으로 {@code PredicateRegistry}에서
 * 함수를 찾습니다. 계약 게시 시점에 이름이 검증됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 하이픈, 언더스코어, 점만 허용</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class PredicateName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");

    private final String value;

    private PredicateName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PredicateName cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("PredicateName length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("PredicateName contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * PredicateName 생성.
     *
     * @param value PredicateName 값 (예: refund-window-open)
     * @return PredicateName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PredicateName of(String value) {
        return new PredicateName(value);
    }

    /**
     * PredicateName 값 조회.
     *
     * @return PredicateName 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PredicateName that = (PredicateName) o;
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
