package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 엔티티 유형.
 *
 * <p>상태 전이 규칙이 어떤 도메인 엔티티(예: payment, order)의 생명주기를
 * 다루는지 식별합니다.</p>
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
public final class EntityType {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");

    private final String value;

    private EntityType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityType cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("EntityType length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("EntityType contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * EntityType 생성.
     *
     * @param value EntityType 값 (예: payment)
     * @return EntityType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityType of(String value) {
        return new EntityType(value);
    }

    /**
     * EntityType 값 조회.
     *
     * @return EntityType 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityType that = (EntityType) o;
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
