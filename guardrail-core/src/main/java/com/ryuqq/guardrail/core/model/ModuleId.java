package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 아키텍처 그래프의 모듈 식별자.
 *
 * <p>모듈은 정확히 하나의 레이어에 속합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 공백 문자 없는 임의 문자열</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ModuleId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^\\S+$");

    private final String value;

    private ModuleId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ModuleId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ModuleId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("ModuleId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * ModuleId 생성.
     *
     * @param value ModuleId 값 (예: app.features.payment.routes)
     * @return ModuleId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ModuleId of(String value) {
        return new ModuleId(value);
    }

    /**
     * ModuleId 값 조회.
     *
     * @return ModuleId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleId that = (ModuleId) o;
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
