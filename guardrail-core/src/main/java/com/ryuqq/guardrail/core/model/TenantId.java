package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 테넌트 식별자.
 *
 * <p>TenantId는 계약(Contract) 격리 경계이며, 계약 조회 시 테넌트 전용 계약이
 * 전역(global) 계약보다 우선합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class TenantId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");

    private final String value;

    private TenantId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TenantId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("TenantId length cannot exceed 128 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("TenantId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * TenantId 생성.
     *
     * @param value TenantId 값 (예: t1)
     * @return TenantId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TenantId of(String value) {
        return new TenantId(value);
    }

    /**
     * TenantId 값 조회.
     *
     * @return TenantId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantId that = (TenantId) o;
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
