package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 계약 이름.
 *
 * <p>(테넌트 범위, 계약 이름) 쌍이 활성 버전을 가리키는 키가 됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자로 시작, 영숫자/하이픈/언더스코어/점만 허용</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ContractName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-_.]*$");

    private final String value;

    private ContractName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ContractName cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("ContractName length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("ContractName contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * ContractName 생성.
     *
     * @param value ContractName 값 (예: payments)
     * @return ContractName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ContractName of(String value) {
        return new ContractName(value);
    }

    /**
     * ContractName 값 조회.
     *
     * @return ContractName 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContractName that = (ContractName) o;
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
