package com.ryuqq.guardrail.core.model;

import java.util.regex.Pattern;

/**
 * 아키텍처 레이어 식별자.
 *
 * <p>의존성 규칙은 개별 모듈이 아닌 레이어 사이에 선언됩니다.</p>
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
public final class LayerId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^\\S+$");

    private final String value;

    private LayerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LayerId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("LayerId length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("LayerId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * LayerId 생성.
     *
     * @param value LayerId 값 (예: web)
     * @return LayerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static LayerId of(String value) {
        return new LayerId(value);
    }

    /**
     * LayerId 값 조회.
     *
     * @return LayerId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayerId that = (LayerId) o;
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
