package com.ryuqq.guardrail.core.model;

/**
 * 활성 계약 버전을 가리키는 복합 키 (테넌트 범위, 계약 이름).
 *
 * <p>키마다 정확히 하나의 활성 버전이 존재하며, 새 버전 게시는 이 키의 포인터를
 * 원자적으로 교체합니다.</p>
 *
 * @param scope 테넌트 범위
 * @param name 계약 이름
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record ContractKey(TenantScope scope, ContractName name) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException scope 또는 name이 null인 경우
     */
    public ContractKey {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }

    /**
     * ContractKey 생성.
     *
     * @param scope 테넌트 범위
     * @param name 계약 이름
     * @return ContractKey 인스턴스
     */
    public static ContractKey of(TenantScope scope, ContractName name) {
        return new ContractKey(scope, name);
    }

    @Override
    public String toString() {
        return scope + "/" + name;
    }
}
