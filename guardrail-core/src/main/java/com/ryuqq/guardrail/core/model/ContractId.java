package com.ryuqq.guardrail.core.model;

/**
 * 게시된 계약 버전의 식별자.
 *
 * <p>(테넌트 범위, 계약 이름, 버전)으로 구성되며, 이전 버전도 감사(audit) 목적으로
 * 이 식별자를 통해 계속 조회할 수 있습니다.</p>
 *
 * @param key 계약 키 (범위 + 이름)
 * @param version 키 내부에서 단조 증가하는 버전 (1 이상)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record ContractId(ContractKey key, long version) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null이거나 version이 1 미만인 경우
     */
    public ContractId {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
    }

    /**
     * ContractId 생성.
     *
     * @param key 계약 키
     * @param version 버전
     * @return ContractId 인스턴스
     */
    public static ContractId of(ContractKey key, long version) {
        return new ContractId(key, version);
    }

    @Override
    public String toString() {
        return key + "@v" + version;
    }
}
