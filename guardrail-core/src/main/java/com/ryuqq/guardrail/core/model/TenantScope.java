package com.ryuqq.guardrail.core.model;

import java.util.Optional;

/**
 * 계약의 테넌트 범위.
 *
 * <p>하나의 테넌트 전용 범위이거나, 모든 테넌트에 적용되는 전역(global) 범위입니다.</p>
 *
 * <p><strong>조회 순서:</strong> 동일한 계약 이름에 대해 테넌트 전용 계약이 전역 계약보다 우선합니다.</p>
 *
 * <pre>
 * TenantScope scope = TenantScope.of(TenantId.of("t1"));
 * TenantScope fallback = TenantScope.global();
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class TenantScope {

    private static final TenantScope GLOBAL = new TenantScope(null);

    private final TenantId tenantId;

    private TenantScope(TenantId tenantId) {
        this.tenantId = tenantId;
    }

    /**
     * 테넌트 전용 범위 생성.
     *
     * @param tenantId 테넌트 ID
     * @return TenantScope 인스턴스
     * @throws IllegalArgumentException tenantId가 null인 경우
     */
    public static TenantScope of(TenantId tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        return new TenantScope(tenantId);
    }

    /**
     * 전역 범위.
     *
     * @return 전역 TenantScope (싱글톤)
     */
    public static TenantScope global() {
        return GLOBAL;
    }

    /**
     * 전역 범위 여부.
     *
     * @return 전역 범위이면 true
     */
    public boolean isGlobal() {
        return tenantId == null;
    }

    /**
     * 테넌트 ID 조회.
     *
     * @return 테넌트 ID (전역 범위이면 empty)
     */
    public Optional<TenantId> tenantId() {
        return Optional.ofNullable(tenantId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantScope that = (TenantScope) o;
        return tenantId == null ? that.tenantId == null : tenantId.equals(that.tenantId);
    }

    @Override
    public int hashCode() {
        return tenantId == null ? 0 : tenantId.hashCode();
    }

    @Override
    public String toString() {
        return tenantId == null ? "global" : tenantId.getValue();
    }
}
