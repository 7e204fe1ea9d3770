package com.ryuqq.guardrail.core.exception;

import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.TenantScope;

/**
 * 테넌트에 대해 게시된 계약이 없고 전역 대체 계약도 없는 경우 (NotFoundError).
 *
 * <p>복구 가능한 상황이며, Gateway는 이를 {@code UNCONFIGURED} 결정으로 변환합니다.
 * 호스트가 fail-open/fail-closed 정책을 결정합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class ContractNotFoundException extends RuntimeException {

    private final TenantScope scope;
    private final ContractName name;

    /**
     * 생성자.
     *
     * @param scope 조회한 테넌트 범위
     * @param name 조회한 계약 이름
     */
    public ContractNotFoundException(TenantScope scope, ContractName name) {
        super("No contract '" + name + "' published for " + scope + " and no global fallback");
        this.scope = scope;
        this.name = name;
    }

    /**
     * 특정 버전 조회 실패용 생성자.
     *
     * @param scope 조회한 테넌트 범위
     * @param name 조회한 계약 이름
     * @param version 조회한 버전
     */
    public ContractNotFoundException(TenantScope scope, ContractName name, long version) {
        super("No version " + version + " of contract '" + name + "' published for " + scope);
        this.scope = scope;
        this.name = name;
    }

    public TenantScope getScope() {
        return scope;
    }

    public ContractName getName() {
        return name;
    }
}
