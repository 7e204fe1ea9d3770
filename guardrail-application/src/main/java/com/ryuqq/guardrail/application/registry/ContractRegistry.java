package com.ryuqq.guardrail.application.registry;

import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.exception.ContractNotFoundException;
import com.ryuqq.guardrail.core.exception.ContractValidationException;
import com.ryuqq.guardrail.core.model.ContractId;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.TenantId;
import com.ryuqq.guardrail.core.model.TenantScope;

import java.util.List;

/**
 * 테넌트별 계약 게시 및 조회.
 *
 * <p>계약 정의를 게시 시점에 검증하고, 검증을 통과한 정의만 새 버전으로 저장합니다.
 * 게시는 읽기 측에 대해 원자적이며, 이미 게시된 버전은 변경되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ContractId id = registry.publish(TenantId.of("t1"), definition);
 * Contract active = registry.resolve(TenantId.of("t1"), ContractName.of("payments"));
 * </pre>
 *
 * <p><strong>조회 우선순위:</strong> 같은 이름이면 테넌트 전용 계약이 전역 계약보다 우선합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public interface ContractRegistry {

    /**
     * 테넌트 전용 계약 게시.
     *
     * @param tenantId 테넌트 ID
     * @param definition 계약 정의
     * @return 새로 게시된 계약 ID (버전 포함)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ContractValidationException 정의가 유효하지 않은 경우 (저장소는 변경되지 않음)
     */
    ContractId publish(TenantId tenantId, ContractDefinition definition);

    /**
     * 전역 계약 게시 (테넌트 전용 계약이 없는 모든 테넌트에 적용).
     *
     * @param definition 계약 정의
     * @return 새로 게시된 계약 ID (버전 포함)
     * @throws IllegalArgumentException definition이 null인 경우
     * @throws ContractValidationException 정의가 유효하지 않은 경우 (저장소는 변경되지 않음)
     */
    ContractId publishGlobal(ContractDefinition definition);

    /**
     * 테넌트에 적용되는 활성 계약 조회.
     *
     * @param tenantId 테넌트 ID
     * @param name 계약 이름
     * @return 활성 계약 (테넌트 전용 우선, 없으면 전역)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ContractNotFoundException 테넌트 전용/전역 계약이 모두 없는 경우
     */
    Contract resolve(TenantId tenantId, ContractName name);

    /**
     * 특정 버전 조회 (감사용).
     *
     * @param scope 테넌트 범위
     * @param name 계약 이름
     * @param version 버전 (1부터)
     * @return 해당 버전의 계약
     * @throws IllegalArgumentException 인자가 null이거나 version이 1 미만인 경우
     * @throws ContractNotFoundException 버전이 존재하지 않는 경우
     */
    Contract resolveVersion(TenantScope scope, ContractName name, long version);

    /**
     * 게시 이력 조회 (오래된 버전부터).
     *
     * @param scope 테넌트 범위
     * @param name 계약 이름
     * @return 버전 체인 (없으면 빈 목록)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    List<Contract> history(TenantScope scope, ContractName name);

    /**
     * 저장소의 현재 논리 순번.
     *
     * @return 마지막 게시의 순번 (게시 이력이 없으면 0)
     */
    long currentSequence();
}
