package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.application.registry.ContractRegistry;
import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.contract.ContractValidator;
import com.ryuqq.guardrail.core.exception.ContractNotFoundException;
import com.ryuqq.guardrail.core.exception.ContractValidationException;
import com.ryuqq.guardrail.core.model.ContractId;
import com.ryuqq.guardrail.core.model.ContractKey;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.TenantId;
import com.ryuqq.guardrail.core.model.TenantScope;
import com.ryuqq.guardrail.core.spi.ContractStore;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * ContractRegistry 기본 구현체.
 *
 * <p>게시 시점에 {@link ContractValidator}로 정의 전체를 검증한 뒤, 통과한 정의만
 * {@link ContractStore}에 새 버전으로 추가합니다.</p>
 *
 * <p><strong>게시 흐름:</strong></p>
 * <pre>
 * 1. ContractValidator.validate(key, definition) → 문제 목록 수집
 *    └─ 문제가 있으면 ContractValidationException (저장소 변경 없음, WARN 로그)
 * 2. store.append(scope, definition) → 새 버전 활성화 (원자적 교체)
 * 3. INFO 로그: key, version, sequence
 * </pre>
 *
 * <p><strong>조회 흐름:</strong></p>
 * <pre>
 * 1. (tenant, name) 활성 버전 조회
 * 2. 없으면 (global, name) 활성 버전 조회
 * 3. 둘 다 없으면 ContractNotFoundException
 * </pre>
 *
 * <p>조회 경로는 로그를 남기지 않습니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class DefaultContractRegistry implements ContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultContractRegistry.class);
    private final ContractStore store;
    private final ContractValidator validator;

    /**
     * 생성자.
     *
     * @param store 계약 저장소
     * @param predicates 술어 레지스트리 (Guard/술어 이름 검증용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultContractRegistry(ContractStore store, PredicateRegistry predicates) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (predicates == null) {
            throw new IllegalArgumentException("predicates cannot be null");
        }
        this.store = store;
        this.validator = new ContractValidator(predicates);
    }

    @Override
    public ContractId publish(TenantId tenantId, ContractDefinition definition) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        return publish(TenantScope.of(tenantId), definition);
    }

    @Override
    public ContractId publishGlobal(ContractDefinition definition) {
        return publish(TenantScope.global(), definition);
    }

    private ContractId publish(TenantScope scope, ContractDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        ContractKey key = ContractKey.of(scope, definition.name());
        try {
            validator.validate(key, definition);
        } catch (ContractValidationException e) {
            log.warn("Rejected contract {}: {}", key, e.getProblems());
            throw e;
        }

        Contract published = store.append(scope, definition);
        log.info("Published contract {} (rules={}, sequence={})",
            published.id(), published.rules().size(), published.sequence());
        return published.id();
    }

    @Override
    public Contract resolve(TenantId tenantId, ContractName name) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        TenantScope scope = TenantScope.of(tenantId);
        Optional<Contract> tenantContract = store.findActive(ContractKey.of(scope, name));
        if (tenantContract.isPresent()) {
            return tenantContract.get();
        }
        return store.findActive(ContractKey.of(TenantScope.global(), name))
            .orElseThrow(() -> new ContractNotFoundException(scope, name));
    }

    @Override
    public Contract resolveVersion(TenantScope scope, ContractName name, long version) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        return store.findVersion(ContractKey.of(scope, name), version)
            .orElseThrow(() -> new ContractNotFoundException(scope, name, version));
    }

    @Override
    public List<Contract> history(TenantScope scope, ContractName name) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return store.history(ContractKey.of(scope, name));
    }

    @Override
    public long currentSequence() {
        return store.currentSequence();
    }
}
