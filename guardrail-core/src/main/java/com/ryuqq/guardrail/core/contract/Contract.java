package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.ContractId;
import com.ryuqq.guardrail.core.model.ContractKey;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.TenantScope;

import java.util.List;

/**
 * 게시된 불변 계약.
 *
 * <p>게시 후에는 절대 변경되지 않습니다. 같은 (테넌트 범위, 이름)에 새 버전이 게시되면
 * 활성 포인터만 원자적으로 교체되고, 이 인스턴스는 감사용으로 계속 조회 가능합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> (범위, 이름, 버전)</li>
 *   <li><strong>rules:</strong> 선언 순서의 규칙 목록</li>
 *   <li><strong>sequence:</strong> 저장소 전역의 논리적 게시 순번 (결정의 evaluatedAt으로 사용)</li>
 * </ul>
 *
 * @param id 계약 ID
 * @param rules 규칙 목록
 * @param sequence 저장소 전역 게시 순번 (1 이상)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record Contract(ContractId id, List<Rule> rules, long sequence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 rules가 null이거나 sequence가 1 미만인 경우
     */
    public Contract {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        rules = List.copyOf(rules);
    }

    /**
     * 정의로부터 게시된 계약 생성.
     *
     * @param scope 테넌트 범위
     * @param definition 계약 정의
     * @param version 키 내부 버전
     * @param sequence 저장소 전역 게시 순번
     * @return Contract 인스턴스
     */
    public static Contract publish(TenantScope scope, ContractDefinition definition, long version, long sequence) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        ContractId id = ContractId.of(ContractKey.of(scope, definition.name()), version);
        return new Contract(id, definition.rules(), sequence);
    }

    public ContractKey key() {
        return id.key();
    }

    public TenantScope tenantScope() {
        return id.key().scope();
    }

    public ContractName name() {
        return id.key().name();
    }

    public long version() {
        return id.version();
    }

    /**
     * 게시 전 정의로 되돌린 뷰 (라운드트립 비교용).
     *
     * @return ContractDefinition
     */
    public ContractDefinition definition() {
        return new ContractDefinition(name(), rules);
    }
}
