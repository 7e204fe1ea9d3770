package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.ContractName;

import java.util.List;

/**
 * 게시 전의 계약 본문 (이름 + 순서 있는 규칙 목록).
 *
 * <p>호스트가 구성하거나 계약 문서에서 역직렬화하여 {@code publish}에 전달합니다.
 * 버전과 테넌트 범위는 게시 시점에 결정됩니다.</p>
 *
 * @param name 계약 이름
 * @param rules 규칙 목록 (선언 순서 = 평가 순서)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record ContractDefinition(ContractName name, List<Rule> rules) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 rules가 null이거나 rules에 null이 포함된 경우
     */
    public ContractDefinition {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        for (Rule rule : rules) {
            if (rule == null) {
                throw new IllegalArgumentException("rules cannot contain null");
            }
        }
        rules = List.copyOf(rules);
    }

    /**
     * ContractDefinition 생성.
     *
     * @param name 계약 이름
     * @param rules 규칙
     * @return ContractDefinition 인스턴스
     */
    public static ContractDefinition of(String name, Rule... rules) {
        return new ContractDefinition(ContractName.of(name), List.of(rules));
    }
}
