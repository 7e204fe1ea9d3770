package com.ryuqq.guardrail.core.exception;

import com.ryuqq.guardrail.core.model.ContractKey;

import java.util.List;

/**
 * 계약 게시 시점의 검증 실패 (ValidationError).
 *
 * <p>상태 머신 또는 아키텍처 그래프가 구조적 불변식을 위반하거나, 알 수 없는 술어 이름을
 * 참조하는 경우 발생합니다. 발견된 모든 문제를 한 번에 담으며, 이 예외가 발생한 게시 호출은
 * 계약 저장소를 변경하지 않습니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class ContractValidationException extends RuntimeException {

    private final ContractKey key;
    private final List<String> problems;

    /**
     * 생성자.
     *
     * @param key 게시하려던 계약 키
     * @param problems 발견된 문제 목록 (1개 이상)
     * @throws IllegalArgumentException problems가 null이거나 비어 있는 경우
     */
    public ContractValidationException(ContractKey key, List<String> problems) {
        super(buildMessage(key, problems));
        this.key = key;
        this.problems = List.copyOf(problems);
    }

    private static String buildMessage(ContractKey key, List<String> problems) {
        if (problems == null || problems.isEmpty()) {
            throw new IllegalArgumentException("problems cannot be null or empty");
        }
        return String.format("Contract %s rejected with %d problem(s): %s", key, problems.size(), String.join("; ", problems));
    }

    /**
     * 게시하려던 계약 키.
     *
     * @return 계약 키
     */
    public ContractKey getKey() {
        return key;
    }

    /**
     * 발견된 문제 목록.
     *
     * @return 불변 문제 목록 (발견 순서)
     */
    public List<String> getProblems() {
        return problems;
    }
}
