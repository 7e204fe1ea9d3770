package com.ryuqq.guardrail.core.decision;

import com.ryuqq.guardrail.core.model.ContractId;

import java.util.List;
import java.util.Optional;

/**
 * 한 번의 평가 호출 결과 (Allow / Deny / Unconfigured) 와 발견된 모든 위반.
 *
 * <p>결정은 호출마다 새로 계산되고 호출자가 소유하며, 엔진이 캐시하지 않습니다.</p>
 *
 * <p><strong>결정성:</strong> evaluatedAt은 벽시계가 아닌 논리적 순번입니다
 * (평가한 계약의 저장소 게시 순번, 미설정인 경우 {@link #UNCONFIGURED_SEQUENCE}). 따라서 변경되지 않은
 * 저장소에 대해 같은 입력으로 두 번 평가하면 동등한 Decision이 반환됩니다. 미설정 결정은 다른 키나
 * 다른 테넌트의 게시에 영향을 받지 않습니다.</p>
 *
 * <pre>
 * Decision decision = gateway.evaluate(tenantId, request);
 * switch (decision.outcome()) {
 *     case ALLOW -&gt; proceed(decision.warnings());
 *     case DENY -&gt; reject(decision.violations());
 *     case UNCONFIGURED -&gt; applyHostDefault();
 * }
 * </pre>
 *
 * @param outcome 결정 결과
 * @param violations 위반 목록 (규칙 선언 순서)
 * @param evaluatedAt 논리적 평가 순번
 * @param contractId 평가한 계약 ID (UNCONFIGURED이면 null)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record Decision(
    DecisionOutcome outcome,
    List<Violation> violations,
    long evaluatedAt,
    ContractId contractId
) {

    /**
     * 미설정 결정의 evaluatedAt. 저장소 순번은 1부터 시작하므로 게시 순번과 겹치지 않습니다.
     */
    public static final long UNCONFIGURED_SEQUENCE = 0L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 결과와 필드가 일관되지 않은 경우
     */
    public Decision {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (violations == null) {
            throw new IllegalArgumentException("violations cannot be null");
        }
        if (evaluatedAt < 0) {
            throw new IllegalArgumentException("evaluatedAt must be non-negative (current: " + evaluatedAt + ")");
        }
        violations = List.copyOf(violations);

        boolean blocked = violations.stream().anyMatch(Violation::isBlocking);
        switch (outcome) {
            case ALLOW -> {
                if (blocked) {
                    throw new IllegalArgumentException("ALLOW decision cannot carry blocking violations");
                }
                requireContract(contractId, outcome);
            }
            case DENY -> {
                if (!blocked) {
                    throw new IllegalArgumentException("DENY decision requires at least one blocking violation");
                }
                requireContract(contractId, outcome);
            }
            case UNCONFIGURED -> {
                if (!violations.isEmpty() || contractId != null) {
                    throw new IllegalArgumentException("UNCONFIGURED decision cannot carry violations or a contract id");
                }
            }
        }
    }

    private static void requireContract(ContractId contractId, DecisionOutcome outcome) {
        if (contractId == null) {
            throw new IllegalArgumentException(outcome + " decision requires a contract id");
        }
    }

    /**
     * 위반 목록을 집계하여 결정 생성.
     *
     * <p>차단 위반이 하나라도 있으면 DENY, 그렇지 않으면 ALLOW입니다.</p>
     *
     * @param contractId 평가한 계약 ID
     * @param violations 위반 목록
     * @param evaluatedAt 논리적 평가 순번
     * @return Decision 인스턴스
     */
    public static Decision aggregate(ContractId contractId, List<Violation> violations, long evaluatedAt) {
        boolean blocked = violations.stream().anyMatch(Violation::isBlocking);
        return new Decision(blocked ? DecisionOutcome.DENY : DecisionOutcome.ALLOW, violations, evaluatedAt, contractId);
    }

    /**
     * 미설정 결정 생성 (evaluatedAt = {@link #UNCONFIGURED_SEQUENCE}).
     *
     * @return UNCONFIGURED Decision
     */
    public static Decision unconfigured() {
        return new Decision(DecisionOutcome.UNCONFIGURED, List.of(), UNCONFIGURED_SEQUENCE, null);
    }

    public boolean isAllowed() {
        return outcome == DecisionOutcome.ALLOW;
    }

    public boolean isDenied() {
        return outcome == DecisionOutcome.DENY;
    }

    public boolean isUnconfigured() {
        return outcome == DecisionOutcome.UNCONFIGURED;
    }

    /**
     * 호스트 정책을 적용한 최종 허용 여부.
     *
     * @param policy 미설정 테넌트 정책
     * @return ALLOW이거나, UNCONFIGURED이면서 정책이 FAIL_OPEN인 경우 true
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public boolean isPermitted(UnconfiguredPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return switch (outcome) {
            case ALLOW -> true;
            case DENY -> false;
            case UNCONFIGURED -> policy == UnconfiguredPolicy.FAIL_OPEN;
        };
    }

    /**
     * 평가한 계약 ID.
     *
     * @return 계약 ID (UNCONFIGURED이면 empty)
     */
    public Optional<ContractId> evaluatedContract() {
        return Optional.ofNullable(contractId);
    }

    /**
     * 경고(WARN) 위반만 조회.
     *
     * @return 경고 위반 목록
     */
    public List<Violation> warnings() {
        return violations.stream().filter(violation -> !violation.isBlocking()).toList();
    }

    /**
     * 차단(BLOCK) 위반만 조회.
     *
     * @return 차단 위반 목록
     */
    public List<Violation> blockers() {
        return violations.stream().filter(Violation::isBlocking).toList();
    }
}
