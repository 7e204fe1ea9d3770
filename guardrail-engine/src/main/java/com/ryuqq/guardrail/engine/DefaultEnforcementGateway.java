package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.application.gateway.DependencyRequest;
import com.ryuqq.guardrail.application.gateway.EnforcementGateway;
import com.ryuqq.guardrail.application.gateway.EvaluationRequest;
import com.ryuqq.guardrail.application.gateway.GenericRequest;
import com.ryuqq.guardrail.application.gateway.TransitionRequest;
import com.ryuqq.guardrail.application.registry.ContractRegistry;
import com.ryuqq.guardrail.core.architecture.ArchitectureValidator;
import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.GenericPredicateRule;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Rule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.contract.StateTransitionRule;
import com.ryuqq.guardrail.core.decision.Decision;
import com.ryuqq.guardrail.core.decision.Violation;
import com.ryuqq.guardrail.core.exception.ContractIntegrityException;
import com.ryuqq.guardrail.core.exception.ContractNotFoundException;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.model.TenantId;
import com.ryuqq.guardrail.core.spi.GuardPredicate;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;
import com.ryuqq.guardrail.core.statemachine.StateMachineValidator;
import com.ryuqq.guardrail.core.validation.ValidationResult;
import com.ryuqq.guardrail.core.validation.ViolationCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EnforcementGateway 기본 구현체.
 *
 * <p>계약을 한 번만 조회하여 그 스냅샷으로만 평가합니다. 평가 도중 새 버전이 게시되어도
 * 이미 시작된 평가는 조회한 버전으로 끝까지 진행됩니다.</p>
 *
 * <p><strong>평가 흐름:</strong></p>
 * <pre>
 * 1. registry.resolve(tenant, request.contract())
 *    └─ ContractNotFoundException → UNCONFIGURED (evaluatedAt = 0, 다른 키의 게시와 무관)
 * 2. 요청 종류에 맞는 규칙을 선언 순서대로 모두 실행 (중단 없음)
 *    - TransitionRequest → entityType이 일치하는 StateTransitionRule
 *      (일치하는 규칙이 없으면 UNKNOWN_ENTITY)
 *    - DependencyRequest → LayerDependencyRule
 *    - GenericRequest → GenericPredicateRule
 * 3. 위반 집계: BLOCK 위반 → DENY, 그 외 → ALLOW (evaluatedAt = 계약 게시 순번)
 * </pre>
 *
 * <p><strong>스레드 안전성:</strong> 불변 필드만 가지며, 호출 간 상태를 공유하지 않습니다.
 * 평가 경로는 로그를 남기지 않습니다 (위반은 Decision으로 호출자에게 반환).</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class DefaultEnforcementGateway implements EnforcementGateway {

    /**
     * 전이 요청의 엔티티 유형을 선언한 규칙이 없을 때 위반에 기록되는 규칙 ID.
     */
    public static final RuleId ENTITY_ROUTING_RULE = RuleId.of("entity-routing");

    private final ContractRegistry registry;
    private final PredicateRegistry predicates;
    private final StateMachineValidator stateMachineValidator;
    private final ArchitectureValidator architectureValidator;

    /**
     * 기본 검증기로 생성.
     *
     * @param registry 계약 레지스트리
     * @param predicates 술어 레지스트리
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultEnforcementGateway(ContractRegistry registry, PredicateRegistry predicates) {
        this(registry, predicates, predicates == null ? null : new StateMachineValidator(predicates),
            new ArchitectureValidator());
    }

    /**
     * 생성자.
     *
     * @param registry 계약 레지스트리
     * @param predicates 술어 레지스트리
     * @param stateMachineValidator 상태 전이 검증기
     * @param architectureValidator 아키텍처 검증기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultEnforcementGateway(ContractRegistry registry,
                                     PredicateRegistry predicates,
                                     StateMachineValidator stateMachineValidator,
                                     ArchitectureValidator architectureValidator) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (predicates == null) {
            throw new IllegalArgumentException("predicates cannot be null");
        }
        if (stateMachineValidator == null) {
            throw new IllegalArgumentException("stateMachineValidator cannot be null");
        }
        if (architectureValidator == null) {
            throw new IllegalArgumentException("architectureValidator cannot be null");
        }
        this.registry = registry;
        this.predicates = predicates;
        this.stateMachineValidator = stateMachineValidator;
        this.architectureValidator = architectureValidator;
    }

    @Override
    public Decision evaluate(TenantId tenantId, EvaluationRequest request) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        Contract contract;
        try {
            contract = registry.resolve(tenantId, request.contract());
        } catch (ContractNotFoundException e) {
            return Decision.unconfigured();
        }

        List<Violation> violations;
        if (request instanceof TransitionRequest transition) {
            violations = evaluateTransition(contract, transition);
        } else if (request instanceof DependencyRequest dependency) {
            violations = evaluateDependency(contract, dependency);
        } else if (request instanceof GenericRequest generic) {
            violations = evaluateGeneric(contract, generic);
        } else {
            throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getName());
        }
        return Decision.aggregate(contract.id(), violations, contract.sequence());
    }

    private List<Violation> evaluateTransition(Contract contract, TransitionRequest request) {
        List<Violation> violations = new ArrayList<>();
        boolean matched = false;
        for (Rule rule : contract.rules()) {
            if (rule instanceof StateTransitionRule stateRule && stateRule.entityType().equals(request.entityType())) {
                matched = true;
                ValidationResult result = stateMachineValidator.validateTransition(
                    stateRule.machine(), request.from(), request.to(), request.guardContext());
                if (result instanceof ValidationResult.Invalid invalid) {
                    violations.add(Violation.of(rule.ruleId(), rule.severity(), withEntity(request, invalid)));
                }
            }
        }
        if (!matched) {
            Map<String, String> context = entityContext(request);
            violations.add(Violation.of(ENTITY_ROUTING_RULE, Severity.BLOCK, new ValidationResult.Invalid(
                ViolationCode.UNKNOWN_ENTITY,
                "Contract " + contract.id() + " declares no state machine for entity type '"
                    + request.entityType() + "'",
                context
            )));
        }
        return violations;
    }

    private List<Violation> evaluateDependency(Contract contract, DependencyRequest request) {
        List<Violation> violations = new ArrayList<>();
        for (Rule rule : contract.rules()) {
            if (rule instanceof LayerDependencyRule layerRule) {
                ValidationResult result = architectureValidator.validateDependency(
                    layerRule.graph(), request.source(), request.target());
                if (result instanceof ValidationResult.Invalid invalid) {
                    violations.add(Violation.of(rule, invalid));
                }
            }
        }
        return violations;
    }

    private List<Violation> evaluateGeneric(Contract contract, GenericRequest request) {
        List<Violation> violations = new ArrayList<>();
        for (Rule rule : contract.rules()) {
            if (rule instanceof GenericPredicateRule predicateRule) {
                ValidationResult result = testPredicate(contract, predicateRule, request);
                if (result instanceof ValidationResult.Invalid invalid) {
                    violations.add(Violation.of(rule, invalid));
                }
            }
        }
        return violations;
    }

    private ValidationResult testPredicate(Contract contract, GenericPredicateRule rule, GenericRequest request) {
        GuardPredicate predicate = predicates.find(rule.predicate())
            .orElseThrow(() -> new ContractIntegrityException(
                "Predicate '" + rule.predicate() + "' of rule " + rule.ruleId() + " in contract "
                    + contract.id() + " is no longer registered"));

        Map<String, String> context = new LinkedHashMap<>();
        context.put("predicate", rule.predicate().getValue());
        try {
            if (predicate.test(request.predicateInput())) {
                return ValidationResult.valid();
            }
        } catch (RuntimeException e) {
            context.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            return ValidationResult.invalid(
                ViolationCode.PREDICATE_REJECTED,
                "Predicate '" + rule.predicate() + "' failed: " + rule.description(),
                context
            );
        }
        return ValidationResult.invalid(
            ViolationCode.PREDICATE_REJECTED,
            "Predicate '" + rule.predicate() + "' rejected the request: " + rule.description(),
            context
        );
    }

    private static ValidationResult.Invalid withEntity(TransitionRequest request, ValidationResult.Invalid invalid) {
        Map<String, String> context = entityContext(request);
        context.putAll(invalid.context());
        return new ValidationResult.Invalid(invalid.code(), invalid.message(), context);
    }

    private static Map<String, String> entityContext(TransitionRequest request) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("entityType", request.entityType().getValue());
        context.put("entityId", request.entityId());
        context.put("from", request.from().getValue());
        context.put("to", request.to().getValue());
        return context;
    }
}
