package com.ryuqq.guardrail.core.statemachine;

import com.ryuqq.guardrail.core.exception.ContractIntegrityException;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.StateId;
import com.ryuqq.guardrail.core.spi.GuardPredicate;
import com.ryuqq.guardrail.core.spi.PredicateContext;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;
import com.ryuqq.guardrail.core.validation.ValidationResult;
import com.ryuqq.guardrail.core.validation.ViolationCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 상태 전이 합법성 검증기.
 *
 * <p>요청된 전이 (from → to)가 상태 머신에서 허용되는지 판단합니다.
 * 전이를 실제로 수행하지 않으며, 상태를 보관하지 않는 순수 검증기입니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>from 또는 to가 선언되지 않음 → UNKNOWN_STATE (둘 다 선언되지 않으면 두 상태 모두 보고)</li>
 *   <li>(from, to) 간선 없음 → ILLEGAL_TRANSITION (종료 상태에서 출발하는 경우 포함)</li>
 *   <li>Guard가 false를 반환하거나 예외 발생 → GUARD_REJECTED</li>
 *   <li>그 외 → Valid</li>
 * </ol>
 *
 * <p><strong>스레드 안전성:</strong> 불변 필드만 가지므로 여러 스레드에서 공유할 수 있습니다.
 * Guard 술어 역시 순수 함수여야 합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class StateMachineValidator {

    private final PredicateRegistry predicateRegistry;

    /**
     * 생성자.
     *
     * @param predicateRegistry Guard 이름을 해석할 레지스트리
     * @throws IllegalArgumentException predicateRegistry가 null인 경우
     */
    public StateMachineValidator(PredicateRegistry predicateRegistry) {
        if (predicateRegistry == null) {
            throw new IllegalArgumentException("predicateRegistry cannot be null");
        }
        this.predicateRegistry = predicateRegistry;
    }

    /**
     * 단일 전이 검증.
     *
     * @param machine 상태 머신
     * @param from 현재 상태
     * @param to 목표 상태
     * @param guardContext Guard에 전달할 컨텍스트
     * @return 검증 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ContractIntegrityException Guard 이름이 레지스트리에서 사라진 경우
     */
    public ValidationResult validateTransition(StateMachine machine, StateId from, StateId to,
                                               PredicateContext guardContext) {
        requireNonNull(machine, "machine");
        requireNonNull(from, "from");
        requireNonNull(to, "to");
        requireNonNull(guardContext, "guardContext");

        if (!machine.declares(from) || !machine.declares(to)) {
            return unknownState(machine, from, to);
        }

        Transition transition = machine.findTransition(from, to).orElse(null);
        if (transition == null) {
            String reason = machine.isTerminal(from)
                ? "'" + from + "' is a terminal state"
                : "allowed targets from '" + from + "' are " + allowedTargets(machine, from);
            return ValidationResult.invalid(
                ViolationCode.ILLEGAL_TRANSITION,
                "Transition " + from + " -> " + to + " is not allowed (" + reason + ")",
                context(from, to, "allowed", allowedTargets(machine, from).toString())
            );
        }

        if (transition.guard() == null) {
            return ValidationResult.valid();
        }
        return evaluateGuard(transition, guardContext);
    }

    /**
     * 상태 경로 전체 검증.
     *
     * <p>연속된 두 상태씩 {@link #validateTransition}을 적용하여 첫 번째 실패를 반환합니다.
     * 경로 길이가 1 이하이면 전이가 없으므로 선언된 상태인지만 확인합니다.</p>
     *
     * @param machine 상태 머신
     * @param path 방문할 상태 순서
     * @param guardContext Guard에 전달할 컨텍스트
     * @return 첫 번째 실패 또는 Valid
     */
    public ValidationResult validatePath(StateMachine machine, List<StateId> path, PredicateContext guardContext) {
        requireNonNull(machine, "machine");
        requireNonNull(path, "path");
        requireNonNull(guardContext, "guardContext");

        if (path.size() == 1 && !machine.declares(path.get(0))) {
            StateId state = path.get(0);
            Map<String, String> context = new LinkedHashMap<>();
            context.put("state", state.getValue());
            return ValidationResult.invalid(
                ViolationCode.UNKNOWN_STATE,
                "State '" + state + "' is not declared by the state machine",
                context
            );
        }
        for (int i = 1; i < path.size(); i++) {
            ValidationResult result = validateTransition(machine, path.get(i - 1), path.get(i), guardContext);
            if (result instanceof ValidationResult.Invalid invalid) {
                Map<String, String> context = new LinkedHashMap<>(invalid.context());
                context.put("step", String.valueOf(i));
                return ValidationResult.invalid(invalid.code(), invalid.message(), context);
            }
        }
        return ValidationResult.valid();
    }

    /**
     * 주어진 상태에서 이동 가능한 상태 목록 (선언 순서).
     *
     * <p>Guard는 평가하지 않습니다.</p>
     *
     * @param machine 상태 머신
     * @param from 출발 상태
     * @return 후속 상태 목록 (종료 상태나 미선언 상태이면 빈 목록)
     */
    public List<StateId> allowedTargets(StateMachine machine, StateId from) {
        requireNonNull(machine, "machine");
        requireNonNull(from, "from");
        List<StateId> targets = new ArrayList<>();
        for (Transition transition : machine.outgoing(from)) {
            targets.add(transition.to());
        }
        return List.copyOf(targets);
    }

    private ValidationResult evaluateGuard(Transition transition, PredicateContext guardContext) {
        PredicateName guardName = transition.guard();
        GuardPredicate guard = predicateRegistry.find(guardName)
            .orElseThrow(() -> new ContractIntegrityException(
                "Guard '" + guardName + "' of transition " + transition.from() + " -> " + transition.to()
                    + " is no longer registered"));

        Map<String, String> context = context(transition.from(), transition.to(), "guard", guardName.getValue());
        try {
            if (guard.test(guardContext)) {
                return ValidationResult.valid();
            }
        } catch (RuntimeException e) {
            context.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            return ValidationResult.invalid(
                ViolationCode.GUARD_REJECTED,
                "Guard '" + guardName + "' failed for transition " + transition.from() + " -> " + transition.to(),
                context
            );
        }
        return ValidationResult.invalid(
            ViolationCode.GUARD_REJECTED,
            "Guard '" + guardName + "' rejected transition " + transition.from() + " -> " + transition.to(),
            context
        );
    }

    private static ValidationResult unknownState(StateMachine machine, StateId from, StateId to) {
        if (machine.declares(from) || machine.declares(to) || from.equals(to)) {
            StateId unknown = machine.declares(from) ? to : from;
            return ValidationResult.invalid(
                ViolationCode.UNKNOWN_STATE,
                "State '" + unknown + "' is not declared by the state machine",
                context(from, to, "state", unknown.getValue())
            );
        }
        Map<String, String> context = context(from, to, "state", from.getValue());
        context.put("states", from + "," + to);
        return ValidationResult.invalid(
            ViolationCode.UNKNOWN_STATE,
            "States '" + from + "' and '" + to + "' are not declared by the state machine",
            context
        );
    }

    private static Map<String, String> context(StateId from, StateId to, String key, String value) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("from", from.getValue());
        context.put("to", to.getValue());
        context.put(key, value);
        return context;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
