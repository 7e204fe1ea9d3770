package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.architecture.ArchitectureGraph;
import com.ryuqq.guardrail.core.architecture.LayerEdge;
import com.ryuqq.guardrail.core.exception.ContractValidationException;
import com.ryuqq.guardrail.core.model.ContractKey;
import com.ryuqq.guardrail.core.model.LayerId;
import com.ryuqq.guardrail.core.model.ModuleId;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.model.StateId;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;
import com.ryuqq.guardrail.core.statemachine.StateMachine;
import com.ryuqq.guardrail.core.statemachine.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 계약 게시 시점 검증.
 *
 * <p>평가 시점이 아닌 게시 시점에 모든 구조적 불변식을 즉시 검증합니다.
 * 첫 번째 문제에서 멈추지 않고 발견된 모든 문제를 수집하여 한 번에 보고합니다.</p>
 *
 * <p><strong>상태 머신 검사:</strong></p>
 * <ul>
 *   <li>initial ∈ states, terminal ⊆ states</li>
 *   <li>모든 전이의 from/to ∈ states</li>
 *   <li>중복 (from, to) 전이 없음</li>
 *   <li>종료 상태에서 나가는 전이 없음</li>
 *   <li>모든 상태가 initial에서 도달 가능</li>
 *   <li>guard 이름이 술어 레지스트리에 존재</li>
 * </ul>
 *
 * <p><strong>아키텍처 그래프 검사:</strong></p>
 * <ul>
 *   <li>모든 모듈이 레이어를 가짐</li>
 *   <li>레이어 매핑 키는 선언된 모듈</li>
 *   <li>허용 간선과 힌트가 참조하는 레이어는 어떤 모듈에 할당되어 있음</li>
 *   <li>금지 대상 힌트는 금지 대상으로 선언된 모듈만 참조</li>
 * </ul>
 *
 * <p><strong>계약 수준 검사:</strong> 규칙 ID 중복 없음, 일반 술어 이름 존재.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ContractValidator {

    private final PredicateRegistry predicates;

    /**
     * 생성자.
     *
     * @param predicates guard/술어 이름 해석에 사용할 레지스트리
     * @throws IllegalArgumentException predicates가 null인 경우
     */
    public ContractValidator(PredicateRegistry predicates) {
        if (predicates == null) {
            throw new IllegalArgumentException("predicates cannot be null");
        }
        this.predicates = predicates;
    }

    /**
     * 계약 정의 검증.
     *
     * @param key 게시 대상 키 (오류 메시지용)
     * @param definition 계약 정의
     * @throws ContractValidationException 하나 이상의 문제가 발견된 경우
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public void validate(ContractKey key, ContractDefinition definition) {
        List<String> problems = inspect(definition);
        if (!problems.isEmpty()) {
            throw new ContractValidationException(key, problems);
        }
    }

    /**
     * 계약 정의의 모든 문제를 수집.
     *
     * @param definition 계약 정의
     * @return 문제 목록 (문제가 없으면 빈 목록)
     * @throws IllegalArgumentException definition이 null인 경우
     */
    public List<String> inspect(ContractDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }

        List<String> problems = new ArrayList<>();
        Set<RuleId> seenRuleIds = new HashSet<>();

        for (Rule rule : definition.rules()) {
            if (!seenRuleIds.add(rule.ruleId())) {
                problems.add("duplicate rule id '" + rule.ruleId() + "'");
            }
            if (rule instanceof StateTransitionRule transitionRule) {
                inspectMachine(transitionRule.ruleId(), transitionRule.machine(), problems);
            } else if (rule instanceof LayerDependencyRule layerRule) {
                inspectGraph(layerRule.ruleId(), layerRule.graph(), problems);
            } else if (rule instanceof GenericPredicateRule predicateRule) {
                requirePredicate(predicateRule.ruleId(), predicateRule.predicate(), "predicate", problems);
            }
        }
        return problems;
    }

    private void inspectMachine(RuleId ruleId, StateMachine machine, List<String> problems) {
        Set<StateId> states = machine.states();

        if (!states.contains(machine.initial())) {
            problems.add(ruleId + ": initial state '" + machine.initial() + "' is not declared");
        }
        for (StateId terminal : machine.terminal()) {
            if (!states.contains(terminal)) {
                problems.add(ruleId + ": terminal state '" + terminal + "' is not declared");
            }
        }

        Set<String> seenEdges = new HashSet<>();
        for (Transition transition : machine.transitions()) {
            if (!states.contains(transition.from())) {
                problems.add(ruleId + ": transition " + transition + " starts from undeclared state '" + transition.from() + "'");
            }
            if (!states.contains(transition.to())) {
                problems.add(ruleId + ": transition " + transition + " targets undeclared state '" + transition.to() + "'");
            }
            if (!seenEdges.add(transition.from() + "\u0000" + transition.to())) {
                problems.add(ruleId + ": duplicate transition " + transition.from() + " -> " + transition.to());
            }
            if (machine.isTerminal(transition.from())) {
                problems.add(ruleId + ": terminal state '" + transition.from() + "' has outgoing transition " + transition);
            }
            if (transition.guard() != null) {
                requirePredicate(ruleId, transition.guard(), "guard of " + transition.from() + " -> " + transition.to(), problems);
            }
        }

        if (states.contains(machine.initial())) {
            Set<StateId> reachable = reachableFrom(machine);
            for (StateId state : states) {
                if (!reachable.contains(state)) {
                    problems.add(ruleId + ": state '" + state + "' is unreachable from initial state '" + machine.initial() + "'");
                }
            }
        }
    }

    private static Set<StateId> reachableFrom(StateMachine machine) {
        Set<StateId> visited = new LinkedHashSet<>();
        Deque<StateId> queue = new ArrayDeque<>();
        visited.add(machine.initial());
        queue.add(machine.initial());
        while (!queue.isEmpty()) {
            StateId current = queue.poll();
            for (Transition transition : machine.outgoing(current)) {
                if (machine.declares(transition.to()) && visited.add(transition.to())) {
                    queue.add(transition.to());
                }
            }
        }
        return visited;
    }

    private void inspectGraph(RuleId ruleId, ArchitectureGraph graph, List<String> problems) {
        for (ModuleId module : graph.modules()) {
            if (!graph.layers().containsKey(module)) {
                problems.add(ruleId + ": module '" + module + "' has no layer");
            }
        }
        for (ModuleId module : graph.layers().keySet()) {
            if (!graph.modules().contains(module)) {
                problems.add(ruleId + ": layer mapping references undeclared module '" + module + "'");
            }
        }

        Set<LayerId> assigned = graph.declaredLayers();
        for (LayerEdge edge : graph.allowedEdges()) {
            requireLayer(ruleId, edge.from(), "allowed edge " + edge, assigned, problems);
            requireLayer(ruleId, edge.to(), "allowed edge " + edge, assigned, problems);
        }
        for (LayerEdge edge : graph.hints().keySet()) {
            requireLayer(ruleId, edge.from(), "hint " + edge, assigned, problems);
            requireLayer(ruleId, edge.to(), "hint " + edge, assigned, problems);
        }
        for (ModuleId module : graph.forbiddenHints().keySet()) {
            if (!graph.forbids(module)) {
                problems.add(ruleId + ": hint for '" + module + "' references a module that is not forbidden");
            }
        }
    }

    private static void requireLayer(RuleId ruleId, LayerId layer, String where, Set<LayerId> assigned, List<String> problems) {
        if (!assigned.contains(layer)) {
            problems.add(ruleId + ": " + where + " references layer '" + layer + "' that no module belongs to");
        }
    }

    private void requirePredicate(RuleId ruleId, PredicateName name, String where, List<String> problems) {
        if (!predicates.contains(name)) {
            problems.add(ruleId + ": " + where + " references unknown predicate '" + name + "'");
        }
    }
}
