package com.ryuqq.guardrail.core.architecture;

import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.decision.Violation;
import com.ryuqq.guardrail.core.model.LayerId;
import com.ryuqq.guardrail.core.model.ModuleId;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.validation.ValidationResult;
import com.ryuqq.guardrail.core.validation.ViolationCode;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * 레이어 의존 규칙 검증기.
 *
 * <p>모듈 간 의존 (source → target)이 두 모듈이 속한 레이어의 허용 간선에 포함되는지 판단합니다.
 * 허용 관계의 대칭이나 추이 폐포를 추론하지 않습니다.</p>
 *
 * <p><strong>단일 검증:</strong></p>
 * <ol>
 *   <li>source가 선언되지 않음 → UNKNOWN_MODULE</li>
 *   <li>target이 금지 대상 → FORBIDDEN_DEPENDENCY (target은 선언되지 않은 외부 패키지일 수 있음)</li>
 *   <li>target이 선언되지 않음 → UNKNOWN_MODULE</li>
 *   <li>source == target → Valid (선언된 모듈의 자기 의존)</li>
 *   <li>(layer(source), layer(target)) ∉ allowedEdges → FORBIDDEN_LAYER_EDGE</li>
 * </ol>
 *
 * <p><strong>일괄 검증:</strong> {@link #validateAll}은 지연 평가되는 재시작 가능한
 * {@link Iterable}을 반환합니다. 중단 없이 모든 간선을 검사하며, 입력에서 처음 등장한 순서로
 * 위반을 보고하고, 같은 위반 간선이 반복되면 한 번만 보고합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ArchitectureValidator {

    /**
     * 규칙 없이 그래프만으로 일괄 검증할 때 사용하는 규칙 ID.
     */
    public static final RuleId DEFAULT_RULE_ID = RuleId.of("architecture");

    /**
     * 금지 대상 위반의 {@code forbidden} 컨텍스트 값과 문서의 힌트 키에 쓰이는 접두어.
     */
    public static final String FORBIDDEN_PREFIX = "forbidden::";

    /**
     * 단일 의존 검증.
     *
     * @param graph 아키텍처 그래프
     * @param source 의존하는 모듈
     * @param target 의존받는 모듈
     * @return 검증 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ValidationResult validateDependency(ArchitectureGraph graph, ModuleId source, ModuleId target) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (source == null || target == null) {
            throw new IllegalArgumentException("source and target cannot be null");
        }

        Optional<LayerId> sourceLayer = graph.layerOf(source);
        if (sourceLayer.isEmpty()) {
            return unknownModule(source, target, source);
        }
        if (graph.forbids(target)) {
            Map<String, String> context = new LinkedHashMap<>();
            context.put("source", source.getValue());
            context.put("target", target.getValue());
            context.put("forbidden", FORBIDDEN_PREFIX + target.getValue());
            graph.forbiddenHintFor(target).ifPresent(hint -> context.put("hint", hint));
            return ValidationResult.invalid(
                ViolationCode.FORBIDDEN_DEPENDENCY,
                "Module '" + source + "' must not depend on forbidden module '" + target + "'",
                context
            );
        }
        Optional<LayerId> targetLayer = graph.layerOf(target);
        if (targetLayer.isEmpty()) {
            return unknownModule(source, target, target);
        }
        if (source.equals(target)) {
            return ValidationResult.valid();
        }

        LayerId from = sourceLayer.get();
        LayerId to = targetLayer.get();
        if (graph.allows(from, to)) {
            return ValidationResult.valid();
        }

        LayerEdge edge = new LayerEdge(from, to);
        Map<String, String> context = new LinkedHashMap<>();
        context.put("source", source.getValue());
        context.put("target", target.getValue());
        context.put("sourceLayer", from.getValue());
        context.put("targetLayer", to.getValue());
        graph.hintFor(edge).ifPresent(hint -> context.put("hint", hint));
        return ValidationResult.invalid(
            ViolationCode.FORBIDDEN_LAYER_EDGE,
            "Module '" + source + "' (" + from + ") must not depend on '" + target + "' (" + to + ")",
            context
        );
    }

    private static ValidationResult unknownModule(ModuleId source, ModuleId target, ModuleId unknown) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("source", source.getValue());
        context.put("target", target.getValue());
        context.put("module", unknown.getValue());
        return ValidationResult.invalid(
            ViolationCode.UNKNOWN_MODULE,
            "Module '" + unknown + "' is not declared by the architecture graph",
            context
        );
    }

    /**
     * 의존 스냅샷 일괄 검증 (기본 규칙 ID, BLOCK).
     *
     * @param graph 아키텍처 그래프
     * @param edges 의존 스냅샷
     * @return 지연 평가되는 위반 시퀀스
     */
    public Iterable<Violation> validateAll(ArchitectureGraph graph, Iterable<DependencyEdge> edges) {
        return validateAll(DEFAULT_RULE_ID, Severity.BLOCK, graph, edges);
    }

    /**
     * 규칙에 결합된 의존 스냅샷 일괄 검증.
     *
     * @param rule 레이어 의존 규칙
     * @param edges 의존 스냅샷
     * @return 지연 평가되는 위반 시퀀스 (규칙 ID와 심각도가 결합됨)
     */
    public Iterable<Violation> validateAll(LayerDependencyRule rule, Iterable<DependencyEdge> edges) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        return validateAll(rule.ruleId(), rule.severity(), rule.graph(), edges);
    }

    private Iterable<Violation> validateAll(RuleId ruleId, Severity severity,
                                            ArchitectureGraph graph, Iterable<DependencyEdge> edges) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (edges == null) {
            throw new IllegalArgumentException("edges cannot be null");
        }
        return () -> new ViolationIterator(ruleId, severity, graph, edges.iterator());
    }

    /**
     * 입력 간선을 하나씩 검사하는 반복자. iterator() 호출마다 새로 생성되므로 재시작 가능합니다.
     */
    private final class ViolationIterator implements Iterator<Violation> {

        private final RuleId ruleId;
        private final Severity severity;
        private final ArchitectureGraph graph;
        private final Iterator<DependencyEdge> edges;
        private final Set<DependencyEdge> reported = new HashSet<>();
        private Violation next;

        private ViolationIterator(RuleId ruleId, Severity severity,
                                  ArchitectureGraph graph, Iterator<DependencyEdge> edges) {
            this.ruleId = ruleId;
            this.severity = severity;
            this.graph = graph;
            this.edges = edges;
        }

        @Override
        public boolean hasNext() {
            while (next == null && edges.hasNext()) {
                DependencyEdge edge = edges.next();
                if (edge == null) {
                    throw new IllegalArgumentException("edges cannot contain null");
                }
                if (reported.contains(edge)) {
                    continue;
                }
                ValidationResult result = validateDependency(graph, edge.source(), edge.target());
                if (result instanceof ValidationResult.Invalid invalid) {
                    reported.add(edge);
                    next = Violation.of(ruleId, severity, invalid);
                }
            }
            return next != null;
        }

        @Override
        public Violation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Violation current = next;
            next = null;
            return current;
        }
    }
}
