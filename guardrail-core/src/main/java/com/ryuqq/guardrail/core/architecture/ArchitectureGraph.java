package com.ryuqq.guardrail.core.architecture;

import com.ryuqq.guardrail.core.model.LayerId;
import com.ryuqq.guardrail.core.model.ModuleId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 모듈/레이어 선언과 레이어 간 허용 간선.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>modules: 선언된 모듈 집합</li>
 *   <li>layers: 모듈 → 레이어 매핑</li>
 *   <li>allowedEdges: 허용된 (레이어 A, 레이어 B) 의존</li>
 *   <li>hints: 금지된 간선에 대한 수정 제안 (선택)</li>
 *   <li>forbidden: 어떤 모듈도 의존할 수 없는 금지 대상 모듈 (선택, 외부 패키지 포함)</li>
 *   <li>forbiddenHints: 금지 대상별 수정 제안 ({@code forbidden::<module>} 키에 대응, 선택)</li>
 * </ul>
 *
 * <p>허용 관계는 대칭·추이적일 필요가 없습니다. 레이어 간 순환은 양방향 간선이 모두
 * 명시적으로 선언된 경우에만 허용됩니다.</p>
 *
 * <p>댕글링 레이어 참조(레이어 없는 모듈, 선언되지 않은 모듈의 매핑, 어떤 모듈에도 할당되지 않은
 * 레이어를 가리키는 간선)는 계약 게시 시점에 {@code ContractValidator}가 거부합니다.</p>
 *
 * <pre>
 * ArchitectureGraph graph = ArchitectureGraph.builder()
 *     .module("api", "web")
 *     .module("db", "data")
 *     .allow("web", "data")
 *     .hint("data", "web", "Expose data through a port owned by the web layer")
 *     .forbid("sqlalchemy")
 *     .forbiddenHint("sqlalchemy", "Use the service layer to perform DB work")
 *     .build();
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ArchitectureGraph {

    private final Set<ModuleId> modules;
    private final Map<ModuleId, LayerId> layers;
    private final Set<LayerEdge> allowedEdges;
    private final Map<LayerEdge, String> hints;
    private final Set<ModuleId> forbidden;
    private final Map<ModuleId, String> forbiddenHints;

    /**
     * 금지 대상 없이 생성.
     *
     * @param modules 모듈 집합
     * @param layers 모듈 → 레이어 매핑
     * @param allowedEdges 허용 간선
     * @param hints 금지 간선 수정 제안 (null이면 빈 맵)
     * @throws IllegalArgumentException 필수 인자가 null이거나 null 원소를 포함하는 경우
     */
    public ArchitectureGraph(Set<ModuleId> modules, Map<ModuleId, LayerId> layers,
                             Set<LayerEdge> allowedEdges, Map<LayerEdge, String> hints) {
        this(modules, layers, allowedEdges, hints, null, null);
    }

    /**
     * 생성자.
     *
     * @param modules 모듈 집합
     * @param layers 모듈 → 레이어 매핑
     * @param allowedEdges 허용 간선
     * @param hints 금지 간선 수정 제안 (null이면 빈 맵)
     * @param forbidden 금지 대상 모듈 (null이면 빈 집합)
     * @param forbiddenHints 금지 대상별 수정 제안 (null이면 빈 맵)
     * @throws IllegalArgumentException 필수 인자가 null이거나 null 원소를 포함하는 경우
     */
    public ArchitectureGraph(Set<ModuleId> modules, Map<ModuleId, LayerId> layers,
                             Set<LayerEdge> allowedEdges, Map<LayerEdge, String> hints,
                             Set<ModuleId> forbidden, Map<ModuleId, String> forbiddenHints) {
        if (modules == null || layers == null || allowedEdges == null) {
            throw new IllegalArgumentException("modules, layers and allowedEdges cannot be null");
        }
        if (modules.stream().anyMatch(Objects::isNull) || allowedEdges.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("modules and allowedEdges cannot contain null");
        }
        if (forbidden != null && forbidden.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("forbidden cannot contain null");
        }
        this.modules = Collections.unmodifiableSet(new LinkedHashSet<>(modules));
        this.layers = Collections.unmodifiableMap(copyOf(layers));
        this.allowedEdges = Collections.unmodifiableSet(new LinkedHashSet<>(allowedEdges));
        this.hints = hints == null ? Map.of() : Collections.unmodifiableMap(copyOf(hints));
        this.forbidden = forbidden == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(forbidden));
        this.forbiddenHints = forbiddenHints == null
            ? Map.of()
            : Collections.unmodifiableMap(copyOf(forbiddenHints));
    }

    private static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        Map<K, V> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("map entries cannot contain null");
            }
            copy.put(key, value);
        });
        return copy;
    }

    /**
     * 빌더 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Set<ModuleId> modules() {
        return modules;
    }

    public Map<ModuleId, LayerId> layers() {
        return layers;
    }

    public Set<LayerEdge> allowedEdges() {
        return allowedEdges;
    }

    public Map<LayerEdge, String> hints() {
        return hints;
    }

    public Set<ModuleId> forbidden() {
        return forbidden;
    }

    public Map<ModuleId, String> forbiddenHints() {
        return forbiddenHints;
    }

    /**
     * 금지 대상 모듈인지 확인.
     *
     * @param module 모듈
     * @return 금지 대상이면 true
     */
    public boolean forbids(ModuleId module) {
        return forbidden.contains(module);
    }

    /**
     * 금지 대상 모듈에 대한 수정 제안 조회.
     *
     * @param module 금지 대상 모듈
     * @return 제안 (없으면 empty)
     */
    public Optional<String> forbiddenHintFor(ModuleId module) {
        return Optional.ofNullable(forbiddenHints.get(module));
    }

    /**
     * 모듈이 속한 레이어 조회.
     *
     * @param module 모듈
     * @return 레이어 (선언되지 않은 모듈이면 empty)
     */
    public Optional<LayerId> layerOf(ModuleId module) {
        if (!modules.contains(module)) {
            return Optional.empty();
        }
        return Optional.ofNullable(layers.get(module));
    }

    /**
     * 레이어 간 의존 허용 여부.
     *
     * @param from 의존하는 쪽 레이어
     * @param to 의존받는 쪽 레이어
     * @return allowedEdges에 포함되면 true
     */
    public boolean allows(LayerId from, LayerId to) {
        return allowedEdges.contains(new LayerEdge(from, to));
    }

    /**
     * 금지 간선에 대한 수정 제안 조회.
     *
     * @param edge 레이어 간선
     * @return 제안 (없으면 empty)
     */
    public Optional<String> hintFor(LayerEdge edge) {
        return Optional.ofNullable(hints.get(edge));
    }

    /**
     * 선언된 모든 레이어 (모듈 할당 순서).
     *
     * @return 레이어 집합
     */
    public Set<LayerId> declaredLayers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(layers.values()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArchitectureGraph that = (ArchitectureGraph) o;
        return modules.equals(that.modules)
            && layers.equals(that.layers)
            && allowedEdges.equals(that.allowedEdges)
            && hints.equals(that.hints)
            && forbidden.equals(that.forbidden)
            && forbiddenHints.equals(that.forbiddenHints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modules, layers, allowedEdges, hints, forbidden, forbiddenHints);
    }

    @Override
    public String toString() {
        return "ArchitectureGraph{layers=" + layers + ", allowedEdges=" + allowedEdges
            + ", forbidden=" + forbidden + '}';
    }

    /**
     * ArchitectureGraph 빌더.
     */
    public static final class Builder {

        private final Set<ModuleId> modules = new LinkedHashSet<>();
        private final Map<ModuleId, LayerId> layers = new LinkedHashMap<>();
        private final Set<LayerEdge> allowedEdges = new LinkedHashSet<>();
        private final Map<LayerEdge, String> hints = new LinkedHashMap<>();
        private final Set<ModuleId> forbidden = new LinkedHashSet<>();
        private final Map<ModuleId, String> forbiddenHints = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 모듈을 선언하고 레이어에 할당.
         *
         * @param module 모듈
         * @param layer 레이어
         * @return this
         */
        public Builder module(String module, String layer) {
            ModuleId moduleId = ModuleId.of(module);
            modules.add(moduleId);
            layers.put(moduleId, LayerId.of(layer));
            return this;
        }

        /**
         * 레이어 없이 모듈만 선언 (게시 시점에 거부됨).
         *
         * @param module 모듈
         * @return this
         */
        public Builder declare(String module) {
            modules.add(ModuleId.of(module));
            return this;
        }

        public Builder allow(String fromLayer, String toLayer) {
            allowedEdges.add(LayerEdge.of(fromLayer, toLayer));
            return this;
        }

        public Builder hint(String fromLayer, String toLayer, String hint) {
            if (hint == null || hint.isBlank()) {
                throw new IllegalArgumentException("hint cannot be null or blank");
            }
            hints.put(LayerEdge.of(fromLayer, toLayer), hint);
            return this;
        }

        /**
         * 어떤 모듈도 의존할 수 없는 대상 모듈 추가.
         *
         * @param module 금지 대상 (선언된 모듈일 필요 없음)
         * @return this
         */
        public Builder forbid(String module) {
            forbidden.add(ModuleId.of(module));
            return this;
        }

        public Builder forbiddenHint(String module, String hint) {
            if (hint == null || hint.isBlank()) {
                throw new IllegalArgumentException("hint cannot be null or blank");
            }
            forbiddenHints.put(ModuleId.of(module), hint);
            return this;
        }

        public ArchitectureGraph build() {
            return new ArchitectureGraph(modules, layers, allowedEdges, hints, forbidden, forbiddenHints);
        }
    }
}
