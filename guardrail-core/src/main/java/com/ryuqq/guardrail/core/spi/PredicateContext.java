package com.ryuqq.guardrail.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Guard 및 일반 술어에 전달되는 불변 입력 컨텍스트.
 *
 * <p>호스트가 요청마다 구성하는 키/값 묶음입니다 (예: 환불 가능 기간, 금액, 호출자 역할).
 * 엔진은 값을 해석하지 않고 술어 함수에 그대로 전달합니다.</p>
 *
 * <pre>
 * PredicateContext context = PredicateContext.of(Map.of("amount", 120, "currency", "USD"));
 * Optional&lt;Integer&gt; amount = context.get("amount", Integer.class);
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class PredicateContext {

    private static final PredicateContext EMPTY = new PredicateContext(Map.of());

    private final Map<String, Object> values;

    private PredicateContext(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * 컨텍스트 생성.
     *
     * @param values 키/값 (null 키 불가, null 값은 무시)
     * @return PredicateContext 인스턴스
     * @throws IllegalArgumentException values가 null이거나 null 키를 포함하는 경우
     */
    public static PredicateContext of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("context keys cannot be null");
            }
            if (entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new PredicateContext(Collections.unmodifiableMap(copy));
    }

    /**
     * 빈 컨텍스트.
     *
     * @return 빈 PredicateContext (싱글톤)
     */
    public static PredicateContext empty() {
        return EMPTY;
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 타입을 지정한 값 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 값 (없거나 타입이 다르면 empty)
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 전체 값 (불변).
     *
     * @return 키/값 맵
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((PredicateContext) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "PredicateContext" + values;
    }
}
