package com.ryuqq.guardrail.core.spi;

/**
 * 이름으로 등록되는 순수 술어 함수.
 *
 * <p>상태 전이 guard와 일반 술어 규칙({@code GenericPredicateRule})이 모두 이 인터페이스로
 * 평가됩니다. 구현은 부수 효과가 없어야 하며, 여러 스레드에서 동시에 호출될 수 있습니다.</p>
 *
 * <pre>
 * GuardPredicate refundWindowOpen = context -&gt;
 *     context.get("daysSincePayment", Integer.class).map(days -&gt; days &lt;= 30).orElse(false);
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GuardPredicate {

    /**
     * 술어 평가.
     *
     * @param context 호스트가 제공한 입력 컨텍스트
     * @return 허용이면 true
     */
    boolean test(PredicateContext context);
}
