package com.ryuqq.guardrail.core.architecture;

import com.ryuqq.guardrail.core.model.ModuleId;

/**
 * 모듈 간 실제 의존 (source가 target에 의존).
 *
 * <p>코드베이스 의존성 스냅샷의 한 항목이며, 일괄 검증의 입력입니다.</p>
 *
 * @param source 의존하는 모듈
 * @param target 의존받는 모듈
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record DependencyEdge(ModuleId source, ModuleId target) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException source 또는 target이 null인 경우
     */
    public DependencyEdge {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    /**
     * 문자열로 DependencyEdge 생성.
     *
     * @param source 의존하는 모듈
     * @param target 의존받는 모듈
     * @return DependencyEdge 인스턴스
     */
    public static DependencyEdge of(String source, String target) {
        return new DependencyEdge(ModuleId.of(source), ModuleId.of(target));
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
