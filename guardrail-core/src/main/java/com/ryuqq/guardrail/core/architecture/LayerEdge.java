package com.ryuqq.guardrail.core.architecture;

import com.ryuqq.guardrail.core.model.LayerId;

/**
 * 레이어 간 허용 간선: "from 레이어의 모듈은 to 레이어의 모듈에 의존할 수 있다".
 *
 * <p>방향이 있으며 대칭·추이 관계로 확장되지 않습니다.</p>
 *
 * @param from 의존하는 쪽 레이어
 * @param to 의존받는 쪽 레이어
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record LayerEdge(LayerId from, LayerId to) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public LayerEdge {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
    }

    /**
     * 문자열로 LayerEdge 생성.
     *
     * @param from 의존하는 쪽 레이어
     * @param to 의존받는 쪽 레이어
     * @return LayerEdge 인스턴스
     */
    public static LayerEdge of(String from, String to) {
        return new LayerEdge(LayerId.of(from), LayerId.of(to));
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
