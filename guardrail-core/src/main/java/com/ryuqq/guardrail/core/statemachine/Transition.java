package com.ryuqq.guardrail.core.statemachine;

import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.StateId;

import java.util.Optional;

/**
 * 상태 머신의 전이 간선 (from → to, 선택적 guard).
 *
 * @param from 출발 상태
 * @param to 도착 상태
 * @param guard guard 술어 이름 (선택, null 가능)
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record Transition(StateId from, StateId to, PredicateName guard) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public Transition {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        // guard는 null 허용
    }

    /**
     * guard 없는 전이 생성.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     * @return Transition 인스턴스
     */
    public static Transition of(StateId from, StateId to) {
        return new Transition(from, to, null);
    }

    /**
     * guard 있는 전이 생성.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     * @param guard guard 술어 이름
     * @return Transition 인스턴스
     */
    public static Transition guarded(StateId from, StateId to, PredicateName guard) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        return new Transition(from, to, guard);
    }

    /**
     * guard 조회.
     *
     * @return guard 술어 이름 (없으면 empty)
     */
    public Optional<PredicateName> guardName() {
        return Optional.ofNullable(guard);
    }

    @Override
    public String toString() {
        return guard == null ? from + " -> " + to : from + " -> " + to + " [" + guard + "]";
    }
}
