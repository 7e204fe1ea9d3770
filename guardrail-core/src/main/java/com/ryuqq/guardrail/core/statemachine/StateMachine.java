package com.ryuqq.guardrail.core.statemachine;

import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.StateId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 선언적 상태 머신 정의.
 *
 * <p>엔티티 상태(states), 허용된 전이(transitions), 초기 상태(initial), 종료 상태(terminal)로
 * 구성됩니다. 상태 머신은 이를 선언한 계약(Contract)이 소유하며 같은 생명주기를 가집니다.</p>
 *
 * <p><strong>구조적 불변식 (계약 게시 시점에 {@code ContractValidator}가 검증):</strong></p>
 * <ul>
 *   <li>모든 전이의 from/to는 states에 속함</li>
 *   <li>initial ∈ states, terminal ⊆ states</li>
 *   <li>종료 상태에서 나가는 전이 없음</li>
 *   <li>모든 상태는 initial에서 도달 가능</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 모든 컬렉션은 선언 순서를 유지하는 불변 복사본입니다.
 * 동등성은 집합 기준의 구조적 비교입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateMachine machine = StateMachine.builder()
 *     .states("pending", "paid", "refunded")
 *     .initial("pending")
 *     .terminal("refunded")
 *     .transition("pending", "paid")
 *     .transition("paid", "refunded", "refund-window-open")
 *     .build();
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class StateMachine {

    private final Set<StateId> states;
    private final Set<Transition> transitions;
    private final StateId initial;
    private final Set<StateId> terminal;
    private final Map<StateId, List<Transition>> outgoing;

    /**
     * 생성자.
     *
     * @param states 상태 집합
     * @param transitions 전이 집합
     * @param initial 초기 상태
     * @param terminal 종료 상태 집합
     * @throws IllegalArgumentException 인자가 null이거나 null 원소를 포함하는 경우
     */
    public StateMachine(Set<StateId> states, Set<Transition> transitions, StateId initial, Set<StateId> terminal) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.states = copyOf(states, "states");
        this.transitions = copyOf(transitions, "transitions");
        this.initial = initial;
        this.terminal = copyOf(terminal, "terminal");

        Map<StateId, List<Transition>> index = new LinkedHashMap<>();
        for (Transition transition : this.transitions) {
            index.computeIfAbsent(transition.from(), k -> new ArrayList<>()).add(transition);
        }
        index.replaceAll((state, list) -> List.copyOf(list));
        this.outgoing = Collections.unmodifiableMap(index);
    }

    private static <T> Set<T> copyOf(Set<T> source, String name) {
        if (source == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        Set<T> copy = new LinkedHashSet<>();
        for (T element : source) {
            if (element == null) {
                throw new IllegalArgumentException(name + " cannot contain null");
            }
            copy.add(element);
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * 빌더 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Set<StateId> states() {
        return states;
    }

    public Set<Transition> transitions() {
        return transitions;
    }

    public StateId initial() {
        return initial;
    }

    public Set<StateId> terminal() {
        return terminal;
    }

    /**
     * 상태가 선언되어 있는지 확인.
     *
     * @param state 상태
     * @return states에 포함되면 true
     */
    public boolean declares(StateId state) {
        return states.contains(state);
    }

    /**
     * 종료 상태인지 확인.
     *
     * @param state 상태
     * @return terminal에 포함되면 true
     */
    public boolean isTerminal(StateId state) {
        return terminal.contains(state);
    }

    /**
     * 주어진 상태에서 나가는 전이 목록 (선언 순서).
     *
     * @param from 출발 상태
     * @return 나가는 전이 (없으면 빈 목록)
     */
    public List<Transition> outgoing(StateId from) {
        return outgoing.getOrDefault(from, List.of());
    }

    /**
     * (from, to) 전이 조회.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     * @return 일치하는 첫 번째 전이 (없으면 empty)
     */
    public Optional<Transition> findTransition(StateId from, StateId to) {
        for (Transition transition : outgoing(from)) {
            if (transition.to().equals(to)) {
                return Optional.of(transition);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateMachine that = (StateMachine) o;
        return states.equals(that.states)
            && transitions.equals(that.transitions)
            && initial.equals(that.initial)
            && terminal.equals(that.terminal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, transitions, initial, terminal);
    }

    @Override
    public String toString() {
        return "StateMachine{initial=" + initial + ", states=" + states + ", terminal=" + terminal
            + ", transitions=" + transitions + '}';
    }

    /**
     * StateMachine 빌더.
     *
     * <p>문자열 인자는 해당 값 객체로 변환되며, 유효하지 않은 값이면
     * {@link IllegalArgumentException}이 발생합니다.</p>
     */
    public static final class Builder {

        private final Set<StateId> states = new LinkedHashSet<>();
        private final Set<Transition> transitions = new LinkedHashSet<>();
        private final Set<StateId> terminal = new LinkedHashSet<>();
        private StateId initial;

        private Builder() {
        }

        public Builder states(String... values) {
            for (String value : values) {
                states.add(StateId.of(value));
            }
            return this;
        }

        public Builder initial(String value) {
            this.initial = StateId.of(value);
            return this;
        }

        public Builder terminal(String... values) {
            for (String value : values) {
                terminal.add(StateId.of(value));
            }
            return this;
        }

        public Builder transition(String from, String to) {
            transitions.add(Transition.of(StateId.of(from), StateId.of(to)));
            return this;
        }

        public Builder transition(String from, String to, String guard) {
            transitions.add(Transition.guarded(StateId.of(from), StateId.of(to), PredicateName.of(guard)));
            return this;
        }

        public Builder transition(Transition transition) {
            if (transition == null) {
                throw new IllegalArgumentException("transition cannot be null");
            }
            transitions.add(transition);
            return this;
        }

        /**
         * StateMachine 생성.
         *
         * @return 불변 StateMachine
         * @throws IllegalArgumentException initial이 지정되지 않은 경우
         */
        public StateMachine build() {
            return new StateMachine(states, transitions, initial, terminal);
        }
    }
}
