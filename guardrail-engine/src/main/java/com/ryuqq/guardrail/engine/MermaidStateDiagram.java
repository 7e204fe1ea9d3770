package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.StateId;
import com.ryuqq.guardrail.core.statemachine.StateMachine;
import com.ryuqq.guardrail.core.statemachine.Transition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 상태 머신을 Mermaid {@code stateDiagram-v2} 텍스트로 변환.
 *
 * <p>출력 예시:</p>
 * <pre>
 * ---
 * title: payment
 * ---
 * stateDiagram-v2
 *     [*] --&gt; pending
 *     pending --&gt; paid
 *     paid --&gt; refunded : refund-window-open
 *     refunded --&gt; [*]
 * </pre>
 *
 * <p><strong>식별자 처리:</strong> 영문자, 숫자, 밑줄로만 된 상태 ID는 그대로 출력합니다.
 * 그 외 문자(콜론, 점, 하이픈 등)가 있거나 Mermaid 예약어와 같은 상태는
 * {@code state "order:v2" as s1} 형태로 별칭을 선언한 뒤 별칭으로 간선을 출력합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class MermaidStateDiagram {

    private static final String INDENT = "    ";
    private static final String MARKER = "[*]";
    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z0-9_]+");
    private static final Set<String> RESERVED = Set.of(
        "state", "note", "end", "direction", "class", "classDef", "style", "click", "as"
    );

    private MermaidStateDiagram() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 머신 렌더링.
     *
     * @param entityType 다이어그램 제목으로 쓸 엔티티 유형
     * @param machine 상태 머신
     * @return Mermaid 텍스트 (줄바꿈 \n)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static String render(EntityType entityType, StateMachine machine) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }

        Map<StateId, String> names = aliases(machine.states());

        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("title: ").append(entityType.getValue()).append('\n');
        sb.append("---\n");
        sb.append("stateDiagram-v2\n");
        names.forEach((state, name) -> {
            if (!name.equals(state.getValue())) {
                line(sb, "state \"" + label(state.getValue()) + "\" as " + name);
            }
        });
        line(sb, MARKER + " --> " + names.get(machine.initial()));
        for (Transition transition : machine.transitions()) {
            String edge = names.get(transition.from()) + " --> " + names.get(transition.to());
            if (transition.guard() != null) {
                edge += " : " + transition.guard().getValue();
            }
            line(sb, edge);
        }
        for (StateId terminal : machine.terminal()) {
            line(sb, names.get(terminal) + " --> " + MARKER);
        }
        return sb.toString();
    }

    private static Map<StateId, String> aliases(Set<StateId> states) {
        Map<StateId, String> names = new LinkedHashMap<>();
        int counter = 0;
        for (StateId state : states) {
            String value = state.getValue();
            if (PLAIN_ID.matcher(value).matches() && !RESERVED.contains(value)) {
                names.put(state, value);
                continue;
            }
            String alias;
            do {
                alias = "s" + (++counter);
            } while (states.contains(StateId.of(alias)));
            names.put(state, alias);
        }
        return names;
    }

    private static String label(String value) {
        return value.replace("\"", "#quot;");
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(INDENT).append(text).append('\n');
    }
}
