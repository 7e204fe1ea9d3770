package com.ryuqq.guardrail.testkit.fixture;

import com.ryuqq.guardrail.core.architecture.ArchitectureGraph;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.contract.GenericPredicateRule;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.contract.StateTransitionRule;
import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.statemachine.StateMachine;

/**
 * Shared contract fixtures for tests.
 *
 * <p><strong>Payment lifecycle:</strong></p>
 * <pre>
 * pending -&gt; paid -&gt; refunded (terminal)
 * </pre>
 *
 * <p><strong>Two-layer architecture:</strong></p>
 * <pre>
 * api : web, db : data, allowed web -&gt; data
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public final class ContractFixtures {

    public static final String PAYMENTS = "payments";
    public static final String PAYMENT = "payment";
    public static final String REFUND_WINDOW_OPEN = "refund-window-open";
    public static final String AMOUNT_POSITIVE = "amount-positive";

    private ContractFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * pending -&gt; paid -&gt; refunded, refunded terminal.
     *
     * @return the payment state machine
     */
    public static StateMachine paymentMachine() {
        return StateMachine.builder()
            .states("pending", "paid", "refunded")
            .initial("pending")
            .terminal("refunded")
            .transition("pending", "paid")
            .transition("paid", "refunded")
            .build();
    }

    /**
     * Same as {@link #paymentMachine()} with paid -&gt; refunded guarded by {@value #REFUND_WINDOW_OPEN}.
     *
     * @return the guarded payment state machine
     */
    public static StateMachine guardedPaymentMachine() {
        return StateMachine.builder()
            .states("pending", "paid", "refunded")
            .initial("pending")
            .terminal("refunded")
            .transition("pending", "paid")
            .transition("paid", "refunded", REFUND_WINDOW_OPEN)
            .build();
    }

    /**
     * api : web, db : data, web may depend on data.
     *
     * @return the two-layer graph
     */
    public static ArchitectureGraph twoLayerGraph() {
        return ArchitectureGraph.builder()
            .module("api", "web")
            .module("db", "data")
            .allow("web", "data")
            .hint("data", "web", "Move shared code to a lower layer")
            .build();
    }

    public static StateTransitionRule paymentRule(Severity severity) {
        return new StateTransitionRule(RuleId.of("payment-lifecycle"), severity, "Payment lifecycle",
            EntityType.of(PAYMENT), paymentMachine());
    }

    public static LayerDependencyRule layeringRule(Severity severity) {
        return new LayerDependencyRule(RuleId.of("layering"), severity, "Web depends on data only", twoLayerGraph());
    }

    public static GenericPredicateRule amountRule(Severity severity) {
        return new GenericPredicateRule(RuleId.of("amount-positive"), severity, "Amount must be positive",
            PredicateName.of(AMOUNT_POSITIVE));
    }

    /**
     * The payments contract with one blocking payment lifecycle rule.
     *
     * @return the definition
     */
    public static ContractDefinition paymentsContract() {
        return ContractDefinition.of(PAYMENTS, paymentRule(Severity.BLOCK));
    }

    /**
     * A contract with one rule of each kind, all blocking.
     *
     * @param name the contract name
     * @return the definition
     */
    public static ContractDefinition mixedContract(String name) {
        return ContractDefinition.of(name,
            paymentRule(Severity.BLOCK),
            layeringRule(Severity.BLOCK),
            amountRule(Severity.BLOCK));
    }
}
