package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.adapter.inmemory.predicate.InMemoryPredicateRegistry;
import com.ryuqq.guardrail.adapter.inmemory.store.InMemoryContractStore;
import com.ryuqq.guardrail.application.gateway.DependencyRequest;
import com.ryuqq.guardrail.application.gateway.GenericRequest;
import com.ryuqq.guardrail.application.gateway.TransitionRequest;
import com.ryuqq.guardrail.core.architecture.ArchitectureGraph;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.contract.GenericPredicateRule;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.contract.StateTransitionRule;
import com.ryuqq.guardrail.core.decision.Decision;
import com.ryuqq.guardrail.core.decision.DecisionOutcome;
import com.ryuqq.guardrail.core.decision.UnconfiguredPolicy;
import com.ryuqq.guardrail.core.decision.Violation;
import com.ryuqq.guardrail.core.exception.ContractIntegrityException;
import com.ryuqq.guardrail.core.model.ContractId;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.model.TenantId;
import com.ryuqq.guardrail.core.spi.PredicateContext;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;
import com.ryuqq.guardrail.core.statemachine.StateMachine;
import com.ryuqq.guardrail.core.validation.ViolationCode;
import com.ryuqq.guardrail.testkit.fixture.ContractFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * DefaultEnforcementGateway 테스트.
 *
 * <p>인메모리 저장소와 실제 레지스트리로 평가 흐름 전체를 검증합니다:</p>
 * <ul>
 *   <li>상태 전이 / 레이어 의존 / 일반 술어 요청</li>
 *   <li>위반 집계와 심각도</li>
 *   <li>UNCONFIGURED 처리와 정책</li>
 *   <li>평가 도중 게시되는 새 버전과의 격리</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultEnforcementGatewayTest {

    private static final TenantId T1 = TenantId.of("t1");
    private static final String PAYMENTS = ContractFixtures.PAYMENTS;
    private static final String PAYMENT = ContractFixtures.PAYMENT;

    @Mock
    private PredicateRegistry detachedPredicates;

    private InMemoryPredicateRegistry predicates;
    private DefaultContractRegistry registry;
    private DefaultEnforcementGateway gateway;

    @BeforeEach
    void setUp() {
        predicates = new InMemoryPredicateRegistry()
            .register(ContractFixtures.REFUND_WINDOW_OPEN,
                ctx -> ctx.get("refundWindowOpen", Boolean.class).orElse(false))
            .register(ContractFixtures.AMOUNT_POSITIVE,
                ctx -> ctx.get("amount", Integer.class).map(amount -> amount > 0).orElse(false));
        registry = new DefaultContractRegistry(new InMemoryContractStore(), predicates);
        gateway = new DefaultEnforcementGateway(registry, predicates);
    }

    // ============================================================
    // 1. 상태 전이
    // ============================================================

    @Test
    void 허용된_전이는_위반_없이_ALLOW() {
        // given
        ContractId id = registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1, TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "paid"));

        // then
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.ALLOW);
        assertThat(decision.violations()).isEmpty();
        assertThat(decision.contractId()).isEqualTo(id);
    }

    @Test
    void 선언되지_않은_전이는_ILLEGAL_TRANSITION으로_DENY() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "refunded"));

        // then
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.DENY);
        assertThat(decision.violations()).hasSize(1);
        Violation violation = decision.violations().get(0);
        assertThat(violation.code()).isEqualTo(ViolationCode.ILLEGAL_TRANSITION);
        assertThat(violation.ruleId()).isEqualTo(RuleId.of("payment-lifecycle"));
        assertThat(violation.message()).contains("pending").contains("refunded");
        assertThat(violation.context())
            .containsEntry("entityType", PAYMENT)
            .containsEntry("entityId", "p-1")
            .containsEntry("from", "pending")
            .containsEntry("to", "refunded")
            .containsKey("allowed");
    }

    @Test
    void 종료_상태에서의_전이는_거부됨() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "refunded", "paid"));

        // then
        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.violations().get(0).message()).contains("terminal");
    }

    @Test
    void 같은_엔티티의_규칙이_여러개면_모든_위반이_선언_순서대로_보고됨() {
        // given
        StateTransitionRule strict = new StateTransitionRule(RuleId.of("strict-lifecycle"), Severity.BLOCK,
            "Strict lifecycle", EntityType.of(PAYMENT), ContractFixtures.paymentMachine());
        registry.publish(T1, ContractDefinition.of(PAYMENTS, ContractFixtures.paymentRule(Severity.BLOCK), strict));

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "refunded"));

        // then
        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.violations())
            .extracting(Violation::ruleId)
            .containsExactly(RuleId.of("payment-lifecycle"), RuleId.of("strict-lifecycle"));
    }

    @Test
    void WARN_위반만_있으면_ALLOW이며_경고가_함께_반환됨() {
        // given
        registry.publish(T1, ContractDefinition.of(PAYMENTS, ContractFixtures.paymentRule(Severity.WARN)));

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "refunded"));

        // then
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.ALLOW);
        assertThat(decision.warnings()).hasSize(1);
        assertThat(decision.blockers()).isEmpty();
        assertThat(decision.warnings().get(0).severity()).isEqualTo(Severity.WARN);
    }

    @Test
    void 알수없는_상태는_WARN_규칙이어도_BLOCK으로_DENY() {
        // given
        registry.publish(T1, ContractDefinition.of(PAYMENTS, ContractFixtures.paymentRule(Severity.WARN)));

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "shipped"));

        // then
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.DENY);
        Violation violation = decision.violations().get(0);
        assertThat(violation.code()).isEqualTo(ViolationCode.UNKNOWN_STATE);
        assertThat(violation.severity()).isEqualTo(Severity.BLOCK);
        assertThat(violation.context()).containsEntry("state", "shipped");
    }

    @Test
    void 계약에_없는_엔티티_유형은_UNKNOWN_ENTITY로_DENY() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1, TransitionRequest.of(PAYMENTS, "order", "o-1", "new", "paid"));

        // then
        assertThat(decision.isDenied()).isTrue();
        Violation violation = decision.violations().get(0);
        assertThat(violation.code()).isEqualTo(ViolationCode.UNKNOWN_ENTITY);
        assertThat(violation.ruleId()).isEqualTo(DefaultEnforcementGateway.ENTITY_ROUTING_RULE);
        assertThat(violation.context()).containsEntry("entityType", "order");
    }

    @Test
    void 가드가_거부하면_GUARD_REJECTED_허용하면_ALLOW() {
        // given
        registry.publish(T1, guardedContract());

        // when
        Decision rejected = gateway.evaluate(T1, TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "paid", "refunded",
            PredicateContext.of(Map.of("refundWindowOpen", false))));
        Decision accepted = gateway.evaluate(T1, TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "paid", "refunded",
            PredicateContext.of(Map.of("refundWindowOpen", true))));

        // then
        assertThat(rejected.isDenied()).isTrue();
        assertThat(rejected.violations().get(0).code()).isEqualTo(ViolationCode.GUARD_REJECTED);
        assertThat(rejected.violations().get(0).context())
            .containsEntry("guard", ContractFixtures.REFUND_WINDOW_OPEN);
        assertThat(accepted.isAllowed()).isTrue();
        assertThat(accepted.violations()).isEmpty();
    }

    // ============================================================
    // 2. 레이어 의존
    // ============================================================

    @Test
    void 허용되지_않은_레이어_의존은_수정_제안과_함께_DENY() {
        // given
        registry.publish(T1, ContractDefinition.of("architecture", ContractFixtures.layeringRule(Severity.BLOCK)));

        // when
        Decision forbidden = gateway.evaluate(T1, DependencyRequest.of("architecture", "db", "api"));
        Decision allowed = gateway.evaluate(T1, DependencyRequest.of("architecture", "api", "db"));

        // then
        assertThat(forbidden.isDenied()).isTrue();
        Violation violation = forbidden.violations().get(0);
        assertThat(violation.code()).isEqualTo(ViolationCode.FORBIDDEN_LAYER_EDGE);
        assertThat(violation.context())
            .containsEntry("sourceLayer", "data")
            .containsEntry("targetLayer", "web")
            .containsEntry("hint", "Move shared code to a lower layer");
        assertThat(allowed.isAllowed()).isTrue();
    }

    @Test
    void 알수없는_모듈은_WARN_규칙이어도_BLOCK() {
        // given
        registry.publish(T1, ContractDefinition.of("architecture", ContractFixtures.layeringRule(Severity.WARN)));

        // when
        Decision decision = gateway.evaluate(T1, DependencyRequest.of("architecture", "api", "cache"));

        // then
        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.violations().get(0).code()).isEqualTo(ViolationCode.UNKNOWN_MODULE);
        assertThat(decision.violations().get(0).context()).containsEntry("module", "cache");
    }

    @Test
    void 선언되지_않은_모듈의_자기_의존은_UNKNOWN_MODULE로_DENY() {
        // given
        registry.publish(T1, ContractDefinition.of("architecture", ContractFixtures.layeringRule(Severity.WARN)));

        // when
        Decision ghost = gateway.evaluate(T1, DependencyRequest.of("architecture", "ghost", "ghost"));
        Decision declared = gateway.evaluate(T1, DependencyRequest.of("architecture", "db", "db"));

        // then
        assertThat(ghost.isDenied()).isTrue();
        assertThat(ghost.violations()).hasSize(1);
        assertThat(ghost.violations().get(0).code()).isEqualTo(ViolationCode.UNKNOWN_MODULE);
        assertThat(ghost.violations().get(0).context()).containsEntry("module", "ghost");
        assertThat(declared.isAllowed()).isTrue();
    }

    @Test
    void 금지_대상_의존은_레이어와_무관하게_수정_제안과_함께_DENY() {
        // given
        ArchitectureGraph graph = ArchitectureGraph.builder()
            .module("api", "web")
            .module("db", "data")
            .allow("web", "data")
            .forbid("sqlalchemy")
            .forbiddenHint("sqlalchemy", "Use the service layer to perform DB work")
            .build();
        registry.publish(T1, ContractDefinition.of("architecture",
            new LayerDependencyRule(RuleId.of("layering"), Severity.BLOCK, "layering", graph)));

        // when
        Decision decision = gateway.evaluate(T1, DependencyRequest.of("architecture", "api", "sqlalchemy"));

        // then
        assertThat(decision.isDenied()).isTrue();
        Violation violation = decision.violations().get(0);
        assertThat(violation.code()).isEqualTo(ViolationCode.FORBIDDEN_DEPENDENCY);
        assertThat(violation.ruleId()).isEqualTo(RuleId.of("layering"));
        assertThat(violation.context())
            .containsEntry("forbidden", "forbidden::sqlalchemy")
            .containsEntry("hint", "Use the service layer to perform DB work");
    }

    @Test
    void 레이어_규칙이_없는_계약의_의존_요청은_ALLOW() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1, DependencyRequest.of(PAYMENTS, "db", "api"));

        // then
        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.violations()).isEmpty();
    }

    // ============================================================
    // 3. 일반 술어
    // ============================================================

    @Test
    void 술어가_거부하면_PREDICATE_REJECTED() {
        // given
        registry.publish(T1, ContractDefinition.of("checks", ContractFixtures.amountRule(Severity.BLOCK)));

        // when
        Decision rejected = gateway.evaluate(T1, GenericRequest.of("checks", PredicateContext.of(Map.of("amount", -5))));
        Decision accepted = gateway.evaluate(T1, GenericRequest.of("checks", PredicateContext.of(Map.of("amount", 10))));

        // then
        assertThat(rejected.isDenied()).isTrue();
        assertThat(rejected.violations().get(0).code()).isEqualTo(ViolationCode.PREDICATE_REJECTED);
        assertThat(rejected.violations().get(0).context())
            .containsEntry("predicate", ContractFixtures.AMOUNT_POSITIVE);
        assertThat(accepted.isAllowed()).isTrue();
    }

    @Test
    void 술어가_예외를_던지면_거부로_기록되고_예외_정보가_남음() {
        // given
        predicates.register("explodes", ctx -> {
            throw new IllegalStateException("boom");
        });
        registry.publish(T1, ContractDefinition.of("checks", new GenericPredicateRule(
            RuleId.of("explosive"), Severity.BLOCK, "Always fails", PredicateName.of("explodes"))));

        // when
        Decision decision = gateway.evaluate(T1, GenericRequest.of("checks", PredicateContext.empty()));

        // then
        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.violations().get(0).code()).isEqualTo(ViolationCode.PREDICATE_REJECTED);
        assertThat(decision.violations().get(0).context().get("error")).contains("boom");
    }

    // ============================================================
    // 4. UNCONFIGURED
    // ============================================================

    @Test
    void 계약이_없으면_UNCONFIGURED이고_정책에_따라_허용_여부가_결정됨() {
        // given
        registry.publish(TenantId.of("other"), ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "paid"));

        // then
        assertThat(decision.outcome()).isEqualTo(DecisionOutcome.UNCONFIGURED);
        assertThat(decision.violations()).isEmpty();
        assertThat(decision.evaluatedContract()).isEmpty();
        assertThat(decision.evaluatedAt()).isEqualTo(Decision.UNCONFIGURED_SEQUENCE);
        assertThat(decision.isPermitted(UnconfiguredPolicy.FAIL_OPEN)).isTrue();
        assertThat(decision.isPermitted(UnconfiguredPolicy.FAIL_CLOSED)).isFalse();
    }

    @Test
    void 다른_테넌트의_게시는_UNCONFIGURED_Decision을_바꾸지_않음() {
        // given
        TransitionRequest request = TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "paid");
        Decision before = gateway.evaluate(TenantId.of("t2"), request);

        // when
        registry.publish(T1, ContractFixtures.paymentsContract());
        registry.publish(T1, ContractDefinition.of("architecture", ContractFixtures.layeringRule(Severity.BLOCK)));
        Decision after = gateway.evaluate(TenantId.of("t2"), request);

        // then
        assertThat(after.isUnconfigured()).isTrue();
        assertThat(after).isEqualTo(before);
    }

    @Test
    void 전역_계약은_테넌트_계약이_없는_모든_테넌트에_적용됨() {
        // given
        ContractId global = registry.publishGlobal(ContractFixtures.paymentsContract());

        // when
        Decision decision = gateway.evaluate(TenantId.of("anyone"),
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "refunded"));

        // then
        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.contractId()).isEqualTo(global);
    }

    // ============================================================
    // 5. 결정성 / 스냅샷 격리
    // ============================================================

    @Test
    void 같은_요청을_반복_평가하면_같은_Decision() {
        // given
        registry.publish(T1, ContractFixtures.mixedContract(PAYMENTS));
        TransitionRequest request = TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "refunded");

        // when
        Decision first = gateway.evaluate(T1, request);
        Decision second = gateway.evaluate(T1, request);

        // then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void 평가_도중_새_버전이_게시되어도_조회한_버전으로_끝까지_평가됨() {
        // given
        predicates.register("publishes-new-version", ctx -> {
            registry.publish(T1, ContractFixtures.paymentsContract());
            return true;
        });
        StateMachine machine = StateMachine.builder()
            .states("pending", "paid", "refunded")
            .initial("pending")
            .terminal("refunded")
            .transition("pending", "paid", "publishes-new-version")
            .transition("paid", "refunded")
            .build();
        ContractId v1 = registry.publish(T1, ContractDefinition.of(PAYMENTS, new StateTransitionRule(
            RuleId.of("racy-lifecycle"), Severity.BLOCK, "Racy lifecycle", EntityType.of(PAYMENT), machine)));
        long v1Sequence = registry.resolve(T1, ContractName.of(PAYMENTS)).sequence();

        // when
        Decision decision = gateway.evaluate(T1, TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "pending", "paid"));

        // then
        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.contractId()).isEqualTo(v1);
        assertThat(decision.evaluatedAt()).isEqualTo(v1Sequence);
        assertThat(registry.resolve(T1, ContractName.of(PAYMENTS)).version()).isEqualTo(2);
    }

    // ============================================================
    // 6. 무결성 / 인자 검증
    // ============================================================

    @Test
    void 게시_이후_술어가_사라지면_ContractIntegrityException() {
        // given
        registry.publish(T1, ContractDefinition.of("checks", ContractFixtures.amountRule(Severity.BLOCK)));
        when(detachedPredicates.find(any())).thenReturn(Optional.empty());
        DefaultEnforcementGateway detached = new DefaultEnforcementGateway(registry, detachedPredicates);

        // when & then
        assertThatThrownBy(() -> detached.evaluate(T1, GenericRequest.of("checks", PredicateContext.empty())))
            .isInstanceOf(ContractIntegrityException.class)
            .hasMessageContaining(ContractFixtures.AMOUNT_POSITIVE);
    }

    @Test
    void 게시_이후_가드가_사라지면_ContractIntegrityException() {
        // given
        registry.publish(T1, guardedContract());
        when(detachedPredicates.find(any())).thenReturn(Optional.empty());
        DefaultEnforcementGateway detached = new DefaultEnforcementGateway(registry, detachedPredicates);

        // when & then
        assertThatThrownBy(() -> detached.evaluate(T1,
            TransitionRequest.of(PAYMENTS, PAYMENT, "p-1", "paid", "refunded")))
            .isInstanceOf(ContractIntegrityException.class)
            .hasMessageContaining(ContractFixtures.REFUND_WINDOW_OPEN);
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> gateway.evaluate(null, GenericRequest.of("checks", PredicateContext.empty())))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.evaluate(T1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultEnforcementGateway(null, predicates))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ContractDefinition guardedContract() {
        return ContractDefinition.of(PAYMENTS, new StateTransitionRule(RuleId.of("guarded-lifecycle"),
            Severity.BLOCK, "Refund only inside the window", EntityType.of(PAYMENT),
            ContractFixtures.guardedPaymentMachine()));
    }
}
