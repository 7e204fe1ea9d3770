package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.adapter.inmemory.predicate.InMemoryPredicateRegistry;
import com.ryuqq.guardrail.adapter.inmemory.store.InMemoryContractStore;
import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.contract.GenericPredicateRule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.contract.StateTransitionRule;
import com.ryuqq.guardrail.core.exception.ContractNotFoundException;
import com.ryuqq.guardrail.core.exception.ContractValidationException;
import com.ryuqq.guardrail.core.model.ContractId;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.model.TenantId;
import com.ryuqq.guardrail.core.model.TenantScope;
import com.ryuqq.guardrail.core.statemachine.StateMachine;
import com.ryuqq.guardrail.testkit.fixture.ContractFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultContractRegistry 테스트.
 *
 * <p>게시 시점 검증, 테넌트/전역 조회 우선순위, 버전 교체와 이력을 검증합니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
class DefaultContractRegistryTest {

    private static final TenantId T1 = TenantId.of("t1");
    private static final TenantId T2 = TenantId.of("t2");
    private static final ContractName PAYMENTS = ContractName.of(ContractFixtures.PAYMENTS);

    private InMemoryContractStore store;
    private DefaultContractRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryContractStore();
        InMemoryPredicateRegistry predicates = new InMemoryPredicateRegistry()
            .register(ContractFixtures.REFUND_WINDOW_OPEN, ctx -> true)
            .register(ContractFixtures.AMOUNT_POSITIVE, ctx -> true);
        registry = new DefaultContractRegistry(store, predicates);
    }

    // ============================================================
    // 1. 게시 / 조회
    // ============================================================

    @Test
    void publish_후_resolve하면_같은_규칙을_가진_계약이_반환됨() {
        // given
        ContractDefinition definition = ContractFixtures.mixedContract(ContractFixtures.PAYMENTS);

        // when
        ContractId id = registry.publish(T1, definition);
        Contract resolved = registry.resolve(T1, PAYMENTS);

        // then
        assertThat(id.version()).isEqualTo(1);
        assertThat(resolved.id()).isEqualTo(id);
        assertThat(resolved.definition()).isEqualTo(definition);
        assertThat(resolved.rules()).isEqualTo(definition.rules());
    }

    @Test
    void 테넌트_전용_계약이_전역_계약보다_우선함() {
        // given
        ContractId global = registry.publishGlobal(ContractFixtures.paymentsContract());
        ContractId tenant = registry.publish(T1, ContractDefinition.of(ContractFixtures.PAYMENTS,
            ContractFixtures.paymentRule(Severity.WARN)));

        // when & then
        assertThat(registry.resolve(T1, PAYMENTS).id()).isEqualTo(tenant);
        assertThat(registry.resolve(T2, PAYMENTS).id()).isEqualTo(global);
    }

    @Test
    void 테넌트_전용도_전역도_없으면_ContractNotFoundException() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when & then
        assertThatThrownBy(() -> registry.resolve(T2, PAYMENTS))
            .isInstanceOf(ContractNotFoundException.class)
            .hasMessageContaining("payments")
            .hasMessageContaining("t2");
    }

    // ============================================================
    // 2. 버전 교체 / 이력
    // ============================================================

    @Test
    void 두번째_버전을_게시하면_resolve는_새_버전만_반환하고_이전_버전은_이력에_남음() {
        // given
        ContractId v1 = registry.publish(T1, ContractFixtures.paymentsContract());

        // when
        ContractId v2 = registry.publish(T1, ContractDefinition.of(ContractFixtures.PAYMENTS,
            ContractFixtures.paymentRule(Severity.WARN)));

        // then
        assertThat(v2.version()).isEqualTo(2);
        assertThat(registry.resolve(T1, PAYMENTS).id()).isEqualTo(v2);
        assertThat(registry.resolveVersion(TenantScope.of(T1), PAYMENTS, 1).id()).isEqualTo(v1);
        assertThat(registry.history(TenantScope.of(T1), PAYMENTS))
            .extracting(Contract::version)
            .containsExactly(1L, 2L);
    }

    @Test
    void 존재하지_않는_버전을_조회하면_ContractNotFoundException() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());

        // when & then
        assertThatThrownBy(() -> registry.resolveVersion(TenantScope.of(T1), PAYMENTS, 5))
            .isInstanceOf(ContractNotFoundException.class)
            .hasMessageContaining("version 5");
        assertThatThrownBy(() -> registry.resolveVersion(TenantScope.of(T1), PAYMENTS, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. 게시 시점 검증
    // ============================================================

    @Test
    void 잘못된_계약은_모든_문제와_함께_거부되고_저장소는_변경되지_않음() {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());
        long sequenceBefore = registry.currentSequence();
        StateMachine broken = StateMachine.builder()
            .states("pending", "paid", "orphan")
            .initial("pending")
            .terminal("paid")
            .transition("pending", "paid")
            .transition("paid", "pending", "unregistered-guard")
            .build();
        ContractDefinition invalid = ContractDefinition.of(ContractFixtures.PAYMENTS,
            new StateTransitionRule(
                RuleId.of("lifecycle"), Severity.BLOCK, "lifecycle",
                EntityType.of("payment"), broken));

        // when & then
        assertThatThrownBy(() -> registry.publish(T1, invalid))
            .isInstanceOf(ContractValidationException.class)
            .satisfies(e -> assertThat(((ContractValidationException) e).getProblems()).hasSize(3));

        assertThat(registry.currentSequence()).isEqualTo(sequenceBefore);
        assertThat(registry.history(TenantScope.of(T1), PAYMENTS)).hasSize(1);
        assertThat(registry.resolve(T1, PAYMENTS).version()).isEqualTo(1);
    }

    @Test
    void 알수없는_술어를_참조하면_게시_거부() {
        // given
        ContractDefinition definition = ContractDefinition.of("checks",
            new GenericPredicateRule(
                RuleId.of("kyc"), Severity.BLOCK, "KYC done",
                PredicateName.of("kyc-complete")));

        // when & then
        assertThatThrownBy(() -> registry.publishGlobal(definition))
            .isInstanceOf(ContractValidationException.class)
            .hasMessageContaining("kyc-complete");
        assertThat(store.size()).isZero();
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> registry.publish(null, ContractFixtures.paymentsContract()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.publishGlobal(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.resolve(T1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 4. 동시성
    // ============================================================

    @Test
    void 게시와_조회가_동시에_일어나도_조회는_항상_완전한_계약을_봄() throws Exception {
        // given
        registry.publish(T1, ContractFixtures.paymentsContract());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        List<Future<?>> futures = new ArrayList<>();

        try {
            // when
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    registry.publish(T1, ContractFixtures.mixedContract(ContractFixtures.PAYMENTS));
                }
                running.set(false);
                return null;
            }));
            for (int r = 0; r < 3; r++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    long lastVersion = 0;
                    while (running.get()) {
                        Contract contract = registry.resolve(T1, PAYMENTS);
                        // then
                        assertThat(contract.version()).isGreaterThanOrEqualTo(lastVersion);
                        assertThat(contract.rules()).hasSizeBetween(1, 3);
                        if (contract.version() > 1) {
                            assertThat(contract.rules()).hasSize(3);
                        }
                        lastVersion = contract.version();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.resolve(T1, PAYMENTS).version()).isEqualTo(201);
    }
}
