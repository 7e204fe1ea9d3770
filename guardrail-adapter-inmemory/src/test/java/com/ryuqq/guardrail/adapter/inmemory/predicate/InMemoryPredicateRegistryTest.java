package com.ryuqq.guardrail.adapter.inmemory.predicate;

import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.spi.GuardPredicate;
import com.ryuqq.guardrail.core.spi.PredicateContext;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryPredicateRegistry}.
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
class InMemoryPredicateRegistryTest {

    @Test
    void register_ThenFind_ReturnsSamePredicate() {
        // Given
        GuardPredicate positive = ctx -> ctx.get("amount", Integer.class).map(a -> a > 0).orElse(false);
        InMemoryPredicateRegistry registry = new InMemoryPredicateRegistry().register("amount-positive", positive);

        // When
        GuardPredicate found = registry.find(PredicateName.of("amount-positive")).orElseThrow();

        // Then
        assertSame(positive, found);
        assertTrue(found.test(PredicateContext.of(Map.of("amount", 3))));
        assertTrue(registry.contains(PredicateName.of("amount-positive")));
    }

    @Test
    void find_UnknownName_ReturnsEmpty() {
        InMemoryPredicateRegistry registry = new InMemoryPredicateRegistry();

        assertTrue(registry.find(PredicateName.of("missing")).isEmpty());
        assertFalse(registry.contains(PredicateName.of("missing")));
    }

    @Test
    void register_DuplicateName_ThrowsAndKeepsOriginal() {
        // Given
        GuardPredicate original = ctx -> true;
        InMemoryPredicateRegistry registry = new InMemoryPredicateRegistry().register("kyc-complete", original);

        // When & Then
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> registry.register("kyc-complete", ctx -> false));
        assertTrue(e.getMessage().contains("kyc-complete"));
        assertSame(original, registry.find(PredicateName.of("kyc-complete")).orElseThrow());
    }

    @Test
    void names_ReturnsSnapshotOfRegisteredNames() {
        // Given
        InMemoryPredicateRegistry registry = new InMemoryPredicateRegistry()
            .register("a", ctx -> true)
            .register("b", ctx -> true);

        // When
        Set<PredicateName> names = registry.names();
        registry.register("c", ctx -> true);

        // Then
        assertEquals(Set.of(PredicateName.of("a"), PredicateName.of("b")), names);
        assertThrows(UnsupportedOperationException.class, () -> names.add(PredicateName.of("d")));
    }

    @Test
    void register_NullArguments_ThrowIllegalArgument() {
        InMemoryPredicateRegistry registry = new InMemoryPredicateRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register((PredicateName) null, ctx -> true));
        assertThrows(IllegalArgumentException.class, () -> registry.register("a", null));
        assertThrows(IllegalArgumentException.class, () -> registry.find(null));
    }
}
