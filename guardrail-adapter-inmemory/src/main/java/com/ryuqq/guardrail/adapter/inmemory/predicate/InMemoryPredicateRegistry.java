package com.ryuqq.guardrail.adapter.inmemory.predicate;

import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.spi.GuardPredicate;
import com.ryuqq.guardrail.core.spi.PredicateRegistry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory, append-only implementation of {@link PredicateRegistry}.
 *
 * <p>Hosts register their guard and predicate functions at startup, before publishing contracts
 * that reference them. A name can be registered only once, so a published contract can never
 * lose or silently change one of its predicates.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryPredicateRegistry predicates = new InMemoryPredicateRegistry()
 *     .register("refund-window-open", ctx -&gt; ctx.get("daysSincePayment", Integer.class).orElse(99) &lt;= 14)
 *     .register("amount-positive", ctx -&gt; ctx.get("amount", Integer.class).orElse(0) &gt; 0);
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class InMemoryPredicateRegistry implements PredicateRegistry {

    private final ConcurrentHashMap<PredicateName, GuardPredicate> predicates = new ConcurrentHashMap<>();

    /**
     * Registers a predicate.
     *
     * @param name the predicate name
     * @param predicate the predicate function (must be pure)
     * @return this registry, for chaining
     * @throws IllegalArgumentException if an argument is null
     * @throws IllegalStateException if the name is already registered
     */
    public InMemoryPredicateRegistry register(PredicateName name, GuardPredicate predicate) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        GuardPredicate existing = predicates.putIfAbsent(name, predicate);
        if (existing != null) {
            throw new IllegalStateException("Predicate '" + name + "' is already registered");
        }
        return this;
    }

    /**
     * Registers a predicate under a string name.
     *
     * @param name the predicate name
     * @param predicate the predicate function (must be pure)
     * @return this registry, for chaining
     */
    public InMemoryPredicateRegistry register(String name, GuardPredicate predicate) {
        return register(PredicateName.of(name), predicate);
    }

    @Override
    public Optional<GuardPredicate> find(PredicateName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return Optional.ofNullable(predicates.get(name));
    }

    @Override
    public Set<PredicateName> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(predicates.keySet()));
    }
}
