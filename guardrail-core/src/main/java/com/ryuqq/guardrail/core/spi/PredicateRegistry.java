package com.ryuqq.guardrail.core.spi;

import com.ryuqq.guardrail.core.model.PredicateName;

import java.util.Optional;
import java.util.Set;

/**
 * Predicate lookup SPI.
 *
 * <p>Maps a {@link PredicateName} to a pure {@link GuardPredicate}. Guard names in state machines
 * and predicate names in generic rules are resolved through this registry when a contract is
 * published, so an unknown name fails the publish instead of the evaluation.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: lookups may run concurrently with evaluations on many threads</li>
 *   <li>Append-only: once a name resolves it must keep resolving, otherwise published contracts
 *       referencing it become corrupted</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public interface PredicateRegistry {

    /**
     * Looks up a predicate by name.
     *
     * @param name the predicate name
     * @return the predicate, or empty if no predicate is registered under this name
     * @throws IllegalArgumentException if name is null
     */
    Optional<GuardPredicate> find(PredicateName name);

    /**
     * Checks whether a predicate is registered under the given name.
     *
     * @param name the predicate name
     * @return true if registered
     * @throws IllegalArgumentException if name is null
     */
    default boolean contains(PredicateName name) {
        return find(name).isPresent();
    }

    /**
     * Returns all registered names.
     *
     * @return registered names (snapshot, may be empty)
     */
    Set<PredicateName> names();
}
