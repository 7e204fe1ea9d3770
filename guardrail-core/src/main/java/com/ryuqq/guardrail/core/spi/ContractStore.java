package com.ryuqq.guardrail.core.spi;

import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.model.ContractKey;
import com.ryuqq.guardrail.core.model.TenantScope;

import java.util.List;
import java.util.Optional;

/**
 * Versioned contract storage SPI.
 *
 * <p>Keeps one immutable version chain per {@link ContractKey} (tenant scope + contract name).
 * The last element of a chain is the active version. Definitions reaching this SPI have already
 * passed publish-time validation; the store only assigns versions and sequence numbers.</p>
 *
 * <p><strong>Publish Semantics:</strong></p>
 * <pre>
 * append(scope, definition)
 *   1. version  = previous active version + 1 (1 for a new key)
 *   2. sequence = store-wide counter + 1
 *   3. chain    = old chain + new contract   (swapped in one atomic step)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Readers never block on writers and never observe a partially published contract</li>
 *   <li>Appends for the same key are serialized; versions increase monotonically</li>
 *   <li>Appends for different keys proceed independently</li>
 *   <li>Published contracts are never mutated or removed</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public interface ContractStore {

    /**
     * Appends a new version for the definition's key and makes it active.
     *
     * @param scope the tenant scope (a tenant or global)
     * @param definition the validated definition
     * @return the published contract with its assigned version and sequence
     * @throws IllegalArgumentException if scope or definition is null
     */
    Contract append(TenantScope scope, ContractDefinition definition);

    /**
     * Returns the active version for the key.
     *
     * @param key the contract key
     * @return the active contract, or empty if nothing was published under this key
     * @throws IllegalArgumentException if key is null
     */
    Optional<Contract> findActive(ContractKey key);

    /**
     * Returns a specific version for the key.
     *
     * @param key the contract key
     * @param version the version (1-based)
     * @return the contract, or empty if the version does not exist
     * @throws IllegalArgumentException if key is null or version is less than 1
     */
    Optional<Contract> findVersion(ContractKey key, long version);

    /**
     * Returns every version published under the key, oldest first.
     *
     * @param key the contract key
     * @return immutable version chain (empty if nothing was published)
     * @throws IllegalArgumentException if key is null
     */
    List<Contract> history(ContractKey key);

    /**
     * Returns the store-wide logical clock: the sequence of the most recent append.
     *
     * @return current sequence (0 if the store is empty)
     */
    long currentSequence();
}
