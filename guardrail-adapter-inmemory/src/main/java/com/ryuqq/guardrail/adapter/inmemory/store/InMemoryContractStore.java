package com.ryuqq.guardrail.adapter.inmemory.store;

import com.ryuqq.guardrail.core.contract.Contract;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.model.ContractKey;
import com.ryuqq.guardrail.core.model.TenantScope;
import com.ryuqq.guardrail.core.spi.ContractStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ContractStore} SPI.
 *
 * <p>Each {@link ContractKey} maps to an immutable version chain. Publishing builds a new chain
 * (old chain + new contract) and swaps it in with {@link ConcurrentHashMap#compute}, so the
 * swap is atomic per key and readers see either the old or the new chain, never a partial one.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>chains:</strong> ConcurrentHashMap&lt;ContractKey, List&lt;Contract&gt;&gt; - Immutable version chain per key, active version last</li>
 *   <li><strong>sequence:</strong> AtomicLong - Store-wide logical publish clock</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li><strong>append:</strong> serialized per key by {@code compute}; different keys proceed in parallel</li>
 *   <li><strong>findActive / findVersion / history:</strong> lock-free {@code get} of an immutable chain</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Version chains are never compacted</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ContractStore store = new InMemoryContractStore();
 * Contract v1 = store.append(TenantScope.of(TenantId.of("t1")), definition);
 * Optional&lt;Contract&gt; active = store.findActive(v1.key());
 * </pre>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class InMemoryContractStore implements ContractStore {

    /**
     * Version chains. Key: ContractKey, Value: immutable list, oldest first.
     */
    private final ConcurrentHashMap<ContractKey, List<Contract>> chains;

    /**
     * Sequence of the most recent append.
     */
    private final AtomicLong sequence;

    /**
     * Creates a new InMemoryContractStore with empty storage.
     */
    public InMemoryContractStore() {
        this.chains = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> the version and the sequence are both assigned inside
     * the per-key {@code compute}, so for one key higher versions always carry higher sequences.</p>
     */
    @Override
    public Contract append(TenantScope scope, ContractDefinition definition) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        ContractKey key = ContractKey.of(scope, definition.name());
        List<Contract> chain = chains.compute(key, (k, existing) -> {
            List<Contract> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(Contract.publish(scope, definition, next.size() + 1L, sequence.incrementAndGet()));
            return List.copyOf(next);
        });
        return chain.get(chain.size() - 1);
    }

    @Override
    public Optional<Contract> findActive(ContractKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        List<Contract> chain = chains.get(key);
        if (chain == null) {
            return Optional.empty();
        }
        return Optional.of(chain.get(chain.size() - 1));
    }

    @Override
    public Optional<Contract> findVersion(ContractKey key, long version) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        List<Contract> chain = chains.get(key);
        if (chain == null || version > chain.size()) {
            return Optional.empty();
        }
        return Optional.of(chain.get((int) (version - 1)));
    }

    @Override
    public List<Contract> history(ContractKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return chains.getOrDefault(key, List.of());
    }

    @Override
    public long currentSequence() {
        return sequence.get();
    }

    /**
     * Number of keys with at least one published version.
     *
     * @return key count
     */
    public int size() {
        return chains.size();
    }
}
