/**
 * In-memory ContractStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.adapter.inmemory.store.InMemoryContractStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.guardrail.core.spi.ContractStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Immutable snapshots:</strong> a published version chain is never mutated</li>
 *   <li><strong>Atomic swap:</strong> one {@link java.util.concurrent.ConcurrentHashMap#compute} per publish</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Use in Contract Tests
 * class MyStoreContractTest extends AbstractContractStoreContractTest {
 *     {@literal @}Override
 *     protected ContractStore createStore() {
 *         return new InMemoryContractStore();
 *     }
 * }
 * </pre>
 *
 * @see com.ryuqq.guardrail.core.spi.ContractStore
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.adapter.inmemory.store;
