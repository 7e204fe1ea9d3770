/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement to plug storage
 * and predicate functions into the engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.spi.ContractStore} - Versioned contract chains per tenant scope and name</li>
 *   <li>{@link com.ryuqq.guardrail.core.spi.PredicateRegistry} - Name to guard/predicate lookup</li>
 *   <li>{@link com.ryuqq.guardrail.core.spi.GuardPredicate} - Pure boolean function over a {@link com.ryuqq.guardrail.core.spi.PredicateContext}</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., guardrail-adapter-inmemory) provide concrete implementations.
 * The core never depends on an adapter.</p>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.spi;
