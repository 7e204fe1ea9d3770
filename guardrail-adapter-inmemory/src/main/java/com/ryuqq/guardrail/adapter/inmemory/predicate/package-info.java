/**
 * In-memory PredicateRegistry adapter.
 *
 * @see com.ryuqq.guardrail.core.spi.PredicateRegistry
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.adapter.inmemory.predicate;
