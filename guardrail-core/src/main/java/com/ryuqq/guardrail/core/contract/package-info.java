/**
 * Contract model package.
 *
 * <p>A {@link com.ryuqq.guardrail.core.contract.Contract} is an immutable, versioned,
 * tenant-scoped bundle of {@link com.ryuqq.guardrail.core.contract.Rule rules}.</p>
 *
 * <h2>Rule Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.contract.StateTransitionRule} - Entity lifecycle legality</li>
 *   <li>{@link com.ryuqq.guardrail.core.contract.LayerDependencyRule} - Architectural layering</li>
 *   <li>{@link com.ryuqq.guardrail.core.contract.GenericPredicateRule} - Named host predicate</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * ContractDefinition (host) --publish--&gt; ContractValidator --ok--&gt; Contract v(n+1) becomes active
 *                                                          --problems--&gt; ContractValidationException, store unchanged
 * </pre>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.contract;
