/**
 * Architecture layering package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.architecture.ArchitectureGraph} - Modules, layer assignment, allowed layer edges, forbidden targets</li>
 *   <li>{@link com.ryuqq.guardrail.core.architecture.ArchitectureValidator} - Single and batch dependency checks</li>
 *   <li>{@link com.ryuqq.guardrail.core.architecture.ArchitectureReport} - Collected violations and fix suggestions</li>
 * </ul>
 *
 * <h2>Batch validation</h2>
 * <pre>
 * Iterable&lt;Violation&gt; violations = validator.validateAll(graph, snapshot);
 * for (Violation violation : violations) {   // lazy, may be iterated again
 *     ...
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.architecture;
