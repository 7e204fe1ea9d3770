/**
 * Decision model package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.decision.Decision} - Aggregate result of one evaluation</li>
 *   <li>{@link com.ryuqq.guardrail.core.decision.DecisionOutcome} - ALLOW, DENY, UNCONFIGURED</li>
 *   <li>{@link com.ryuqq.guardrail.core.decision.Violation} - One rule failure with diagnostics</li>
 *   <li>{@link com.ryuqq.guardrail.core.decision.UnconfiguredPolicy} - Host default for tenants without a contract</li>
 * </ul>
 *
 * <h2>Aggregation</h2>
 * <pre>
 * any BLOCK violation  -&gt; DENY
 * only WARN violations -&gt; ALLOW (violations non-empty)
 * no violations        -&gt; ALLOW
 * no contract          -&gt; UNCONFIGURED
 * </pre>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.decision;
