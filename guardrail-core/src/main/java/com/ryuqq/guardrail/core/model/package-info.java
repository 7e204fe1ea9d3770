/**
 * Core value objects and composite keys.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.model.TenantId} - Tenant isolation boundary</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.TenantScope} - One tenant or global</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.ContractName} - Contract name</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.RuleId} - Rule identifier used in diagnostics</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.StateId} - State machine state</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.EntityType} - Entity kind governed by a state machine</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.ModuleId} / {@link com.ryuqq.guardrail.core.model.LayerId} - Architecture graph nodes</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.PredicateName} - Guard / predicate lookup name</li>
 * </ul>
 *
 * <h2>Composite Keys</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.model.ContractKey} - (scope, name): points at the active version</li>
 *   <li>{@link com.ryuqq.guardrail.core.model.ContractId} - (scope, name, version): one published version</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.model;
