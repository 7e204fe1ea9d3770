/**
 * YAML/JSON document adapter.
 *
 * <p>Maps host-side documents to the in-memory model using Jackson
 * ({@code jackson-databind} + {@code jackson-dataformat-yaml}).</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.adapter.yaml.ContractDocumentReader} - contract document to ContractDefinition</li>
 *   <li>{@link com.ryuqq.guardrail.adapter.yaml.DependencySnapshotReader} - edge list to DependencyEdge list</li>
 * </ul>
 *
 * <p>Malformed input raises {@link com.ryuqq.guardrail.adapter.yaml.ContractDocumentException}
 * naming the JSON pointer of the offending node.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.adapter.yaml;
