/**
 * Reusable SPI contract tests.
 *
 * <p>Adapter modules extend {@link com.ryuqq.guardrail.testkit.contract.AbstractContractStoreContractTest}
 * to prove their {@link com.ryuqq.guardrail.core.spi.ContractStore} honours the versioning and
 * concurrency guarantees the registry relies on.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.testkit.contract;
