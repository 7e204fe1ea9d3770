/**
 * Engine exceptions.
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.exception.ContractValidationException} - Malformed contract at publish time</li>
 *   <li>{@link com.ryuqq.guardrail.core.exception.ContractNotFoundException} - No contract for the tenant (recoverable)</li>
 *   <li>{@link com.ryuqq.guardrail.core.exception.ContractIntegrityException} - Corrupted in-memory contract (unrecoverable)</li>
 * </ul>
 *
 * <p>Rule failures are never thrown; they are returned as violations.</p>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.exception;
