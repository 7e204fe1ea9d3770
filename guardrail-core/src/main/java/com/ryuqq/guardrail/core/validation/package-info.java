/**
 * Validator result types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.validation.ValidationResult} - Sealed interface (permits Valid, Invalid)</li>
 *   <li>{@link com.ryuqq.guardrail.core.validation.ViolationCode} - Violation taxonomy</li>
 * </ul>
 *
 * <p>Expected failures such as an illegal transition or a forbidden layer edge are values,
 * never exceptions.</p>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.validation;
