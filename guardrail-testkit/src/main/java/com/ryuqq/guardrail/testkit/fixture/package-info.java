/**
 * Reusable model fixtures (payment lifecycle, two-layer architecture).
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.testkit.fixture;
