package com.ryuqq.guardrail.core.contract;

import com.ryuqq.guardrail.core.model.RuleId;

final class RuleFields {

    private RuleFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void require(RuleId ruleId, Severity severity, String description) {
        if (ruleId == null) {
            throw new IllegalArgumentException("ruleId cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
    }
}
