package com.ryuqq.guardrail.engine;

import com.ryuqq.guardrail.core.architecture.ArchitectureReport;

/**
 * 아키텍처 린트 결과.
 *
 * <p>CI 호스트는 {@link #passed()}로 빌드 성공 여부를 정하고, 종료 코드는 호스트가 결정합니다
 * (예: 실패 시 1).</p>
 *
 * @param report 위반 및 수정 제안 보고서
 * @param passed 통과 여부
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public record LintResult(ArchitectureReport report, boolean passed) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException report가 null인 경우
     */
    public LintResult {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
    }

    /**
     * 관례적인 프로세스 종료 코드.
     *
     * @return 통과이면 0, 실패이면 1
     */
    public int exitCode() {
        return passed ? 0 : 1;
    }
}
