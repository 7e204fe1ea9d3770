package com.ryuqq.guardrail.engine;

/**
 * ArchitectureLintRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failOnWarn: WARN 위반만 있어도 실패로 판정할지 여부 (기본 false)</li>
 *   <li>maxLoggedViolations: 개별 로그로 남길 최대 위반 수 (기본 50, 0이면 요약만)</li>
 * </ul>
 *
 * <p><strong>CI 설정 가이드:</strong></p>
 * <ul>
 *   <li>도입 초기: failOnWarn=false로 경고를 누적 관찰</li>
 *   <li>정착 이후: failOnWarn=true로 모든 위반을 빌드 실패로 처리</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 * @param failOnWarn WARN 위반도 실패로 판정할지 여부
 * @param maxLoggedViolations 개별 로그 최대 수 (0 이상이어야 함)
 */
public record LintConfig(boolean failOnWarn, int maxLoggedViolations) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failOnWarn=false, maxLoggedViolations=50</p>
     */
    public LintConfig() {
        this(false, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LintConfig {
        if (maxLoggedViolations < 0) {
            throw new IllegalArgumentException(
                "maxLoggedViolations must be non-negative (current: " + maxLoggedViolations + ")"
            );
        }
    }

    /**
     * failOnWarn만 변경한 새 인스턴스 생성.
     *
     * @param failOnWarn 새로운 failOnWarn
     * @return 새 LintConfig 인스턴스
     */
    public LintConfig withFailOnWarn(boolean failOnWarn) {
        return new LintConfig(failOnWarn, this.maxLoggedViolations);
    }

    /**
     * maxLoggedViolations만 변경한 새 인스턴스 생성.
     *
     * @param maxLoggedViolations 새로운 개별 로그 최대 수
     * @return 새 LintConfig 인스턴스
     */
    public LintConfig withMaxLoggedViolations(int maxLoggedViolations) {
        return new LintConfig(this.failOnWarn, maxLoggedViolations);
    }
}
