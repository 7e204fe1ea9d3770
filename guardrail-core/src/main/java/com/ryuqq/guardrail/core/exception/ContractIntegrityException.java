package com.ryuqq.guardrail.core.exception;

/**
 * 구조적으로 불가능한 계약 상태 (복구 불가).
 *
 * <p>게시 시점 검증을 우회한 손상된 인메모리 계약을 평가할 때만 발생합니다.
 * 예: guard 이름이 평가 시점에 술어 레지스트리에서 사라진 경우.
 * 그 외의 모든 실패는 호출자가 검사하는 타입화된 결과로 반환됩니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class ContractIntegrityException extends IllegalStateException {

    /**
     * 생성자.
     *
     * @param message 손상 내용
     */
    public ContractIntegrityException(String message) {
        super(message);
    }
}
