/**
 * Guardrail Engine - 기본 구현체.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.engine.DefaultContractRegistry} - 게시 시점 검증 + 버전 저장</li>
 *   <li>{@link com.ryuqq.guardrail.engine.DefaultEnforcementGateway} - 규칙 실행 및 결정 집계</li>
 *   <li>{@link com.ryuqq.guardrail.engine.ArchitectureLintRunner} - CI용 일괄 아키텍처 검사</li>
 *   <li>{@link com.ryuqq.guardrail.engine.MermaidStateDiagram} - 상태 머신 다이어그램 출력</li>
 * </ul>
 *
 * <h2>로깅</h2>
 * <p>SLF4J를 사용합니다. 게시 성공은 INFO, 거부는 WARN으로 기록하며,
 * 평가 경로는 로그를 남기지 않습니다.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.engine;
