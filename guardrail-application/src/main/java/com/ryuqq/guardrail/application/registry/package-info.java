/**
 * Guardrail Application Layer - 계약 게시/조회 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.application.registry.ContractRegistry} - 테넌트별 계약 게시 및 조회</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>게시 시점 검증:</strong> 잘못된 계약은 평가 시점이 아닌 게시 시점에 거부</li>
 *   <li><strong>불변 스냅샷:</strong> 게시된 버전은 변경되지 않고, 새 버전이 원자적으로 교체</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 guardrail-engine 모듈에 위치</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.application.registry;
