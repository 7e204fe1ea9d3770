/**
 * Guardrail Application Layer - 정책 평가 API.
 *
 * <p>호스트 애플리케이션이 호출하는 결정 API입니다. 호스트는 인증된 테넌트와 요청을 넘기고,
 * 반환된 Decision을 스스로 집행합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.application.gateway.EnforcementGateway} - 정책 평가 진입점</li>
 *   <li>{@link com.ryuqq.guardrail.application.gateway.EvaluationRequest} - 전이/의존/일반 요청</li>
 * </ul>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
package com.ryuqq.guardrail.application.gateway;
