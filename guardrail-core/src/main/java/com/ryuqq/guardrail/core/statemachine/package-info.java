/**
 * State machine package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.guardrail.core.statemachine.StateMachine} - Declarative states and transitions</li>
 *   <li>{@link com.ryuqq.guardrail.core.statemachine.Transition} - One edge, optionally guarded</li>
 *   <li>{@link com.ryuqq.guardrail.core.statemachine.StateMachineValidator} - Pure transition legality check</li>
 * </ul>
 *
 * <p>The validator never commits a transition. Persisting the new state is the host's job.</p>
 *
 * @since 1.0.0
 * @author Guardrail Team
 */
package com.ryuqq.guardrail.core.statemachine;
