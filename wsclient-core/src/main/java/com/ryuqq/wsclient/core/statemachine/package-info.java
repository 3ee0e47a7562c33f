/**
 * Two-phase invocation state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wsclient.core.statemachine.InvocationState} - pending slot state (enum)</li>
 *   <li>{@link com.ryuqq.wsclient.core.statemachine.InvocationEvent} - prepare / finalize</li>
 *   <li>{@link com.ryuqq.wsclient.core.statemachine.InvocationTransition} - transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * InvocationState state = InvocationState.NO_PENDING;
 * state = InvocationTransition.next(state, InvocationEvent.PREPARE);
 * state = InvocationTransition.next(state, InvocationEvent.FINALIZE);
 *
 * // This will throw NoPendingInvocationException
 * InvocationTransition.next(state, InvocationEvent.FINALIZE);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.wsclient.core.statemachine;
