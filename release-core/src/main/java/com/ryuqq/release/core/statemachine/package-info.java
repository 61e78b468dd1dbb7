/**
 * Release state machine package.
 *
 * <p>This package implements the state transition rules for the release lifecycle,
 * ensuring that a finished release is never reopened.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.statemachine.ReleaseState} - Release lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.release.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → IN_PROGRESS (validation passed)
 * IN_PROGRESS → IN_PROGRESS (batch-by-batch update)
 * IN_PROGRESS → SUCCESS | FAILED | ROLLED_BACK
 *
 * Forbidden:
 * - SUCCESS / FAILED / ROLLED_BACK → * (terminal states)
 * - Backward transitions (e.g., IN_PROGRESS → PENDING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ReleaseState state = ReleaseState.PENDING;
 * state = StateTransition.transition(state, ReleaseState.IN_PROGRESS);
 * state = StateTransition.transition(state, ReleaseState.ROLLED_BACK);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, ReleaseState.SUCCESS);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.core.statemachine;
