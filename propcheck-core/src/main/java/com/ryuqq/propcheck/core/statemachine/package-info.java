/**
 * Evaluation state machine package.
 *
 * <p>Tracks where a single property check is: before sampling, drawing values,
 * evaluating the predicate, or finished.</p>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * INIT → SAMPLING
 * SAMPLING → PREDICATE_CHECK
 * PREDICATE_CHECK → SAMPLING (next sample)
 * SAMPLING | PREDICATE_CHECK → PASS | FAIL
 *
 * Forbidden:
 * - PASS → * (terminal state)
 * - FAIL → * (terminal state)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * EvaluationState state = EvaluationState.INIT;
 * state = StateTransition.transition(state, EvaluationState.SAMPLING);
 * state = StateTransition.transition(state, EvaluationState.PREDICATE_CHECK);
 * state = StateTransition.transition(state, EvaluationState.PASS);
 * </pre>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.statemachine;
