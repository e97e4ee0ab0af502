package com.ryuqq.propcheck.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.propcheck.core.statemachine.EvaluationState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 흐름 INIT → SAMPLING → PREDICATE_CHECK → (SAMPLING →) PASS | FAIL</li>
 *   <li>종료 상태에서의 전이는 IllegalStateException</li>
 *   <li>건너뛰기 전이(INIT → PREDICATE_CHECK 등)는 IllegalStateException</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_InitToSampling_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(INIT, SAMPLING));
    }

    @Test
    void validate_PredicateCheckToSampling_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PREDICATE_CHECK, SAMPLING));
    }

    @Test
    void validate_SamplingToTerminal_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(SAMPLING, PASS));
        assertDoesNotThrow(() -> StateTransition.validate(SAMPLING, FAIL));
    }

    @Test
    void transition_NormalFlowToPass_Succeeds() {
        // Given
        EvaluationState state = INIT;

        // When
        state = StateTransition.transition(state, SAMPLING);
        state = StateTransition.transition(state, PREDICATE_CHECK);
        state = StateTransition.transition(state, SAMPLING);
        state = StateTransition.transition(state, PREDICATE_CHECK);
        state = StateTransition.transition(state, PASS);

        // Then
        assertEquals(PASS, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_CounterexampleFlowToFail_Succeeds() {
        // Given
        EvaluationState state = INIT;

        // When
        state = StateTransition.transition(state, SAMPLING);
        state = StateTransition.transition(state, PREDICATE_CHECK);
        state = StateTransition.transition(state, FAIL);

        // Then
        assertEquals(FAIL, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @ParameterizedTest
    @EnumSource(EvaluationState.class)
    void validate_FromPass_ThrowsException(EvaluationState to) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PASS, to)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @ParameterizedTest
    @EnumSource(EvaluationState.class)
    void validate_FromFail_ThrowsException(EvaluationState to) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(FAIL, to)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_InitToPredicateCheck_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(INIT, PREDICATE_CHECK)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_InitToPass_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(INIT, PASS));
    }

    @Test
    void validate_SamplingToInit_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(SAMPLING, INIT));
    }

    @Test
    void validate_SamplingToSampling_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(SAMPLING, SAMPLING));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, SAMPLING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(INIT, null));
    }

    @Test
    void isTerminal_OnlyPassAndFail() {
        assertFalse(INIT.isTerminal());
        assertFalse(SAMPLING.isTerminal());
        assertFalse(PREDICATE_CHECK.isTerminal());
        assertTrue(PASS.isTerminal());
        assertTrue(FAIL.isTerminal());
    }
}
