package com.ryuqq.propcheck.adapter.runner;

import com.ryuqq.propcheck.core.domain.Domains;
import com.ryuqq.propcheck.core.property.Property;
import com.ryuqq.propcheck.core.property.PropertyPredicate;
import com.ryuqq.propcheck.core.seed.Seed;
import com.ryuqq.propcheck.core.statemachine.EvaluationState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Evaluation 유닛 테스트.
 *
 * <p>검사 한 번의 상태 전이와 평가 횟수를 검증합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EvaluationTest {

    @Mock
    private PropertyPredicate predicate;

    @Test
    void run_성공하면_PASS_상태로_종료() throws Exception {
        // given
        when(predicate.test(any())).thenReturn(true);
        Property property = Property.builder("pass")
            .forAll("x", Domains.integers(), 4)
            .forAll("y", Domains.integers(), 3)
            .check(predicate);
        Evaluation evaluation = new Evaluation(property, Seed.of(1L), 100);

        // when
        evaluation.run();

        // then
        assertThat(evaluation.getState()).isEqualTo(EvaluationState.PASS);
        assertThat(evaluation.getEvaluations()).isEqualTo(12);
        verify(predicate, times(12)).test(any());
    }

    @Test
    void run_실패하면_FAIL_상태로_종료() throws Exception {
        // given
        when(predicate.test(any())).thenReturn(false);
        Property property = Property.builder("fail")
            .forAll("x", Domains.integers())
            .check(predicate);
        Evaluation evaluation = new Evaluation(property, Seed.of(1L), 100);

        // when
        evaluation.run();

        // then
        assertThat(evaluation.getState()).isEqualTo(EvaluationState.FAIL);
        verify(predicate, times(1)).test(any());
    }

    @Test
    void run_한정자가_없으면_조건을_한_번_평가() throws Exception {
        // given
        when(predicate.test(any())).thenReturn(true);
        Property property = Property.builder("closed").check(predicate);
        Evaluation evaluation = new Evaluation(property, Seed.of(1L), 100);

        // when
        evaluation.run();

        // then
        assertThat(evaluation.getEvaluations()).isEqualTo(1);
        assertThat(evaluation.getState()).isEqualTo(EvaluationState.PASS);
    }

    @Test
    void run_두_번_실행하면_IllegalStateException() throws Exception {
        // given
        when(predicate.test(any())).thenReturn(true);
        Property property = Property.builder("once")
            .forAll("x", Domains.booleans())
            .check(predicate);
        Evaluation evaluation = new Evaluation(property, Seed.of(1L), 100);
        evaluation.run();

        // when & then
        assertThatThrownBy(evaluation::run)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminal state");
    }
}
