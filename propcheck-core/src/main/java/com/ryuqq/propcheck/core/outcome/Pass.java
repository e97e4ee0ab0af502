package com.ryuqq.propcheck.core.outcome;

import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.seed.Seed;

/**
 * 성공 결과.
 *
 * @param seed 검사 시드
 * @param witness 존재 한정을 만족시킨 바인딩 (전칭만 있는 경우 빈 Bindings)
 * @param evaluations 조건 평가 횟수
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public record Pass(
    Seed seed,
    Bindings witness,
    long evaluations
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException seed 또는 witness가 null이거나 evaluations가 음수인 경우
     */
    public Pass {
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        if (witness == null) {
            throw new IllegalArgumentException("witness cannot be null");
        }
        if (evaluations < 0) {
            throw new IllegalArgumentException("evaluations must be non-negative (current: " + evaluations + ")");
        }
    }
}
