package com.ryuqq.propcheck.core.outcome;

import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.seed.Seed;

/**
 * 실패 결과.
 *
 * <p>반례와 불만족 존재 한정은 예외가 아닌 정상적인 검사 결과로 표현됩니다.</p>
 *
 * @param seed 검사 시드 (재실행용)
 * @param kind 실패 종류
 * @param witness 증인 바인딩 (선언 순서)
 * @param evaluations 조건 평가 횟수
 * @param message 실패 메시지
 * @param cause 원인 (PREDICATE_ERROR에서만, 그 외 null)
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public record Fail(
    Seed seed,
    FailureKind kind,
    Bindings witness,
    long evaluations,
    String message,
    Throwable cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 evaluations가 음수인 경우
     */
    public Fail {
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (witness == null) {
            throw new IllegalArgumentException("witness cannot be null");
        }
        if (evaluations < 0) {
            throw new IllegalArgumentException("evaluations must be non-negative (current: " + evaluations + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }
}
