package com.ryuqq.propcheck.core.outcome;

import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.seed.Seed;

/**
 * 속성 검사 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Pass}: 탐색한 모든 바인딩에서 속성이 성립</li>
 *   <li>{@link Fail}: 반례 발견, 존재 한정 불만족, 또는 조건 평가 오류</li>
 * </ul>
 *
 * <p>두 결과 모두 검사에 사용된 시드를 담고 있어, 같은 시드로 재실행하면
 * 동일한 결과를 재현할 수 있습니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = checker.check(property);
 * if (outcome instanceof Fail fail) {
 *     System.out.println(fail.kind() + " " + fail.witness() + " (seed " + fail.seed().getValue() + ")");
 * }
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Pass, Fail {

    /**
     * 검사에 사용된 시드.
     *
     * @return Seed
     */
    Seed seed();

    /**
     * 증인 바인딩 (선언 순서).
     *
     * @return 실패 시 반례 바인딩, 존재 한정 성공 시 만족 바인딩, 그 외에는 빈 Bindings
     */
    Bindings witness();

    /**
     * 조건 평가 횟수.
     *
     * @return 평가 횟수
     */
    long evaluations();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isPass() {
        return this instanceof Pass;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
