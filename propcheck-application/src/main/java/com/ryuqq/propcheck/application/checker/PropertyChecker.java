package com.ryuqq.propcheck.application.checker;

import com.ryuqq.propcheck.core.outcome.Outcome;
import com.ryuqq.propcheck.core.property.Property;

/**
 * 속성 검사기.
 *
 * <p>Property를 평가해 Pass 또는 Fail을 반환합니다. 반례와 불만족 존재 한정은
 * 예외가 아니라 {@link com.ryuqq.propcheck.core.outcome.Fail} 결과입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = checker.check(property);
 * if (outcome.isFail()) {
 *     // 같은 시드로 재실행하면 같은 반례가 재현됨
 *     Outcome replay = checker.check(property, outcome.seed().getValue());
 * }
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public interface PropertyChecker {

    /**
     * 무작위 시드와 기본 샘플 수로 검사.
     *
     * @param property 검사할 속성
     * @return Outcome (생성된 시드 포함)
     * @throws IllegalArgumentException property가 null인 경우
     * @throws com.ryuqq.propcheck.core.exception.UsageException 속성 선언이 잘못된 경우
     */
    default Outcome check(Property property) {
        return check(property, CheckOptions.defaults());
    }

    /**
     * 주어진 시드로 검사 (재실행).
     *
     * @param property 검사할 속성
     * @param seed 시드 값
     * @return Outcome
     */
    default Outcome check(Property property, long seed) {
        return check(property, CheckOptions.defaults().withSeed(seed));
    }

    /**
     * 옵션을 지정해 검사.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>options.seed가 없으면 새 시드 생성</li>
     *   <li>한정자를 바깥에서 안쪽으로 중첩 평가</li>
     *   <li>첫 반례(전칭) 또는 첫 만족 바인딩(존재)에서 종료</li>
     * </ol>
     *
     * @param property 검사할 속성
     * @param options 시드와 샘플 수
     * @return Outcome
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.propcheck.core.exception.UsageException 속성 선언이 잘못된 경우
     * @throws com.ryuqq.propcheck.core.exception.GenerationExhaustedException 값 생성 한도를 넘은 경우
     */
    Outcome check(Property property, CheckOptions options);
}
