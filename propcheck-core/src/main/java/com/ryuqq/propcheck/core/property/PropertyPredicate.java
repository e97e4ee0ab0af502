package com.ryuqq.propcheck.core.property;

import com.ryuqq.propcheck.core.expression.Bindings;

/**
 * 속성의 최종 조건.
 *
 * <p>모든 한정 변수가 바인딩된 상태에서 호출됩니다.
 * 예외를 던지면 반례가 아니라 PREDICATE_ERROR 실패로 기록됩니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PropertyPredicate {

    /**
     * 조건 평가.
     *
     * @param bindings 선언 순서로 바인딩된 모든 변수
     * @return 성립 여부
     * @throws Exception 조건 평가 중 오류
     */
    boolean test(Bindings bindings) throws Exception;
}
