package com.ryuqq.propcheck.core.outcome;

/**
 * 실패 종류.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 전칭 한정의 반례 발견. 증인은 반례 바인딩 전체.
     */
    COUNTEREXAMPLE,

    /**
     * 존재 한정이 도메인을 모두 열거했지만 만족하는 원소가 없음.
     * 증인은 바깥 한정자의 바인딩뿐입니다.
     */
    EXISTENTIAL_UNSATISFIED,

    /**
     * 조건 평가 중 예외 발생. 증인은 예외 당시의 바인딩.
     */
    PREDICATE_ERROR
}
