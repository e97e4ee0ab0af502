package com.ryuqq.propcheck.core.statemachine;

/**
 * 속성 검사 한 번의 평가 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INIT
 *    │
 *    ▼ (첫 한정자 진입)
 * SAMPLING ◄──────────┐
 *    │                │ (다음 샘플)
 *    ▼                │
 * PREDICATE_CHECK ────┘
 *    │
 *    ├─► PASS
 *    │
 *    └─► FAIL
 * </pre>
 *
 * <p>SAMPLING에서 바로 종료 상태로 갈 수 있습니다 (예: 빈 도메인, 존재 한정 불만족).</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public enum EvaluationState {

    /**
     * 시작 전.
     */
    INIT,

    /**
     * 한정자 도메인에서 값을 뽑는 중.
     */
    SAMPLING,

    /**
     * 조건 평가 중.
     */
    PREDICATE_CHECK,

    /**
     * 성공.
     */
    PASS,

    /**
     * 실패.
     */
    FAIL;

    /**
     * 종료 상태인지 확인.
     *
     * @return PASS 또는 FAIL인 경우 true
     */
    public boolean isTerminal() {
        return this == PASS || this == FAIL;
    }
}
