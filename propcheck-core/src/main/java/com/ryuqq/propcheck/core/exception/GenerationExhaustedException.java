package com.ryuqq.propcheck.core.exception;

/**
 * 제한된 시도 횟수 안에 조건을 만족하는 값을 생성하지 못한 경우의 예외.
 *
 * <p>주로 filter 조합자가 연속 거부 한도에 도달했을 때 발생하며,
 * 무한 루프 대신 즉시 실패합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class GenerationExhaustedException extends PropertyCheckException {

    public GenerationExhaustedException(String message) {
        super(message);
    }
}
