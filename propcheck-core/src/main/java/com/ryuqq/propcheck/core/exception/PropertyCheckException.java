package com.ryuqq.propcheck.core.exception;

/**
 * 속성 검사 인프라 오류의 최상위 예외.
 *
 * <p>이 예외 계층은 검사 자체를 진행할 수 없는 치명적인 오류를 나타냅니다.
 * 반례(counterexample)나 만족되지 않은 존재 한정은 예외가 아니라
 * {@link com.ryuqq.propcheck.core.outcome.Fail} 결과로 표현됩니다.</p>
 *
 * <p><strong>하위 예외:</strong></p>
 * <ul>
 *   <li>{@link UsageException}: 잘못된 API 사용</li>
 *   <li>{@link NotExhaustibleException}: 전수 열거 불가능한 도메인의 열거 요청</li>
 *   <li>{@link GenerationExhaustedException}: 재시도 한도 내 값 생성 실패</li>
 * </ul>
 *
 * <p>인프라 오류는 재시도하지 않고 현재 검사를 즉시 중단합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public abstract class PropertyCheckException extends RuntimeException {

    protected PropertyCheckException(String message) {
        super(message);
    }

    protected PropertyCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
