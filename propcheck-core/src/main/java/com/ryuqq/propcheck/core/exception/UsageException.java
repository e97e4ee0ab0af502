package com.ryuqq.propcheck.core.exception;

/**
 * 라이브러리를 잘못 사용한 경우의 예외.
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>전수 열거 불가능한 도메인에 exists 적용</li>
 *   <li>전수 열거를 지원하지 않는 도메인을 exhaustive로 표시</li>
 *   <li>상호 재귀 도메인 정의 감지</li>
 *   <li>재귀 도메인에 기저 분기(base case)가 없음</li>
 *   <li>바인딩되지 않았거나 선언되지 않은 변수 참조</li>
 *   <li>같은 변수를 두 번 한정 (shadowing)</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public class UsageException extends PropertyCheckException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
