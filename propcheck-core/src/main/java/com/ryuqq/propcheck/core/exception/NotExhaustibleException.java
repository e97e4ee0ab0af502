package com.ryuqq.propcheck.core.exception;

/**
 * exhaustive로 표시되지 않은 도메인에 {@code enumerate()}를 호출한 경우의 예외.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class NotExhaustibleException extends UsageException {

    public NotExhaustibleException(String domainDescription) {
        super("Domain is not marked as exhaustive: " + domainDescription);
    }
}
