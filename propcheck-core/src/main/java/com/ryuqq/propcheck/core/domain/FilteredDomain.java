package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.GenerationExhaustedException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 조건을 만족하는 값만 생성하는 도메인.
 *
 * <p>k번째 시도는 원본을 자식 시드 k로 그립니다. 연속 거부가 maxAttempts에 도달하면
 * 무한 루프 대신 {@link GenerationExhaustedException}으로 실패합니다.</p>
 *
 * <p>exhaustive 원본의 열거는 조건으로 걸러서 그대로 사용합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class FilteredDomain<T> implements Domain<T> {

    private final Domain<T> source;
    private final Predicate<? super T> predicate;
    private final int maxAttempts;

    FilteredDomain(Domain<T> source, Predicate<? super T> predicate, int maxAttempts) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        this.source = source;
        this.predicate = predicate;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            T candidate = source.draw(seed.child(attempt), context);
            if (predicate.test(candidate)) {
                return candidate;
            }
        }
        throw new GenerationExhaustedException(
            String.format("No value satisfying the filter after %d attempts from %s (seed: %d)",
                maxAttempts, source, seed.getValue())
        );
    }

    @Override
    public boolean isExhaustive() {
        return source.isExhaustive();
    }

    @Override
    public Stream<T> enumerate() {
        return source.enumerate().filter(predicate);
    }

    @Override
    public boolean isBlocked() {
        return source.isBlocked();
    }

    int maxAttempts() {
        return maxAttempts;
    }

    Domain<T> source() {
        return source;
    }

    @Override
    public String toString() {
        return "Filter(" + source + ")";
    }
}
