package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.stream.Stream;

/**
 * 단일 값 도메인 (null 허용).
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class ConstantDomain<T> implements Domain<T> {

    private final T value;

    ConstantDomain(T value) {
        this.value = value;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        return value;
    }

    @Override
    public boolean isExhaustive() {
        return true;
    }

    @Override
    public Stream<T> enumerate() {
        return Stream.of(value);
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}
