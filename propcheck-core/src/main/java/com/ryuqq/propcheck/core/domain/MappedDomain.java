package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 원본 도메인의 값에 함수를 적용한 도메인.
 *
 * <p>원본을 같은 시드로 그린 뒤 변환하므로 결정성이 유지됩니다.
 * exhaustive 여부와 막힘 여부는 원본을 따릅니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class MappedDomain<S, T> implements Domain<T> {

    private final Domain<S> source;
    private final Function<? super S, ? extends T> mapper;

    MappedDomain(Domain<S> source, Function<? super S, ? extends T> mapper) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.source = source;
        this.mapper = mapper;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        return mapper.apply(source.draw(seed, context));
    }

    @Override
    public boolean isExhaustive() {
        return source.isExhaustive();
    }

    @Override
    public Stream<T> enumerate() {
        return source.enumerate().map(mapper);
    }

    @Override
    public boolean isBlocked() {
        return source.isBlocked();
    }

    Domain<S> source() {
        return source;
    }

    @Override
    public String toString() {
        return "Map(" + source + ")";
    }
}
