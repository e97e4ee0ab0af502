package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 닫힌 구간 [min, max]의 정수 도메인.
 *
 * <p>구간 안에서 균등하게 값을 뽑습니다.
 * {@link #exhaustive()}로 표시하면 min부터 max까지 오름차순으로 열거합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class IntegerDomain implements Domain<Integer> {

    private final int min;
    private final int max;
    private final boolean exhaustive;

    IntegerDomain(int min, int max, boolean exhaustive) {
        if (min > max) {
            throw new IllegalArgumentException(
                "min must be <= max (min: " + min + ", max: " + max + ")"
            );
        }
        this.min = min;
        this.max = max;
        this.exhaustive = exhaustive;
    }

    @Override
    public Integer draw(Seed seed, DrawContext context) {
        return (int) seed.newRandom().nextLong(min, (long) max + 1L);
    }

    @Override
    public boolean isExhaustive() {
        return exhaustive;
    }

    @Override
    public Stream<Integer> enumerate() {
        if (!exhaustive) {
            return Domain.super.enumerate();
        }
        return IntStream.rangeClosed(min, max).boxed();
    }

    @Override
    public Domain<Integer> exhaustive() {
        return exhaustive ? this : new IntegerDomain(min, max, true);
    }

    int min() {
        return min;
    }

    int max() {
        return max;
    }

    @Override
    public String toString() {
        return "Integers[" + min + ".." + max + "]" + (exhaustive ? "!" : "");
    }
}
