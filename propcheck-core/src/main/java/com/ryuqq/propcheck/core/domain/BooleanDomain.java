package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.stream.Stream;

/**
 * 불리언 도메인. 구성상 exhaustive이며 {@code false, true} 순서로 열거합니다.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class BooleanDomain implements Domain<Boolean> {

    static final BooleanDomain INSTANCE = new BooleanDomain();

    private BooleanDomain() {
    }

    @Override
    public Boolean draw(Seed seed, DrawContext context) {
        return seed.newRandom().nextBoolean();
    }

    @Override
    public boolean isExhaustive() {
        return true;
    }

    @Override
    public Stream<Boolean> enumerate() {
        return Stream.of(Boolean.FALSE, Boolean.TRUE);
    }

    @Override
    public String toString() {
        return "Booleans";
    }
}
