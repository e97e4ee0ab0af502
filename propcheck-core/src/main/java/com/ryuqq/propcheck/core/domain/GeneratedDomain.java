package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.SplittableRandom;
import java.util.function.Function;

/**
 * 작성자가 제공한 생성 함수를 감싸는 어댑터 도메인.
 *
 * <p>생성 함수는 시드로 초기화된 난수 생성기만 사용해야 재현성이 유지됩니다.
 * 유한성을 알 수 없으므로 exhaustive로 표시할 수 없습니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class GeneratedDomain<T> implements Domain<T> {

    private final String description;
    private final Function<SplittableRandom, ? extends T> generator;

    GeneratedDomain(String description, Function<SplittableRandom, ? extends T> generator) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        this.description = description;
        this.generator = generator;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        return generator.apply(seed.newRandom());
    }

    @Override
    public String toString() {
        return description;
    }
}
