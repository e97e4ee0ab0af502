package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.GenerationExhaustedException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * 유한 시퀀스를 도메인으로 감싸는 어댑터.
 *
 * <p>생성 시점에 원소를 복사하므로 원본 컬렉션이 바뀌어도 영향을 받지 않습니다.
 * 구성상 exhaustive이며 원래 순서대로 열거합니다.
 * draw는 원소 하나를 균등하게 선택합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class FromSequenceDomain<T> implements Domain<T> {

    private final List<T> values;

    FromSequenceDomain(Iterable<? extends T> sequence) {
        if (sequence == null) {
            throw new IllegalArgumentException("sequence cannot be null");
        }
        List<T> copy = new ArrayList<>();
        for (T value : sequence) {
            copy.add(value);
        }
        this.values = Collections.unmodifiableList(copy);
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        if (values.isEmpty()) {
            throw new GenerationExhaustedException("Cannot draw from an empty sequence");
        }
        return values.get(seed.newRandom().nextInt(values.size()));
    }

    @Override
    public boolean isExhaustive() {
        return true;
    }

    @Override
    public Stream<T> enumerate() {
        return values.stream();
    }

    @Override
    public String toString() {
        return "FromSequence" + values;
    }
}
