package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 리스트의 연속 부분 리스트(slice) 도메인.
 *
 * <p>빈 부분 리스트를 포함하며 구성상 exhaustive입니다.
 * 열거 순서: 빈 리스트, 그 다음 시작 위치 a, 끝 위치 b 순으로 {@code list[a..b]}.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class SublistDomain<T> implements Domain<List<T>> {

    private final List<T> source;

    SublistDomain(List<? extends T> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = Collections.unmodifiableList(new ArrayList<>(source));
    }

    @Override
    public List<T> draw(Seed seed, DrawContext context) {
        SplittableRandom random = seed.newRandom();
        int a = random.nextInt(source.size() + 1);
        int b = random.nextInt(source.size() + 1);
        return source.subList(Math.min(a, b), Math.max(a, b));
    }

    @Override
    public boolean isExhaustive() {
        return true;
    }

    @Override
    public Stream<List<T>> enumerate() {
        int n = source.size();
        Stream<List<T>> slices = IntStream.range(0, n).boxed()
            .flatMap(a -> IntStream.range(a, n).mapToObj(b -> source.subList(a, b + 1)));
        return Stream.concat(Stream.of(List.<T>of()), slices);
    }

    @Override
    public String toString() {
        return "Sublists" + source;
    }
}
