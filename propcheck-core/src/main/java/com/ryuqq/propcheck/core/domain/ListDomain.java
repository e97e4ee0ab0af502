package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 크기가 [minSize, maxSize]인 리스트 도메인.
 *
 * <p><strong>생성 알고리즘:</strong></p>
 * <ol>
 *   <li>자식 시드 0으로 크기 결정</li>
 *   <li>j번째 원소는 자식 시드 (1 + j)로 원소 도메인에서 draw</li>
 * </ol>
 *
 * <p>원소 도메인이 막혔고 minSize가 0이면 빈 리스트를 생성합니다.
 * 재귀 도메인 안의 리스트는 이 규칙으로 종료됩니다.</p>
 *
 * <p>원소 도메인이 exhaustive일 때만 {@link #exhaustive()}로 표시할 수 있으며,
 * 크기 순으로 모든 리스트를 열거합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class ListDomain<T> implements Domain<List<T>> {

    private final Domain<T> element;
    private final int minSize;
    private final int maxSize;
    private final boolean exhaustive;

    ListDomain(Domain<T> element, int minSize, int maxSize, boolean exhaustive) {
        if (element == null) {
            throw new IllegalArgumentException("element domain cannot be null");
        }
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize must be non-negative (current: " + minSize + ")");
        }
        if (maxSize < minSize) {
            throw new IllegalArgumentException(
                "maxSize must be >= minSize (min: " + minSize + ", max: " + maxSize + ")"
            );
        }
        this.element = element;
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.exhaustive = exhaustive;
    }

    @Override
    public List<T> draw(Seed seed, DrawContext context) {
        if (element.isBlocked()) {
            if (minSize > 0) {
                throw new UsageException("Recursion depth exhausted inside " + this);
            }
            return List.of();
        }
        int size = seed.child(0).newRandom().nextInt(minSize, maxSize + 1);
        List<T> values = new ArrayList<>(size);
        for (int j = 0; j < size; j++) {
            values.add(element.draw(seed.child(1 + j), context));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public boolean isExhaustive() {
        return exhaustive;
    }

    @Override
    public Stream<List<T>> enumerate() {
        if (!exhaustive) {
            return Domain.super.enumerate();
        }
        List<T> values = element.enumerate().collect(Collectors.toList());
        return IntStream.rangeClosed(minSize, maxSize).boxed()
            .flatMap(size -> Products.<T>cartesian(Collections.nCopies(size, values)));
    }

    @Override
    public Domain<List<T>> exhaustive() {
        if (exhaustive) {
            return this;
        }
        if (!element.isExhaustive()) {
            throw new UsageException("List element domain is not exhaustive: " + element);
        }
        return new ListDomain<>(element, minSize, maxSize, true);
    }

    @Override
    public boolean isBlocked() {
        return minSize > 0 && element.isBlocked();
    }

    Domain<T> element() {
        return element;
    }

    @Override
    public String toString() {
        return "List(" + element + ", " + minSize + ".." + maxSize + ")";
    }
}
