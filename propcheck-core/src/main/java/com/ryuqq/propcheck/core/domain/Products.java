package com.ryuqq.propcheck.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * 열거용 데카르트 곱 유틸리티.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class Products {

    private Products() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 축 목록의 데카르트 곱을 지연 스트림으로 생성.
     *
     * <p>마지막 축이 가장 빠르게 변합니다. 축이 없으면 빈 조합 하나를 생성합니다.</p>
     *
     * @param axes 축별 값 목록
     * @param <E> 원소 타입
     * @return 조합 스트림 (각 조합은 불변 목록)
     */
    static <E> Stream<List<E>> cartesian(List<? extends List<? extends E>> axes) {
        return extend(axes, 0, List.of());
    }

    private static <E> Stream<List<E>> extend(List<? extends List<? extends E>> axes, int axis, List<E> prefix) {
        if (axis == axes.size()) {
            return Stream.of(prefix);
        }
        return axes.get(axis).stream().flatMap(value -> {
            List<E> next = new ArrayList<>(prefix.size() + 1);
            next.addAll(prefix);
            next.add(value);
            return extend(axes, axis + 1, Collections.unmodifiableList(next));
        });
    }
}
