package com.ryuqq.propcheck.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * tuple 도메인이 생성하는 불변 값.
 *
 * <p>각 위치의 값은 null일 수 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Tuple pair = Tuple.of(1, "a");
 * int first = pair.get(0, Integer.class);
 * String second = pair.get(1, String.class);
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class Tuple {

    private final List<Object> values;

    private Tuple(List<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Tuple 생성.
     *
     * @param values 위치별 값
     * @return Tuple 인스턴스
     */
    public static Tuple of(Object... values) {
        return new Tuple(Arrays.asList(values));
    }

    /**
     * 목록으로부터 Tuple 생성.
     *
     * @param values 위치별 값
     * @return Tuple 인스턴스
     * @throws IllegalArgumentException values가 null인 경우
     */
    public static Tuple fromList(List<?> values) {
        return new Tuple(values);
    }

    /**
     * 위치의 값 조회.
     *
     * @param index 위치 (0부터)
     * @return 값
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * 기대 타입으로 위치의 값 조회.
     *
     * @param index 위치 (0부터)
     * @param type 기대하는 값 타입
     * @param <E> 기대하는 값 타입
     * @return 값
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     * @throws ClassCastException 값의 타입이 다른 경우
     */
    public <E> E get(int index, Class<E> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return type.cast(values.get(index));
    }

    /**
     * 원소 개수.
     *
     * @return 크기
     */
    public int size() {
        return values.size();
    }

    /**
     * 불변 값 목록.
     *
     * @return 값 목록
     */
    public List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tuple tuple = (Tuple) o;
        return values.equals(tuple.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
