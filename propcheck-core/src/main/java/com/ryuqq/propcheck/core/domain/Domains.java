package com.ryuqq.propcheck.core.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 내장 도메인 생성자 모음.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>정수: [0, 10000]</li>
 *   <li>컨테이너 크기: [0, 20]</li>
 *   <li>filter 연속 거부 한도: 100</li>
 *   <li>재귀 최대 깊이: 6</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Domain&lt;Integer&gt; small = Domains.integers(0, 9).exhaustive();
 * Domain&lt;List&lt;Integer&gt;&gt; lists = Domains.lists(Domains.integers(), 1, 5);
 * Domain&lt;Object&gt; json = Domains.recursive("Json", self -&gt; Domains.union(
 *     Domains.constant(null),
 *     Domains.booleans(),
 *     Domains.integers(),
 *     Domains.lists(self),
 *     Domains.mappings(Domains.identifiers(), self)
 * ));
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class Domains {

    /**
     * 정수 도메인 기본 최댓값.
     */
    public static final int DEFAULT_MAX_INTEGER = 10_000;

    /**
     * 컨테이너 기본 최대 크기.
     */
    public static final int DEFAULT_MAX_SIZE = 20;

    /**
     * filter 기본 연속 거부 한도.
     */
    public static final int DEFAULT_FILTER_ATTEMPTS = 100;

    /**
     * 재귀 도메인 기본 최대 깊이.
     */
    public static final int DEFAULT_MAX_DEPTH = 6;

    // Utility class - prevent instantiation
    private Domains() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ------------------------------------------------------------------
    // Leaf domains
    // ------------------------------------------------------------------

    public static Domain<Integer> integers() {
        return new IntegerDomain(0, DEFAULT_MAX_INTEGER, false);
    }

    /**
     * [0, max] 정수 도메인.
     *
     * @param max 최댓값 (0 이상)
     * @return 정수 도메인
     * @throws IllegalArgumentException max가 음수인 경우
     */
    public static Domain<Integer> integers(int max) {
        return new IntegerDomain(0, max, false);
    }

    /**
     * [min, max] 정수 도메인.
     *
     * @param min 최솟값
     * @param max 최댓값
     * @return 정수 도메인
     * @throws IllegalArgumentException min &gt; max인 경우
     */
    public static Domain<Integer> integers(int min, int max) {
        return new IntegerDomain(min, max, false);
    }

    public static Domain<Boolean> booleans() {
        return BooleanDomain.INSTANCE;
    }

    /**
     * 단일 값 도메인.
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return 상수 도메인
     */
    public static <T> Domain<T> constant(T value) {
        return new ConstantDomain<>(value);
    }

    public static Domain<String> identifiers() {
        return new IdentifierDomain(1, 8);
    }

    public static Domain<String> identifiers(int minLength, int maxLength) {
        return new IdentifierDomain(minLength, maxLength);
    }

    /**
     * 작성자 정의 생성 함수를 도메인으로 감쌈.
     *
     * <p>generator는 전달받은 난수 생성기만 사용해야 재현성이 보장됩니다.</p>
     *
     * @param description 도메인 설명 (보고용)
     * @param generator 생성 함수
     * @param <T> 값 타입
     * @return 생성 도메인
     * @throws IllegalArgumentException description이 비었거나 generator가 null인 경우
     */
    public static <T> Domain<T> generated(String description, Function<SplittableRandom, ? extends T> generator) {
        return new GeneratedDomain<>(description, generator);
    }

    // ------------------------------------------------------------------
    // Finite sequence adapters
    // ------------------------------------------------------------------

    /**
     * 유한 시퀀스를 exhaustive 도메인으로 감쌈.
     *
     * @param sequence 유한 시퀀스
     * @param <T> 값 타입
     * @return exhaustive 도메인
     * @throws IllegalArgumentException sequence가 null인 경우
     */
    public static <T> Domain<T> fromSequence(Iterable<? extends T> sequence) {
        return new FromSequenceDomain<>(sequence);
    }

    @SafeVarargs
    public static <T> Domain<T> of(T... values) {
        return new FromSequenceDomain<>(Arrays.asList(values));
    }

    public static <T> Domain<List<T>> sublists(List<? extends T> source) {
        return new SublistDomain<>(source);
    }

    // ------------------------------------------------------------------
    // Combinators
    // ------------------------------------------------------------------

    /**
     * 여러 도메인의 합집합.
     *
     * @param branches 분기 도메인 (1개 이상)
     * @param <T> 값 타입
     * @return union 도메인
     * @throws IllegalArgumentException 분기가 없거나 null 분기가 있는 경우
     */
    @SafeVarargs
    public static <T> Domain<T> union(Domain<? extends T>... branches) {
        if (branches == null) {
            throw new IllegalArgumentException("branches cannot be null");
        }
        return new UnionDomain<>(Arrays.asList(branches));
    }

    public static <S, T> Domain<T> map(Domain<S> source, Function<? super S, ? extends T> mapper) {
        return new MappedDomain<>(source, mapper);
    }

    public static <T> Domain<T> filter(Domain<T> source, Predicate<? super T> predicate) {
        return new FilteredDomain<>(source, predicate, DEFAULT_FILTER_ATTEMPTS);
    }

    /**
     * 조건을 만족하는 값만 생성하는 도메인.
     *
     * @param source 원본 도메인
     * @param predicate 조건
     * @param maxAttempts 연속 거부 한도 (양수)
     * @param <T> 값 타입
     * @return filter 도메인
     * @throws IllegalArgumentException 인자가 null이거나 maxAttempts가 양수가 아닌 경우
     */
    public static <T> Domain<T> filter(Domain<T> source, Predicate<? super T> predicate, int maxAttempts) {
        return new FilteredDomain<>(source, predicate, maxAttempts);
    }

    public static Domain<Tuple> tuple(Domain<?>... components) {
        if (components == null) {
            throw new IllegalArgumentException("components cannot be null");
        }
        return new TupleDomain(Arrays.asList(components));
    }

    public static <T> Domain<List<T>> lists(Domain<T> element) {
        return new ListDomain<>(element, 0, DEFAULT_MAX_SIZE, false);
    }

    /**
     * 크기가 [minSize, maxSize]인 리스트 도메인.
     *
     * @param element 원소 도메인
     * @param minSize 최소 크기 (0 이상)
     * @param maxSize 최대 크기 (minSize 이상)
     * @param <T> 원소 타입
     * @return 리스트 도메인
     * @throws IllegalArgumentException 크기 범위가 잘못된 경우
     */
    public static <T> Domain<List<T>> lists(Domain<T> element, int minSize, int maxSize) {
        return new ListDomain<>(element, minSize, maxSize, false);
    }

    public static <K, V> Domain<Map<K, V>> mappings(Domain<K> keys, Domain<V> values) {
        return new MappingDomain<>(keys, values, 0, DEFAULT_MAX_SIZE);
    }

    public static <K, V> Domain<Map<K, V>> mappings(Domain<K> keys, Domain<V> values, int minSize, int maxSize) {
        return new MappingDomain<>(keys, values, minSize, maxSize);
    }

    // ------------------------------------------------------------------
    // Recursion
    // ------------------------------------------------------------------

    public static <T> RecursiveDomain<T> recursive(Function<SelfReference<T>, ? extends Domain<T>> factory) {
        return RecursiveDomain.declare("Recursive", factory, DEFAULT_MAX_DEPTH);
    }

    public static <T> RecursiveDomain<T> recursive(Function<SelfReference<T>, ? extends Domain<T>> factory, int maxDepth) {
        return RecursiveDomain.declare("Recursive", factory, maxDepth);
    }

    public static <T> RecursiveDomain<T> recursive(String name, Function<SelfReference<T>, ? extends Domain<T>> factory) {
        return RecursiveDomain.declare(name, factory, DEFAULT_MAX_DEPTH);
    }

    /**
     * 최대 깊이를 지정한 재귀 도메인 선언.
     *
     * @param name 선언 이름 (보고용)
     * @param factory 자기 참조 핸들을 받아 본문 도메인을 만드는 함수
     * @param maxDepth 최대 자기 전개 횟수 (0이면 항상 기저 분기)
     * @param <T> 값 타입
     * @return 재귀 도메인
     * @throws IllegalArgumentException 인자가 잘못된 경우
     * @throws com.ryuqq.propcheck.core.exception.UsageException 본문이 union이 아니거나, 기저 분기 또는 핸들을 사용하는 분기가 없는 경우
     */
    public static <T> RecursiveDomain<T> recursive(
        String name,
        Function<SelfReference<T>, ? extends Domain<T>> factory,
        int maxDepth
    ) {
        return RecursiveDomain.declare(name, factory, maxDepth);
    }

    /**
     * draw 시점에 해석되는 지연 참조.
     *
     * @param target 대상 도메인 공급자
     * @param <T> 값 타입
     * @return 지연 도메인
     */
    public static <T> Domain<T> lazy(Supplier<? extends Domain<T>> target) {
        return new LazyDomain<>(target);
    }
}
