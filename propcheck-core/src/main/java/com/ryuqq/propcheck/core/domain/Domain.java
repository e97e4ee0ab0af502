package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.NotExhaustibleException;
import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 값 집합(도메인)의 능력 계약.
 *
 * <p>Domain은 유한하거나 무한할 수 있는 값 집합을 표현하며, 시드로부터
 * 결정적인 값 시퀀스를 생성합니다. exhaustive로 표시된 도메인은 전체 열거도 지원합니다.</p>
 *
 * <p><strong>핵심 보장:</strong></p>
 * <ul>
 *   <li>동일한 (도메인, 시드, 개수)는 항상 동일한 시퀀스를 생성 (비트 단위 재현성)</li>
 *   <li>{@code produce(seed, count)}의 i번째 값은 {@code draw(seed.child(i))}와 같음</li>
 *   <li>도메인 인스턴스는 불변이며 공유 가변 상태를 갖지 않음</li>
 *   <li>합성 도메인은 하위 컴포넌트마다 독립된 자식 시드를 파생</li>
 * </ul>
 *
 * <p><strong>Exhaustive 표시:</strong> 작성자가 명시적으로 표시해야 하며,
 * 코어는 이 플래그를 신뢰할 뿐 유한성을 추론하지 않습니다.
 * 불리언, 시퀀스 어댑터처럼 구성상 유한한 도메인은 처음부터 exhaustive입니다.</p>
 *
 * <p>Sealed interface로 정의되어 구현 변형이 닫혀 있습니다. 임의의 외부 시퀀스는
 * {@link Domains#fromSequence(Iterable)}, 임의의 생성기는
 * {@link Domains#generated(String, Function)} 어댑터를 통해 도메인이 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Domain&lt;Integer&gt; evens = Domains.integers(0, 100).filter(x -&gt; x % 2 == 0);
 * List&lt;Integer&gt; samples = evens.produce(Seed.of(7L), 10);
 *
 * Domain&lt;Integer&gt; digits = Domains.integers(0, 9).exhaustive();
 * digits.enumerate().forEach(System.out::println);
 * </pre>
 *
 * @param <T> 도메인 값 타입
 * @author PropCheck Team
 * @since 1.0.0
 */
public sealed interface Domain<T>
    permits IntegerDomain, BooleanDomain, ConstantDomain, IdentifierDomain, GeneratedDomain,
            FromSequenceDomain, SublistDomain, UnionDomain, MappedDomain, FilteredDomain,
            TupleDomain, ListDomain, MappingDomain, RecursiveDomain, SelfReference, LazyDomain {

    /**
     * 시드로부터 값 하나를 생성.
     *
     * <p>합성 도메인은 하위 도메인을 그릴 때 같은 context를 그대로 전달합니다.</p>
     *
     * @param seed 시드
     * @param context 재귀 전개 상태
     * @return 생성된 값
     * @throws com.ryuqq.propcheck.core.exception.PropertyCheckException 값을 생성할 수 없는 경우
     */
    T draw(Seed seed, DrawContext context);

    /**
     * 루트 context로 값 하나를 생성.
     *
     * @param seed 시드
     * @return 생성된 값
     */
    default T draw(Seed seed) {
        return draw(seed, DrawContext.root());
    }

    /**
     * 시드로부터 count개의 값을 생성.
     *
     * @param seed 시드
     * @param count 생성할 값의 개수 (0 이상)
     * @return 불변 값 목록 (null 원소 허용)
     * @throws IllegalArgumentException seed가 null이거나 count가 음수인 경우
     */
    default List<T> produce(Seed seed, int count) {
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        List<T> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(draw(seed.child(i)));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * 전수 열거 가능 여부.
     *
     * @return exhaustive로 표시된 경우 true
     */
    default boolean isExhaustive() {
        return false;
    }

    /**
     * 도메인 전체를 열거.
     *
     * <p>호출할 때마다 새 스트림을 반환합니다. 열거 순서는 결정적입니다.</p>
     *
     * @return 전체 값 스트림
     * @throws NotExhaustibleException exhaustive로 표시되지 않은 경우
     */
    default Stream<T> enumerate() {
        throw new NotExhaustibleException(toString());
    }

    /**
     * exhaustive로 표시된 도메인 반환.
     *
     * <p>조합자(union, map, filter, tuple)는 하위 도메인으로부터 표시를 물려받으므로,
     * 하위 도메인이 모두 exhaustive일 때만 자기 자신을 반환합니다.</p>
     *
     * @return exhaustive 도메인
     * @throws UsageException 이 도메인이 전수 열거를 지원하지 않는 경우
     */
    default Domain<T> exhaustive() {
        if (isExhaustive()) {
            return this;
        }
        throw new UsageException("Domain cannot be marked as exhaustive: " + this);
    }

    /**
     * 재귀 깊이 한도 때문에 더 이상 값을 만들 수 없는지 여부.
     *
     * <p>union은 막힌(blocked) 분기를 선택하지 않습니다.</p>
     *
     * @return 막힌 경우 true
     */
    default boolean isBlocked() {
        return false;
    }

    /**
     * 각 값에 함수를 적용한 도메인 생성.
     *
     * @param mapper 변환 함수
     * @param <R> 변환 결과 타입
     * @return MappedDomain
     */
    default <R> Domain<R> map(Function<? super T, ? extends R> mapper) {
        return Domains.map(this, mapper);
    }

    /**
     * 조건을 만족하는 값만 생성하는 도메인 생성 (기본 재시도 한도).
     *
     * @param predicate 조건
     * @return FilteredDomain
     */
    default Domain<T> filter(Predicate<? super T> predicate) {
        return Domains.filter(this, predicate);
    }
}
