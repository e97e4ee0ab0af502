package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RecursiveDomain 유닛 테스트.
 *
 * <ul>
 *   <li>maxDepth = k이면 자기 전개가 k번을 넘지 않음</li>
 *   <li>k = 0이면 항상 기저 분기</li>
 *   <li>union이 아닌 본문, 기저 분기 또는 재귀 분기 누락, 상호 재귀는 UsageException</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class RecursiveDomainTest {

    /**
     * 값이 곧 자기 전개 횟수인 재귀 도메인.
     */
    private static RecursiveDomain<Integer> depthCounter(int maxDepth) {
        return Domains.recursive("Depth", self -> Domains.union(
            Domains.constant(0),
            self.map(depth -> depth + 1)
        ), maxDepth);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 6, 10})
    void draw_자기_전개는_maxDepth를_넘지_않음(int maxDepth) {
        // given
        RecursiveDomain<Integer> domain = depthCounter(maxDepth);

        // when
        List<Integer> depths = domain.produce(Seed.of(maxDepth), 500);

        // then
        assertThat(depths).allSatisfy(depth -> assertThat(depth).isBetween(0, maxDepth));
        assertThat(depths).contains(0, 1);
    }

    @Test
    void draw_maxDepth가_0이면_항상_기저_분기() {
        // given
        RecursiveDomain<Integer> domain = depthCounter(0);

        // when & then
        assertThat(domain.produce(Seed.of(5L), 200)).containsOnly(0);
    }

    @Test
    void draw_깊이_0의_컨테이너는_비어있음() {
        // given
        Domain<Object> nested = Domains.<Object>recursive("Nested", self -> Domains.union(
            Domains.lists(self, 0, 3)
        ), 0);

        // when & then
        assertThat(nested.produce(Seed.of(1L), 50)).containsOnly(List.of());
    }

    @Test
    void draw_JSON_형태_값이_유한하게_생성됨() {
        // given
        Domain<Object> json = Domains.<Object>recursive("Json", self -> Domains.union(
            Domains.constant(null),
            Domains.booleans(),
            Domains.integers(),
            Domains.lists(self, 0, 4),
            Domains.mappings(Domains.identifiers(), self, 0, 4)
        ), 4);

        // when
        List<Object> values = json.produce(Seed.of(77L), 200);

        // then
        assertThat(values).allSatisfy(value -> assertThat(nesting(value)).isLessThanOrEqualTo(4));
    }

    @Test
    void withMaxDepth_새_인스턴스를_만들고_원본은_유지() {
        // given
        RecursiveDomain<Integer> original = depthCounter(6);

        // when
        RecursiveDomain<Integer> shallow = original.withMaxDepth(2);

        // then
        assertThat(shallow.remainingDepth()).isEqualTo(2);
        assertThat(original.remainingDepth()).isEqualTo(6);
        assertThat(shallow.produce(Seed.of(3L), 300)).allSatisfy(depth -> assertThat(depth).isLessThanOrEqualTo(2));
    }

    @Test
    void recursive_기본_깊이는_6() {
        // when
        RecursiveDomain<Integer> domain = Domains.recursive(self -> Domains.union(
            Domains.constant(0), self.map(depth -> depth + 1)));

        // then
        assertThat(domain.remainingDepth()).isEqualTo(Domains.DEFAULT_MAX_DEPTH);
    }

    @Test
    void recursive_기저_분기가_없으면_UsageException() {
        assertThatThrownBy(() -> Domains.<Integer>recursive("Endless", self -> Domains.union(
            self.map(depth -> depth + 1)
        ), 3))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("no base case");
    }

    @Test
    void recursive_최소_크기가_있는_자기_참조_리스트만_있으면_UsageException() {
        assertThatThrownBy(() -> Domains.<Object>recursive("NonEmpty", self -> Domains.union(
            Domains.lists(self, 1, 3)
        ), 3))
            .isInstanceOf(UsageException.class);
    }

    @Test
    void recursive_exhaustive로_표시할_수_없음() {
        // given
        RecursiveDomain<Integer> domain = depthCounter(2);

        // when & then
        assertThat(domain.isExhaustive()).isFalse();
        assertThatThrownBy(domain::exhaustive).isInstanceOf(UsageException.class);
    }

    @Test
    void recursive_본문이_union이_아니면_UsageException() {
        assertThatThrownBy(() -> Domains.<Integer>recursive("Plain", self -> Domains.integers(), 3))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("must be a union");
    }

    @Test
    void recursive_핸들을_사용하는_분기가_없으면_UsageException() {
        assertThatThrownBy(() -> Domains.<Integer>recursive("Flat", self -> Domains.union(
            Domains.integers(),
            Domains.integers(5)
        ), 3))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("no branch using its self reference");
    }

    @Test
    void recursive_컨테이너_안의_핸들도_재귀_분기로_인정() {
        // when
        RecursiveDomain<Object> nested = Domains.<Object>recursive("Nested", self -> Domains.union(
            Domains.booleans(),
            Domains.tuple(Domains.integers(), Domains.mappings(Domains.identifiers(), self))
        ), 2);

        // then
        assertThat(nested.remainingDepth()).isEqualTo(2);
    }

    @Test
    void draw_상호_재귀는_시드와_무관하게_UsageException() {
        // given
        AtomicReference<Domain<Object>> a = new AtomicReference<>();
        AtomicReference<Domain<Object>> b = new AtomicReference<>();
        a.set(Domains.<Object>recursive("A", self -> Domains.union(
            Domains.integers(),
            Domains.lists(self, 0, 2),
            Domains.lazy(b::get)
        )));
        b.set(Domains.<Object>recursive("B", self -> Domains.union(
            Domains.booleans(),
            Domains.lists(self, 0, 2),
            Domains.lazy(a::get)
        )));

        // when & then
        for (long seed = 0; seed < 200; seed++) {
            Seed each = Seed.of(seed);
            assertThatThrownBy(() -> a.get().draw(each))
                .isInstanceOf(UsageException.class)
                .hasMessageContaining("Mutually recursive")
                .hasMessageContaining("A -> B -> A");
        }
        assertThatThrownBy(() -> b.get().draw(Seed.of(0L)))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("B -> A -> B");
    }

    @Test
    void draw_컨테이너_안에_숨은_상호_재귀도_UsageException() {
        // given
        AtomicReference<Domain<Object>> b = new AtomicReference<>();
        Domain<Object> a = Domains.<Object>recursive("A", self -> Domains.union(
            Domains.constant(null),
            Domains.lists(self, 0, 2),
            Domains.lists(Domains.lazy(b::get), 0, 1)
        ));
        b.set(Domains.<Object>recursive("B", self -> Domains.union(
            Domains.booleans(),
            Domains.tuple(self, self),
            Domains.map(a, value -> value)
        )));

        // when & then
        assertThatThrownBy(() -> a.draw(Seed.of(9L)))
            .isInstanceOf(UsageException.class)
            .hasMessageContaining("Mutually recursive");
    }

    @Test
    void draw_다른_재귀_도메인을_한_방향으로_쓰는_것은_허용() {
        // given
        Domain<Integer> depth = depthCounter(2);
        Domain<Object> forest = Domains.<Object>recursive("Forest", self -> Domains.union(
            Domains.map(depth, value -> value),
            Domains.lists(self, 0, 3)
        ), 3);

        // when
        List<Object> values = forest.produce(Seed.of(12L), 200);

        // then
        assertThat(values).hasSize(200);
        assertThat(values).allSatisfy(value -> assertThat(nesting(value)).isLessThanOrEqualTo(3));
    }

    @Test
    void drawContext_전개할_때마다_깊이가_늘어나고_원본은_유지() {
        // given
        Object outer = new Object();
        Object inner = new Object();
        DrawContext root = DrawContext.root();

        // when
        DrawContext nested = root.enter(outer).enter(inner);

        // then
        assertThat(root.depth()).isZero();
        assertThat(nested.depth()).isEqualTo(2);
        assertThat(nested.isExpanding(outer)).isTrue();
        assertThat(root.isExpanding(outer)).isFalse();
    }

    @Test
    void draw_같은_선언을_형제로_두_번_쓰는_것은_상호_재귀가_아님() {
        // given
        Domain<Integer> leaf = depthCounter(2);

        // when
        Tuple pair = Domains.tuple(leaf, leaf).draw(Seed.of(4L));

        // then
        assertThat(pair.size()).isEqualTo(2);
    }

    private static int nesting(Object value) {
        int deepest = 0;
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                deepest = Math.max(deepest, 1 + nesting(element));
            }
        } else if (value instanceof Map) {
            for (Object element : ((Map<?, ?>) value).values()) {
                deepest = Math.max(deepest, 1 + nesting(element));
            }
        }
        return deepest;
    }
}
