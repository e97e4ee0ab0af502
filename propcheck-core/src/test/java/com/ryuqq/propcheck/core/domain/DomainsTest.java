package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.GenerationExhaustedException;
import com.ryuqq.propcheck.core.exception.NotExhaustibleException;
import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 기본 도메인 유닛 테스트.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class DomainsTest {

    private static final Seed SEED = Seed.of(2024L);

    // ========== 결정성 ==========

    @Test
    void produce_같은_시드와_개수면_같은_시퀀스() {
        // given
        Domain<Integer> integers = Domains.integers();

        // when
        List<Integer> first = integers.produce(SEED, 100);
        List<Integer> second = integers.produce(Seed.of(2024L), 100);

        // then
        assertThat(first).isEqualTo(second);
        assertThat(integers.produce(Seed.of(2025L), 100)).isNotEqualTo(first);
    }

    @Test
    void produce_음수_개수면_예외() {
        assertThatThrownBy(() -> Domains.integers().produce(SEED, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("count must be non-negative (current: -1)");
    }

    @Test
    void produce_null_원소_허용() {
        assertThat(Domains.constant(null).produce(SEED, 3)).containsExactly(null, null, null);
    }

    // ========== 정수 ==========

    @Test
    void integers_기본_범위는_0부터_10000() {
        assertThat(Domains.integers().produce(SEED, 500))
            .allSatisfy(value -> assertThat(value).isBetween(0, Domains.DEFAULT_MAX_INTEGER));
    }

    @Test
    void integers_범위_안의_값만_생성() {
        assertThat(Domains.integers(-3, 3).produce(SEED, 200))
            .allSatisfy(value -> assertThat(value).isBetween(-3, 3))
            .contains(-3, 3);
    }

    @Test
    void integers_min이_max보다_크면_예외() {
        assertThatThrownBy(() -> Domains.integers(5, 4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("min must be <= max");
        assertThatThrownBy(() -> Domains.integers(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void integers_exhaustive_표시하면_전체_열거() {
        // when
        Domain<Integer> digits = Domains.integers(1, 8).exhaustive();

        // then
        assertThat(digits.isExhaustive()).isTrue();
        assertThat(digits.enumerate()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(Domains.integers(1, 8).isExhaustive()).isFalse();
    }

    @Test
    void enumerate_exhaustive가_아니면_NotExhaustibleException() {
        assertThatThrownBy(() -> Domains.integers().enumerate())
            .isInstanceOf(NotExhaustibleException.class)
            .isInstanceOf(UsageException.class);
    }

    // ========== 구성상 유한한 도메인 ==========

    @Test
    void booleans_처음부터_exhaustive() {
        assertThat(Domains.booleans().isExhaustive()).isTrue();
        assertThat(Domains.booleans().enumerate()).containsExactly(false, true);
        assertThat(Domains.booleans().produce(SEED, 100)).contains(false, true);
    }

    @Test
    void fromSequence_원본을_복사해_열거() {
        // given
        List<String> colors = new ArrayList<>(List.of("red", "green", "blue"));
        Domain<String> domain = Domains.fromSequence(colors);

        // when
        colors.add("black");

        // then
        assertThat(domain.isExhaustive()).isTrue();
        assertThat(domain.enumerate()).containsExactly("red", "green", "blue");
        assertThat(domain.produce(SEED, 50)).isSubsetOf("red", "green", "blue");
    }

    @Test
    void fromSequence_빈_시퀀스에서_draw하면_GenerationExhaustedException() {
        // given
        Domain<Integer> empty = Domains.fromSequence(List.of());

        // when & then
        assertThat(empty.enumerate()).isEmpty();
        assertThatThrownBy(() -> empty.draw(SEED))
            .isInstanceOf(GenerationExhaustedException.class);
    }

    @Test
    void sublists_빈_조각을_포함한_연속_조각() {
        // given
        Domain<List<Integer>> slices = Domains.sublists(List.of(1, 2, 3));

        // when
        List<List<Integer>> all = slices.enumerate().collect(Collectors.toList());

        // then
        assertThat(all).containsExactly(
            List.of(), List.of(1), List.of(1, 2), List.of(1, 2, 3),
            List.of(2), List.of(2, 3), List.of(3)
        );
        assertThat(slices.produce(SEED, 100)).allSatisfy(slice -> assertThat(all).contains(slice));
    }

    // ========== 무한 도메인 ==========

    @Test
    void identifiers_식별자_형태의_문자열() {
        assertThat(Domains.identifiers(2, 6).produce(SEED, 200))
            .allSatisfy(name -> {
                assertThat(name).matches("[_A-Za-z][_A-Za-z0-9]*");
                assertThat(name.length()).isBetween(2, 6);
            });
    }

    @Test
    void identifiers_길이_범위가_잘못되면_예외() {
        assertThatThrownBy(() -> Domains.identifiers(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Domains.identifiers(4, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generated_난수_생성기로_결정적_생성() {
        // given
        Domain<Double> unit = Domains.generated("UnitInterval", random -> random.nextDouble());

        // when & then
        assertThat(unit.produce(SEED, 20)).isEqualTo(unit.produce(SEED, 20));
        assertThat(unit.toString()).isEqualTo("UnitInterval");
    }

    @Test
    void exhaustive_표시할_수_없는_도메인은_UsageException() {
        assertThatThrownBy(() -> Domains.identifiers().exhaustive()).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> Domains.generated("g", random -> 1).exhaustive()).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> Domains.mappings(Domains.booleans(), Domains.booleans()).exhaustive())
            .isInstanceOf(UsageException.class);
    }

    @Test
    void Domains_인스턴스화_불가() throws Exception {
        Constructor<Domains> constructor = Domains.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        assertThatThrownBy(constructor::newInstance)
            .hasCauseInstanceOf(UnsupportedOperationException.class);
    }
}
