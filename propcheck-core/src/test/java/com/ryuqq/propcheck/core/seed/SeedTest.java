package com.ryuqq.propcheck.core.seed;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Seed 유닛 테스트.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class SeedTest {

    @Test
    void child_같은_부모와_인덱스면_같은_시드() {
        // given
        Seed root = Seed.of(42L);

        // when & then
        assertThat(root.child(3)).isEqualTo(Seed.of(42L).child(3));
        assertThat(root.child(-1)).isEqualTo(Seed.of(42L).child(-1));
    }

    @Test
    void child_형제_인덱스는_서로_다른_시드() {
        // given
        Seed root = Seed.of(7L);
        Set<Seed> children = new HashSet<>();

        // when
        for (int i = -50; i < 50; i++) {
            children.add(root.child(i));
        }

        // then
        assertThat(children).hasSize(100);
        assertThat(children).doesNotContain(root);
    }

    @Test
    void child_부모가_다르면_다른_시드() {
        assertThat(Seed.of(1L).child(0)).isNotEqualTo(Seed.of(2L).child(0));
    }

    @Test
    void newRandom_호출마다_독립된_같은_시퀀스() {
        // given
        Seed seed = Seed.of(99L);
        SplittableRandom first = seed.newRandom();

        // when
        long a = first.nextLong();
        first.nextLong();
        long b = seed.newRandom().nextLong();

        // then
        assertThat(a).isEqualTo(b);
    }

    @Test
    void equals_hashCode_값_기반() {
        assertThat(Seed.of(5L)).isEqualTo(Seed.of(5L));
        assertThat(Seed.of(5L).hashCode()).isEqualTo(Seed.of(5L).hashCode());
        assertThat(Seed.of(5L).getValue()).isEqualTo(5L);
        assertThat(Seed.of(5L).toString()).isEqualTo("Seed{5}");
    }
}
