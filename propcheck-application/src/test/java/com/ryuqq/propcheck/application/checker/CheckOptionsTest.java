package com.ryuqq.propcheck.application.checker;

import com.ryuqq.propcheck.core.seed.Seed;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CheckOptions 유닛 테스트.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class CheckOptionsTest {

    @Test
    void defaults_시드와_샘플수_모두_비어있음() {
        // when
        CheckOptions options = CheckOptions.defaults();

        // then
        assertThat(options.seed()).isNull();
        assertThat(options.sampleCount()).isNull();
    }

    @Test
    void withSeed_시드만_변경() {
        // given
        CheckOptions options = CheckOptions.defaults().withSampleCount(7);

        // when
        CheckOptions changed = options.withSeed(42L);

        // then
        assertThat(changed.seed()).isEqualTo(42L);
        assertThat(changed.sampleCount()).isEqualTo(7);
        assertThat(options.seed()).isNull();
    }

    @Test
    void withSampleCount_0이면_예외() {
        assertThatThrownBy(() -> CheckOptions.defaults().withSampleCount(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sampleCount must be positive");
    }

    @Test
    void resolveSeed_지정된_시드_사용() {
        // given
        CheckOptions options = CheckOptions.defaults().withSeed(123L);

        // when & then
        assertThat(options.resolveSeed()).isEqualTo(Seed.of(123L));
    }

    @Test
    void resolveSeed_시드가_없으면_새로_생성() {
        // given
        CheckOptions options = CheckOptions.defaults();

        // when
        Seed seed = options.resolveSeed();

        // then
        assertThat(seed).isNotNull();
    }
}
