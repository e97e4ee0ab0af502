package com.ryuqq.propcheck.application.checker;

import com.ryuqq.propcheck.core.seed.Seed;

/**
 * 검사 한 번의 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>seed: 검사 시드 (null이면 검사 시점에 생성)</li>
 *   <li>sampleCount: 전칭 한정 샘플 수 (null이면 검사기 기본값)</li>
 * </ul>
 *
 * <p>한정자 자체에 지정된 샘플 수가 이 값보다 우선합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 * @param seed 시드 값 (선택)
 * @param sampleCount 샘플 수 (선택, 양수여야 함)
 */
public record CheckOptions(
    Long seed,
    Integer sampleCount
) {

    private static final CheckOptions DEFAULTS = new CheckOptions(null, null);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException sampleCount가 양수가 아닌 경우
     */
    public CheckOptions {
        if (sampleCount != null && sampleCount <= 0) {
            throw new IllegalArgumentException(
                "sampleCount must be positive (current: " + sampleCount + ")"
            );
        }
    }

    /**
     * 시드와 샘플 수를 모두 비워 둔 기본 옵션.
     *
     * @return 기본 CheckOptions
     */
    public static CheckOptions defaults() {
        return DEFAULTS;
    }

    /**
     * seed만 변경한 새 인스턴스 생성.
     */
    public CheckOptions withSeed(long seed) {
        return new CheckOptions(seed, sampleCount);
    }

    /**
     * sampleCount만 변경한 새 인스턴스 생성.
     */
    public CheckOptions withSampleCount(int sampleCount) {
        return new CheckOptions(seed, sampleCount);
    }

    /**
     * 사용할 시드 결정.
     *
     * @return 지정된 시드, 없으면 새로 생성한 시드
     */
    public Seed resolveSeed() {
        return seed != null ? Seed.of(seed) : Seed.generate();
    }
}
