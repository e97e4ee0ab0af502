package com.ryuqq.propcheck.adapter.runner;

/**
 * QuantifierEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultSampleCount: 전칭 한정 기본 샘플 수 (기본 100)</li>
 * </ul>
 *
 * <p>샘플 수 우선순위는 한정자 재정의, CheckOptions, 이 설정 순입니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 * @param defaultSampleCount 기본 샘플 수 (양수여야 함)
 */
public record EngineConfig(
    int defaultSampleCount
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultSampleCount=100</p>
     */
    public EngineConfig() {
        this(100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (defaultSampleCount <= 0) {
            throw new IllegalArgumentException(
                "defaultSampleCount must be positive (current: " + defaultSampleCount + ")"
            );
        }
    }

    /**
     * defaultSampleCount만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withDefaultSampleCount(int defaultSampleCount) {
        return new EngineConfig(defaultSampleCount);
    }
}
