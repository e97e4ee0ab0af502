package com.ryuqq.propcheck.core.seed;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 의사난수 시퀀스를 결정하는 시드.
 *
 * <p>Seed는 불변 값 객체이며, 동일한 시드로부터는 항상 동일한 값 시퀀스가 생성됩니다.
 * 실패한 검사를 같은 시드로 재실행하면 비트 단위로 동일한 결과를 재현할 수 있습니다.</p>
 *
 * <p><strong>자식 시드 파생:</strong></p>
 * <ul>
 *   <li>{@link #child(int)}: (부모 시드, 구조 경로 인덱스)로부터 결정적으로 파생</li>
 *   <li>형제 컴포넌트(튜플 필드, 유니온 분기 등)는 서로 다른 인덱스를 사용하므로
 *       상관관계 없는 값을 뽑습니다.</li>
 *   <li>공유되는 가변 난수 생성기는 존재하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Seed root = Seed.of(42L);
 * Seed first = root.child(0);
 * Seed second = root.child(1);
 * SplittableRandom random = first.newRandom();
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class Seed {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long value;

    private Seed(long value) {
        this.value = value;
    }

    /**
     * Seed 생성.
     *
     * @param value 시드 값
     * @return Seed 인스턴스
     */
    public static Seed of(long value) {
        return new Seed(value);
    }

    /**
     * 새로운 무작위 Seed 생성.
     *
     * <p>호출자가 시드를 지정하지 않은 경우에 사용합니다.
     * 생성된 시드는 결과(Outcome)에 노출되어 재실행에 사용됩니다.</p>
     *
     * @return 무작위 Seed
     */
    public static Seed generate() {
        return new Seed(ThreadLocalRandom.current().nextLong());
    }

    /**
     * 구조 경로 인덱스로 자식 시드 파생.
     *
     * <p>같은 (부모, 인덱스) 쌍은 항상 같은 자식 시드를 반환합니다.
     * 음수 인덱스는 Quantifier 엔진이 중첩 레벨 시드용으로 예약합니다.</p>
     *
     * @param index 구조 경로 인덱스 (필드 번호, 분기 번호, 샘플 번호 등)
     * @return 자식 Seed
     */
    public Seed child(int index) {
        return new Seed(mix(value + GOLDEN_GAMMA * ((long) index + 1L)) ^ mix(index));
    }

    /**
     * 이 시드로 초기화된 난수 생성기 생성.
     *
     * <p>호출할 때마다 새 인스턴스를 반환하므로 호출자 간에 상태가 공유되지 않습니다.</p>
     *
     * @return SplittableRandom 인스턴스
     */
    public SplittableRandom newRandom() {
        return new SplittableRandom(value);
    }

    /**
     * 시드 값 조회.
     *
     * @return 시드 값
     */
    public long getValue() {
        return value;
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Seed seed = (Seed) o;
        return value == seed.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Seed{" + value + '}';
    }
}
