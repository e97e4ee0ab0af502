package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 키 도메인과 값 도메인으로부터 맵을 생성하는 도메인.
 *
 * <p>크기는 자식 시드 0으로 정하고, j번째 항목은 자식 시드 (1 + j)에서
 * 다시 키(0)와 값(1)으로 갈라 그립니다. 중복 키는 나중 값으로 덮어쓰므로
 * 결과 크기가 뽑은 크기보다 작을 수 있습니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class MappingDomain<K, V> implements Domain<Map<K, V>> {

    private final Domain<K> keys;
    private final Domain<V> values;
    private final int minSize;
    private final int maxSize;

    MappingDomain(Domain<K> keys, Domain<V> values, int minSize, int maxSize) {
        if (keys == null || values == null) {
            throw new IllegalArgumentException("key and value domains cannot be null");
        }
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize must be non-negative (current: " + minSize + ")");
        }
        if (maxSize < minSize) {
            throw new IllegalArgumentException(
                "maxSize must be >= minSize (min: " + minSize + ", max: " + maxSize + ")"
            );
        }
        this.keys = keys;
        this.values = values;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    @Override
    public Map<K, V> draw(Seed seed, DrawContext context) {
        if (keys.isBlocked() || values.isBlocked()) {
            if (minSize > 0) {
                throw new UsageException("Recursion depth exhausted inside " + this);
            }
            return Map.of();
        }
        int size = seed.child(0).newRandom().nextInt(minSize, maxSize + 1);
        Map<K, V> entries = new LinkedHashMap<>();
        for (int j = 0; j < size; j++) {
            Seed entrySeed = seed.child(1 + j);
            entries.put(keys.draw(entrySeed.child(0), context), values.draw(entrySeed.child(1), context));
        }
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public boolean isBlocked() {
        return minSize > 0 && (keys.isBlocked() || values.isBlocked());
    }

    Domain<K> keys() {
        return keys;
    }

    Domain<V> values() {
        return values;
    }

    @Override
    public String toString() {
        return "Mapping(" + keys + " -> " + values + ", " + minSize + ".." + maxSize + ")";
    }
}
