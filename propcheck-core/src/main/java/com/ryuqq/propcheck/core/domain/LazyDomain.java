package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.function.Supplier;

/**
 * draw 시점에 대상 도메인을 얻는 지연 참조.
 *
 * <p>아직 선언되지 않은 도메인을 참조할 때 사용합니다. 서로를 참조하는 두 재귀 선언은
 * 이 참조를 통해서만 표현할 수 있으며, 첫 draw 전에 구조 검사로 상호 재귀가 감지됩니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class LazyDomain<T> implements Domain<T> {

    private final Supplier<? extends Domain<T>> target;

    LazyDomain(Supplier<? extends Domain<T>> target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.target = target;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        return resolve().draw(seed, context);
    }

    Domain<T> resolve() {
        Domain<T> resolved = target.get();
        if (resolved == null) {
            throw new UsageException("Lazy domain reference resolved to null");
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "Lazy";
    }
}
