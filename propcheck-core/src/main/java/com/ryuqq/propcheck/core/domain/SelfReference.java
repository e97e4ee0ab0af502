package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

/**
 * 재귀 도메인 팩토리에 전달되는 자기 참조 핸들.
 *
 * <p>핸들 자체가 도메인이므로 다른 조합자 안에 그대로 넣어 사용합니다.
 * 핸들을 통해 draw하면 남은 깊이가 하나 줄어든 재귀 도메인이 새로 전개됩니다.
 * 남은 깊이가 0인 핸들은 막혀 있으며, union은 막힌 분기를 선택하지 않습니다.</p>
 *
 * @param <T> 값 타입
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class SelfReference<T> implements Domain<T> {

    private final RecursiveDomain.Declaration<T> declaration;
    private final int remainingDepth;

    SelfReference(RecursiveDomain.Declaration<T> declaration, int remainingDepth) {
        this.declaration = declaration;
        this.remainingDepth = remainingDepth;
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        if (remainingDepth <= 0) {
            throw new UsageException("Recursion depth exhausted for " + declaration.name());
        }
        return new RecursiveDomain<>(declaration, remainingDepth - 1).expand(seed, context);
    }

    @Override
    public boolean isBlocked() {
        return remainingDepth <= 0;
    }

    /**
     * 이 핸들을 소유한 재귀 도메인의 남은 깊이.
     *
     * @return 남은 자기 전개 횟수
     */
    public int remainingDepth() {
        return remainingDepth;
    }

    RecursiveDomain.Declaration<T> declaration() {
        return declaration;
    }

    @Override
    public String toString() {
        return declaration.name() + "@" + remainingDepth;
    }
}
