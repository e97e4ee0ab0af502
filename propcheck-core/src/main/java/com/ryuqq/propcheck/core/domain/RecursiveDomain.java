package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.function.Function;

/**
 * 자기 자신을 참조하는 재귀 도메인.
 *
 * <p>팩토리는 자기 참조 핸들({@link SelfReference})을 받아, 핸들을 사용하지 않는
 * 기저 분기와 핸들을 사용하는 재귀 분기를 포함한 union을 반환해야 합니다.</p>
 *
 * <p><strong>종료 보장:</strong></p>
 * <ul>
 *   <li>각 인스턴스는 남은 자기 전개 횟수(remainingDepth)를 가짐</li>
 *   <li>핸들을 통해 draw할 때마다 remainingDepth - 1인 새 인스턴스가 전개됨</li>
 *   <li>remainingDepth가 0이면 핸들이 막히고, union은 기저 분기만 선택</li>
 *   <li>따라서 maxDepth = k이면 최대 k번의 중첩 자기 전개로 값이 완성됨</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>선언 시점에 본문이 union인지, 기저 분기와 핸들을 사용하는 분기가 모두 있는지 검증
 *       (아니면 {@link UsageException})</li>
 *   <li>카운터는 인스턴스마다 독립적이며 공유되지 않음</li>
 *   <li>첫 draw 전에 본문 구조를 따라가 자기 참조 핸들이 아닌 경로로 같은 선언에
 *       다시 도달하면 상호 재귀로 보고 시드와 무관하게 {@link UsageException}으로 실패</li>
 *   <li>exhaustive로 표시할 수 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Domain&lt;Object&gt; tree = Domains.recursive("Tree", self -&gt; Domains.union(
 *     Domains.booleans(),
 *     Domains.tuple(self, self)
 * ));
 * </pre>
 *
 * @param <T> 값 타입
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class RecursiveDomain<T> implements Domain<T> {

    private final Declaration<T> declaration;
    private final int remainingDepth;

    RecursiveDomain(Declaration<T> declaration, int remainingDepth) {
        this.declaration = declaration;
        this.remainingDepth = remainingDepth;
    }

    static <T> RecursiveDomain<T> declare(
        String name,
        Function<SelfReference<T>, ? extends Domain<T>> factory,
        int maxDepth
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative (current: " + maxDepth + ")");
        }
        Declaration<T> declaration = new Declaration<>(name, factory);
        Domain<T> baseOnly = declaration.body(new SelfReference<>(declaration, 0));
        if (!(baseOnly instanceof UnionDomain)) {
            throw new UsageException("Recursive domain " + name + " must be a union of branches: " + baseOnly);
        }
        if (baseOnly.isBlocked()) {
            throw new UsageException("Recursive domain " + name + " has no base case: " + baseOnly);
        }
        boolean recursiveBranch = ((UnionDomain<T>) baseOnly).branches().stream()
            .anyMatch(branch -> RecursionGraph.usesHandle(branch, declaration));
        if (!recursiveBranch) {
            throw new UsageException("Recursive domain " + name + " has no branch using its self reference: " + baseOnly);
        }
        return new RecursiveDomain<>(declaration, maxDepth);
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        if (context.depth() == 0) {
            declaration.verify();
        }
        if (context.isExpanding(declaration)) {
            throw new UsageException(
                "Mutually recursive domain definitions are not supported: " + declaration.name
            );
        }
        return expand(seed, context.enter(declaration));
    }

    T expand(Seed seed, DrawContext context) {
        return declaration.body(new SelfReference<>(declaration, remainingDepth)).draw(seed, context);
    }

    /**
     * 최대 자기 전개 횟수만 바꾼 새 인스턴스 생성.
     *
     * @param maxDepth 최대 깊이 (0 이상)
     * @return 새 RecursiveDomain
     * @throws IllegalArgumentException maxDepth가 음수인 경우
     */
    public RecursiveDomain<T> withMaxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative (current: " + maxDepth + ")");
        }
        return new RecursiveDomain<>(declaration, maxDepth);
    }

    /**
     * 남은 자기 전개 횟수.
     *
     * @return remainingDepth
     */
    public int remainingDepth() {
        return remainingDepth;
    }

    Declaration<T> declaration() {
        return declaration;
    }

    @Override
    public Domain<T> exhaustive() {
        throw new UsageException("Recursive domain cannot be marked as exhaustive: " + this);
    }

    @Override
    public String toString() {
        return "Recursive(" + declaration.name + ", depth=" + remainingDepth + ")";
    }

    /**
     * 재귀 선언의 정체성. 깊이가 다른 인스턴스들이 같은 선언을 공유합니다.
     */
    static final class Declaration<T> {

        private final String name;
        private final Function<SelfReference<T>, ? extends Domain<T>> factory;
        private volatile boolean verified;

        Declaration(String name, Function<SelfReference<T>, ? extends Domain<T>> factory) {
            this.name = name;
            this.factory = factory;
        }

        Domain<T> body(SelfReference<T> self) {
            Domain<T> body = factory.apply(self);
            if (body == null) {
                throw new UsageException("Recursive domain factory returned null: " + name);
            }
            return body;
        }

        /**
         * 첫 전개 전에 한 번, 도달 가능한 선언 그래프에서 상호 재귀를 검사합니다.
         */
        void verify() {
            if (!verified) {
                RecursionGraph.verifyNoMutualRecursion(this);
                verified = true;
            }
        }

        String name() {
            return name;
        }
    }
}
