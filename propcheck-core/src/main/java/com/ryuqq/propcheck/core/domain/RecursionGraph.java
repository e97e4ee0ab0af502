package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 재귀 선언 본문의 도메인 그래프 검사.
 *
 * <p>draw 결과와 무관하게 구조만으로 판단하므로, 시드에 따라 결과가 달라지지 않습니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ul>
 *   <li>본문 분기가 자기 참조 핸들을 사용하는지 ({@link #usesHandle})</li>
 *   <li>지연 참조를 따라가며, 전개 경로에 있는 선언에 자기 참조 핸들이 아닌
 *       경로로 다시 도달하는지 ({@link #verifyNoMutualRecursion})</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class RecursionGraph {

    // Utility class - prevent instantiation
    private RecursionGraph() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 도메인이 주어진 선언의 자기 참조 핸들을 포함하는지 확인.
     *
     * <p>지연 참조는 따라가지 않습니다.</p>
     *
     * @param domain 검사할 도메인
     * @param declaration 핸들 소유 선언
     * @return 핸들을 포함하면 true
     */
    static boolean usesHandle(Domain<?> domain, RecursiveDomain.Declaration<?> declaration) {
        if (domain instanceof SelfReference) {
            return ((SelfReference<?>) domain).declaration() == declaration;
        }
        for (Domain<?> child : children(domain)) {
            if (usesHandle(child, declaration)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 선언에서 도달 가능한 모든 재귀 선언을 따라가며 상호 재귀를 검사.
     *
     * @param root 검사 시작 선언
     * @throws UsageException 상호 재귀가 있는 경우
     */
    static void verifyNoMutualRecursion(RecursiveDomain.Declaration<?> root) {
        Deque<RecursiveDomain.Declaration<?>> path = new ArrayDeque<>();
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        enter(root, path, visited);
    }

    private static void enter(
        RecursiveDomain.Declaration<?> declaration,
        Deque<RecursiveDomain.Declaration<?>> path,
        Set<Object> visited
    ) {
        if (path.contains(declaration)) {
            throw mutual(declaration, path);
        }
        if (!visited.add(declaration)) {
            return;
        }
        path.addLast(declaration);
        walk(blockedBody(declaration), path, visited);
        path.removeLast();
    }

    private static void walk(
        Domain<?> domain,
        Deque<RecursiveDomain.Declaration<?>> path,
        Set<Object> visited
    ) {
        if (domain instanceof SelfReference) {
            RecursiveDomain.Declaration<?> owner = ((SelfReference<?>) domain).declaration();
            if (owner != path.peekLast() && path.contains(owner)) {
                throw mutual(owner, path);
            }
            return;
        }
        if (domain instanceof RecursiveDomain) {
            enter(((RecursiveDomain<?>) domain).declaration(), path, visited);
            return;
        }
        if (domain instanceof LazyDomain) {
            if (visited.add(domain)) {
                walk(((LazyDomain<?>) domain).resolve(), path, visited);
                visited.remove(domain);
            }
            return;
        }
        for (Domain<?> child : children(domain)) {
            walk(child, path, visited);
        }
    }

    private static List<? extends Domain<?>> children(Domain<?> domain) {
        if (domain instanceof UnionDomain) {
            return ((UnionDomain<?>) domain).branches();
        }
        if (domain instanceof MappedDomain) {
            return List.of(((MappedDomain<?, ?>) domain).source());
        }
        if (domain instanceof FilteredDomain) {
            return List.of(((FilteredDomain<?>) domain).source());
        }
        if (domain instanceof TupleDomain) {
            return ((TupleDomain) domain).components();
        }
        if (domain instanceof ListDomain) {
            return List.of(((ListDomain<?>) domain).element());
        }
        if (domain instanceof MappingDomain) {
            MappingDomain<?, ?> mapping = (MappingDomain<?, ?>) domain;
            return List.of(mapping.keys(), mapping.values());
        }
        return List.of();
    }

    private static <T> Domain<T> blockedBody(RecursiveDomain.Declaration<T> declaration) {
        return declaration.body(new SelfReference<>(declaration, 0));
    }

    private static UsageException mutual(
        RecursiveDomain.Declaration<?> reentered,
        Deque<RecursiveDomain.Declaration<?>> path
    ) {
        StringBuilder cycle = new StringBuilder();
        for (RecursiveDomain.Declaration<?> each : path) {
            cycle.append(each.name()).append(" -> ");
        }
        cycle.append(reentered.name());
        return new UsageException("Mutually recursive domain definitions are not supported: " + cycle);
    }
}
