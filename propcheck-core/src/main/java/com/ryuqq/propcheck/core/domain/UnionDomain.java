package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 여러 도메인의 합집합.
 *
 * <p><strong>생성 알고리즘:</strong></p>
 * <ol>
 *   <li>막히지 않은(blocked가 아닌) 분기만 후보로 삼음</li>
 *   <li>자식 시드 0으로 후보 중 하나를 공정하게 선택</li>
 *   <li>선택된 분기 i를 자식 시드 (1 + i)로 draw</li>
 * </ol>
 *
 * <p>재귀 도메인이 깊이 한도에 도달하면 재귀 분기가 막히므로,
 * 선택은 무작위 값과 관계없이 기저 분기로 강제됩니다.</p>
 *
 * <p>중첩된 union은 평탄화됩니다. 모든 분기가 exhaustive이면 union도 exhaustive이며,
 * 중복을 제거한 분기 열거의 연결로 열거합니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class UnionDomain<T> implements Domain<T> {

    private final List<Domain<? extends T>> branches;

    UnionDomain(List<? extends Domain<? extends T>> branches) {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one branch");
        }
        List<Domain<? extends T>> flattened = new ArrayList<>();
        for (Domain<? extends T> branch : branches) {
            if (branch == null) {
                throw new IllegalArgumentException("union branch cannot be null");
            }
            if (branch instanceof UnionDomain) {
                flattened.addAll(((UnionDomain<? extends T>) branch).branches);
            } else {
                flattened.add(branch);
            }
        }
        this.branches = Collections.unmodifiableList(flattened);
    }

    @Override
    public T draw(Seed seed, DrawContext context) {
        List<Integer> eligible = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            if (!branches.get(i).isBlocked()) {
                eligible.add(i);
            }
        }
        if (eligible.isEmpty()) {
            throw new UsageException("No drawable branch in " + this + " (missing base case?)");
        }
        int chosen = eligible.get(seed.child(0).newRandom().nextInt(eligible.size()));
        return branches.get(chosen).draw(seed.child(1 + chosen), context);
    }

    @Override
    public boolean isExhaustive() {
        return branches.stream().allMatch(Domain::isExhaustive);
    }

    @Override
    public Stream<T> enumerate() {
        if (!isExhaustive()) {
            return Domain.super.enumerate();
        }
        LinkedHashSet<T> distinct = branches.stream()
            .<T>flatMap(Domain::enumerate)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return distinct.stream();
    }

    @Override
    public boolean isBlocked() {
        return branches.stream().allMatch(Domain::isBlocked);
    }

    List<Domain<? extends T>> branches() {
        return branches;
    }

    @Override
    public String toString() {
        return branches.stream().map(String::valueOf).collect(Collectors.joining(" | ", "(", ")"));
    }
}
