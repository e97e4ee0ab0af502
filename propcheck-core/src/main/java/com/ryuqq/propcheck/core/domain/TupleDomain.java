package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 여러 도메인의 곱(product) 도메인.
 *
 * <p>i번째 컴포넌트는 자식 시드 i로 독립적으로 그립니다.
 * 모든 컴포넌트가 exhaustive이면 데카르트 곱으로 열거합니다.
 * 컴포넌트 하나라도 막히면 tuple 전체가 막힙니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class TupleDomain implements Domain<Tuple> {

    private final List<Domain<?>> components;

    TupleDomain(List<? extends Domain<?>> components) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("tuple requires at least one component");
        }
        for (Domain<?> component : components) {
            if (component == null) {
                throw new IllegalArgumentException("tuple component cannot be null");
            }
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    @Override
    public Tuple draw(Seed seed, DrawContext context) {
        List<Object> values = new ArrayList<>(components.size());
        for (int i = 0; i < components.size(); i++) {
            values.add(components.get(i).draw(seed.child(i), context));
        }
        return Tuple.fromList(values);
    }

    @Override
    public boolean isExhaustive() {
        return components.stream().allMatch(Domain::isExhaustive);
    }

    @Override
    public Stream<Tuple> enumerate() {
        if (!isExhaustive()) {
            return Domain.super.enumerate();
        }
        List<List<Object>> axes = new ArrayList<>(components.size());
        for (Domain<?> component : components) {
            axes.add(component.enumerate().collect(Collectors.<Object>toList()));
        }
        return Products.cartesian(axes).map(Tuple::fromList);
    }

    @Override
    public boolean isBlocked() {
        return components.stream().anyMatch(Domain::isBlocked);
    }

    List<Domain<?>> components() {
        return components;
    }

    @Override
    public String toString() {
        return components.stream().map(String::valueOf).collect(Collectors.joining(", ", "Tuple(", ")"));
    }
}
