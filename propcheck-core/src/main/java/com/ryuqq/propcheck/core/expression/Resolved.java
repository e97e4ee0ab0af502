package com.ryuqq.propcheck.core.expression;

import com.ryuqq.propcheck.core.domain.Domain;

import java.util.List;

/**
 * 확정된 도메인 표현식.
 *
 * @param domain 도메인
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public record Resolved(Domain<?> domain) implements DomainExpression {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException domain이 null인 경우
     */
    public Resolved {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
    }

    @Override
    public Domain<?> resolve(Bindings bindings) {
        return domain;
    }

    @Override
    public List<String> freeVariables() {
        return List.of();
    }
}
