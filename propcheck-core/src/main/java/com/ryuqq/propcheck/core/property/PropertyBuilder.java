package com.ryuqq.propcheck.core.property;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.expression.DomainExpression;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 한정자 선언을 순서대로 모아 {@link Property}를 만드는 빌더.
 *
 * <p>선언 순서가 곧 중첩 순서입니다. 먼저 선언한 한정자가 바깥쪽입니다.</p>
 *
 * <p><strong>검증 (check 호출 시):</strong></p>
 * <ul>
 *   <li>같은 변수를 두 번 한정하면 {@link UsageException} (shadowing)</li>
 *   <li>Deferred 표현식의 자유 변수는 앞선 한정자가 바인딩해야 함 (아니면 {@link UsageException})</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class PropertyBuilder {

    private final String name;
    private final List<Quantifier> quantifiers = new ArrayList<>();

    PropertyBuilder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    public PropertyBuilder forAll(String variable, Domain<?> domain) {
        return add(new Quantifier(QuantifierKind.FORALL, variable, DomainExpression.of(domain), null));
    }

    public PropertyBuilder forAll(String variable, Domain<?> domain, int sampleCount) {
        return add(new Quantifier(QuantifierKind.FORALL, variable, DomainExpression.of(domain), sampleCount));
    }

    public PropertyBuilder forAll(String variable, DomainExpression expression) {
        return add(new Quantifier(QuantifierKind.FORALL, variable, expression, null));
    }

    public PropertyBuilder forAll(String variable, DomainExpression expression, int sampleCount) {
        return add(new Quantifier(QuantifierKind.FORALL, variable, expression, sampleCount));
    }

    /**
     * 앞선 변수에 의존하는 도메인 위의 전칭 한정 추가.
     *
     * @param variable 한정 변수
     * @param freeVariables 도메인이 읽는 앞선 변수 이름
     * @param function Bindings → 도메인
     * @return this
     */
    public PropertyBuilder forAll(
        String variable,
        List<String> freeVariables,
        Function<Bindings, ? extends Domain<?>> function
    ) {
        return forAll(variable, DomainExpression.deferred(freeVariables, function));
    }

    public PropertyBuilder exists(String variable, Domain<?> domain) {
        return add(new Quantifier(QuantifierKind.EXISTS, variable, DomainExpression.of(domain), null));
    }

    public PropertyBuilder exists(String variable, DomainExpression expression) {
        return add(new Quantifier(QuantifierKind.EXISTS, variable, expression, null));
    }

    public PropertyBuilder exists(
        String variable,
        List<String> freeVariables,
        Function<Bindings, ? extends Domain<?>> function
    ) {
        return exists(variable, DomainExpression.deferred(freeVariables, function));
    }

    /**
     * 이미 만들어진 한정자 추가.
     *
     * @param quantifier 한정자
     * @return this
     * @throws IllegalArgumentException quantifier가 null인 경우
     */
    public PropertyBuilder add(Quantifier quantifier) {
        if (quantifier == null) {
            throw new IllegalArgumentException("quantifier cannot be null");
        }
        quantifiers.add(quantifier);
        return this;
    }

    /**
     * 최종 조건을 붙여 Property 생성.
     *
     * @param predicate 최종 조건
     * @return Property
     * @throws IllegalArgumentException predicate가 null인 경우
     * @throws UsageException shadowing 또는 바인딩 순서 위반
     */
    public Property check(PropertyPredicate predicate) {
        Set<String> bound = new HashSet<>();
        for (Quantifier quantifier : quantifiers) {
            for (String free : quantifier.expression().freeVariables()) {
                if (!bound.contains(free)) {
                    throw new UsageException(String.format(
                        "Domain of %s reads %s, which is not bound by an earlier quantifier",
                        quantifier.variable(), free));
                }
            }
            if (!bound.add(quantifier.variable())) {
                throw new UsageException("Variable " + quantifier.variable() + " is shadowed in " + name);
            }
        }
        return new Property(name, quantifiers, predicate);
    }
}
