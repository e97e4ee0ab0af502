package com.ryuqq.propcheck.core.expression;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.exception.UsageException;

import java.util.HashSet;
import java.util.List;
import java.util.function.Function;

/**
 * 앞서 한정된 변수에 의존하는 지연 도메인 표현식.
 *
 * <p><strong>해석 규칙:</strong></p>
 * <ol>
 *   <li>선언된 자유 변수가 모두 바인딩되어 있는지 검증</li>
 *   <li>Bindings를 선언된 자유 변수로 제한 (선언하지 않은 변수 읽기는 {@link UsageException})</li>
 *   <li>함수를 호출해 구체 도메인을 얻음 (null이면 {@link UsageException})</li>
 * </ol>
 *
 * @param freeVariables 읽는 자유 변수 이름 (1개 이상, 중복 불가)
 * @param function Bindings → 도메인 함수
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public record Deferred(
    List<String> freeVariables,
    Function<Bindings, ? extends Domain<?>> function
) implements DomainExpression {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 자유 변수가 없거나 중복되거나 function이 null인 경우
     */
    public Deferred {
        if (freeVariables == null || freeVariables.isEmpty()) {
            throw new IllegalArgumentException("freeVariables cannot be null or empty");
        }
        if (new HashSet<>(freeVariables).size() != freeVariables.size()) {
            throw new IllegalArgumentException("freeVariables must be distinct: " + freeVariables);
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        freeVariables = List.copyOf(freeVariables);
    }

    @Override
    public Domain<?> resolve(Bindings bindings) {
        Domain<?> domain = function.apply(bindings.restrictTo(freeVariables));
        if (domain == null) {
            throw new UsageException("Deferred domain expression over " + freeVariables + " returned null");
        }
        return domain;
    }
}
