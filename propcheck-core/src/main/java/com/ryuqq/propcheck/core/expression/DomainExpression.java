package com.ryuqq.propcheck.core.expression;

import com.ryuqq.propcheck.core.domain.Domain;

import java.util.List;
import java.util.function.Function;

/**
 * Quantifier가 한정하는 도메인 표현식.
 *
 * <p>두 가지 경우가 있습니다:</p>
 * <ul>
 *   <li>{@link Resolved}: 이미 확정된 도메인</li>
 *   <li>{@link Deferred}: 앞서 한정된 변수들의 값에 따라 결정되는 도메인</li>
 * </ul>
 *
 * <p>엔진은 바깥 샘플마다 현재 Bindings를 넘겨 {@link #resolve(Bindings)}를 호출하며,
 * Deferred는 바깥 샘플마다 새 도메인을 만듭니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DomainExpression xs = DomainExpression.of(Domains.integers());
 * DomainExpression ys = DomainExpression.deferred(List.of("x"),
 *     bindings -&gt; Domains.integers(bindings.&lt;Integer&gt;get("x")));
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public sealed interface DomainExpression permits Resolved, Deferred {

    /**
     * 현재 Bindings로 구체 도메인 결정.
     *
     * @param bindings 앞서 한정된 변수들의 값
     * @return 구체 도메인
     * @throws com.ryuqq.propcheck.core.exception.UsageException 자유 변수가 바인딩되지 않은 경우
     */
    Domain<?> resolve(Bindings bindings);

    /**
     * 이 표현식이 읽는 자유 변수 이름.
     *
     * @return 자유 변수 목록 (Resolved는 빈 목록)
     */
    List<String> freeVariables();

    static DomainExpression of(Domain<?> domain) {
        return new Resolved(domain);
    }

    static DomainExpression deferred(List<String> freeVariables, Function<Bindings, ? extends Domain<?>> function) {
        return new Deferred(freeVariables, function);
    }
}
