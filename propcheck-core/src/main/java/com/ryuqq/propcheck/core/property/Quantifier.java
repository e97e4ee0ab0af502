package com.ryuqq.propcheck.core.property;

import com.ryuqq.propcheck.core.expression.DomainExpression;

/**
 * 변수 하나를 도메인 표현식 위에서 한정하는 선언.
 *
 * @param kind 한정자 종류 (FORALL, EXISTS)
 * @param variable 한정 변수 이름
 * @param expression 도메인 표현식
 * @param sampleCount 샘플 수 재정의 (선택, null이면 검사 설정을 따름)
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public record Quantifier(
    QuantifierKind kind,
    String variable,
    DomainExpression expression,
    Integer sampleCount
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sampleCount가 양수가 아닌 경우
     */
    public Quantifier {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable cannot be null or blank");
        }
        if (expression == null) {
            throw new IllegalArgumentException("expression cannot be null");
        }
        if (sampleCount != null && sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive (current: " + sampleCount + ")");
        }
        // sampleCount는 null 허용
    }

    public static Quantifier forAll(String variable, DomainExpression expression) {
        return new Quantifier(QuantifierKind.FORALL, variable, expression, null);
    }

    public static Quantifier exists(String variable, DomainExpression expression) {
        return new Quantifier(QuantifierKind.EXISTS, variable, expression, null);
    }

    /**
     * 실제 사용할 샘플 수 결정.
     *
     * @param fallback 재정의가 없을 때 사용할 값
     * @return sampleCount 또는 fallback
     */
    public int effectiveSampleCount(int fallback) {
        return sampleCount != null ? sampleCount : fallback;
    }
}
