package com.ryuqq.propcheck.core.property;

import java.util.List;

/**
 * 검사 가능한 속성.
 *
 * <p>한정자 목록(바깥 → 안쪽 순서)과 최종 조건으로 구성됩니다.
 * {@link #builder(String)}로 선언하며, 생성 시점에 바인딩 순서와 shadowing을 검증합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Property property = Property.builder("y is bounded by x")
 *     .forAll("x", Domains.integers())
 *     .forAll("y", List.of("x"), b -&gt; Domains.integers(b.&lt;Integer&gt;get("x")))
 *     .check(b -&gt; b.&lt;Integer&gt;get("y") &lt;= b.&lt;Integer&gt;get("x"));
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class Property {

    private final String name;
    private final List<Quantifier> quantifiers;
    private final PropertyPredicate predicate;

    Property(String name, List<Quantifier> quantifiers, PropertyPredicate predicate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (quantifiers == null) {
            throw new IllegalArgumentException("quantifiers cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        this.name = name;
        this.quantifiers = List.copyOf(quantifiers);
        this.predicate = predicate;
    }

    /**
     * PropertyBuilder 생성.
     *
     * @param name 속성 이름 (보고용)
     * @return 새 빌더
     */
    public static PropertyBuilder builder(String name) {
        return new PropertyBuilder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * 한정자 목록 (바깥 → 안쪽).
     *
     * @return 불변 목록
     */
    public List<Quantifier> getQuantifiers() {
        return quantifiers;
    }

    public PropertyPredicate getPredicate() {
        return predicate;
    }

    @Override
    public String toString() {
        return "Property{" + name + ", quantifiers=" + quantifiers.size() + '}';
    }
}
