/**
 * Property declaration model.
 *
 * <p>A {@link com.ryuqq.propcheck.core.property.Property} is an ordered list of
 * {@link com.ryuqq.propcheck.core.property.Quantifier}s plus a terminal
 * {@link com.ryuqq.propcheck.core.property.PropertyPredicate}. It is declared through
 * {@link com.ryuqq.propcheck.core.property.PropertyBuilder}, which makes binding order and
 * nesting explicit.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Property property = Property.builder("exists y &gt; 7")
 *     .exists("y", Domains.integers(1, 8).exhaustive())
 *     .check(b -&gt; b.&lt;Integer&gt;get("y") &gt; 7);
 * </pre>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.property;
