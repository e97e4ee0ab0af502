/**
 * Variable binder.
 *
 * <p>A {@link com.ryuqq.propcheck.core.expression.DomainExpression} is either
 * {@link com.ryuqq.propcheck.core.expression.Resolved} or
 * {@link com.ryuqq.propcheck.core.expression.Deferred}. Deferred expressions name the free
 * variables they read and are resolved against the current
 * {@link com.ryuqq.propcheck.core.expression.Bindings} once per outer sample.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * DomainExpression ys = DomainExpression.deferred(List.of("x"),
 *     b -&gt; Domains.integers(b.&lt;Integer&gt;get("x")));
 * Domain&lt;?&gt; domain = ys.resolve(Bindings.empty().with("x", 10));
 * </pre>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.expression;
