/**
 * Property check outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for check results.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.propcheck.core.outcome.Pass} - The property held for every explored binding</li>
 *   <li>{@link com.ryuqq.propcheck.core.outcome.Fail} - Counterexample, unsatisfied existential or predicate error
 *       (see {@link com.ryuqq.propcheck.core.outcome.FailureKind})</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Replay:</strong> every outcome carries the seed of the run</li>
 *   <li><strong>Witness:</strong> bindings are reported in declaration order</li>
 *   <li><strong>No faults:</strong> ordinary test failures are values, not exceptions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.outcome;
