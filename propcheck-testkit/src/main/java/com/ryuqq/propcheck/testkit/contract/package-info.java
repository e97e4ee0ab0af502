/**
 * Reusable contract tests for PropCheck domains.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.propcheck.testkit.contract.AbstractDomainContractTest} - sampling and enumeration contract
 *       every Domain must satisfy</li>
 *   <li>{@link com.ryuqq.propcheck.testkit.contract.RecordingPredicate} - predicate that records its evaluations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.testkit.contract;
