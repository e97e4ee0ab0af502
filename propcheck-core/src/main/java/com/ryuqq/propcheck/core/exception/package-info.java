/**
 * Infrastructure failure taxonomy.
 *
 * <p>All exceptions are unchecked and fail fast. They are never retried and abort
 * the current property check.</p>
 *
 * <h2>Hierarchy</h2>
 * <pre>
 * PropertyCheckException
 *   ├─ UsageException
 *   │    └─ NotExhaustibleException
 *   └─ GenerationExhaustedException
 * </pre>
 *
 * <p>Ordinary test failures (counterexample, unsatisfied existential, predicate error)
 * are not exceptions; they are reported through
 * {@link com.ryuqq.propcheck.core.outcome.Fail}.</p>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.exception;
