/**
 * Deterministic seeds.
 *
 * <p>{@link com.ryuqq.propcheck.core.seed.Seed} replaces process-wide random state with an
 * explicit value. Composite domains derive child seeds from the parent seed and a structural
 * index, so no generator object is ever shared.</p>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.seed;
