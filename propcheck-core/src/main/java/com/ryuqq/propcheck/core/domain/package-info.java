/**
 * Domain abstraction, built-in domains and combinators.
 *
 * <p>A {@link com.ryuqq.propcheck.core.domain.Domain} is an immutable, possibly infinite value
 * set that produces a deterministic value sequence from a
 * {@link com.ryuqq.propcheck.core.seed.Seed}.</p>
 *
 * <h2>Built-in Domains</h2>
 * <ul>
 *   <li>Leaves: integers, booleans, constant, identifiers, generated</li>
 *   <li>Finite adapters: fromSequence, of, sublists (exhaustive by construction)</li>
 *   <li>Combinators: union, map, filter, tuple, lists, mappings</li>
 *   <li>Recursion: recursive (with {@link com.ryuqq.propcheck.core.domain.SelfReference}), lazy</li>
 * </ul>
 *
 * <h2>Child Seed Paths</h2>
 * <pre>
 * union     : choice = child(0), branch i = child(1 + i)
 * filter    : attempt k = child(k)
 * tuple     : component i = child(i)
 * lists     : size = child(0), element j = child(1 + j)
 * mappings  : size = child(0), entry j = child(1 + j) → key child(0), value child(1)
 * map, lazy : same seed as the source
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Reproducibility:</strong> identical (domain, seed, count) yields identical values</li>
 *   <li><strong>Independence:</strong> sibling components never share a random stream</li>
 *   <li><strong>Termination:</strong> recursive domains carry a per-instance depth counter</li>
 *   <li><strong>Trust:</strong> the exhaustive flag is asserted by the author, never inferred</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PropCheck Team
 */
package com.ryuqq.propcheck.core.domain;
