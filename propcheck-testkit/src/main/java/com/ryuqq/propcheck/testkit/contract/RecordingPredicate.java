package com.ryuqq.propcheck.testkit.contract;

import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.property.PropertyPredicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A predicate that records every binding it is evaluated with.
 *
 * <p>Used to assert how many times, and in which order, the engine evaluated a property.</p>
 *
 * <pre>
 * RecordingPredicate predicate = RecordingPredicate.alwaysTrue();
 * engine.check(Property.builder("p").forAll("x", xs, 5).forAll("y", ys, 4).check(predicate));
 * assertEquals(20, predicate.count());
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class RecordingPredicate implements PropertyPredicate {

    private final PropertyPredicate delegate;
    private final List<Bindings> calls = new ArrayList<>();

    /**
     * Creates a recording predicate.
     *
     * @param delegate the predicate that decides the result
     * @throws IllegalArgumentException if delegate is null
     */
    public RecordingPredicate(PropertyPredicate delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public static RecordingPredicate alwaysTrue() {
        return new RecordingPredicate(bindings -> true);
    }

    @Override
    public boolean test(Bindings bindings) throws Exception {
        calls.add(bindings);
        return delegate.test(bindings);
    }

    /**
     * Number of recorded evaluations.
     *
     * @return the evaluation count
     */
    public int count() {
        return calls.size();
    }

    /**
     * Recorded bindings in evaluation order.
     *
     * @return unmodifiable view of the calls
     */
    public List<Bindings> calls() {
        return Collections.unmodifiableList(calls);
    }

    public void clear() {
        calls.clear();
    }
}
