package org.absint.dataflow.interval;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import org.absint.dataflow.analysis.AbstractState;

/**
 * An immutable map from variable names to the {@link Interval} of their possible values. A
 * variable without an entry can have any value. The bottom store describes no execution at all.
 */
public final class IntervalStore implements AbstractState<IntervalStore> {

    private static final IntervalStore TOP = new IntervalStore(false, Collections.emptyMap());

    private static final IntervalStore BOTTOM = new IntervalStore(true, Collections.emptyMap());

    private final boolean isBottom;

    /** Bounded variables only; never maps to {@link Interval#TOP} or {@link Interval#BOTTOM}. */
    private final Map<String, Interval> values;

    private IntervalStore(boolean isBottom, Map<String, Interval> values) {
        this.isBottom = isBottom;
        this.values = values;
    }

    /** @return the store where every variable may have any value */
    public static IntervalStore top() {
        return TOP;
    }

    /** @return the store describing no execution */
    public static IntervalStore bottom() {
        return BOTTOM;
    }

    /** @return true if this store describes no execution */
    public boolean isBottom() {
        return isBottom;
    }

    /**
     * @param variable the variable name
     * @return the interval of {@code variable}; {@link Interval#BOTTOM} in the bottom store
     */
    public Interval get(String variable) {
        if (isBottom) {
            return Interval.BOTTOM;
        }
        Interval value = values.get(variable);
        return value == null ? Interval.TOP : value;
    }

    /**
     * @param variable the variable name
     * @param value its new interval
     * @return the updated store; the bottom store if {@code value} is empty
     */
    public IntervalStore set(String variable, Interval value) {
        if (isBottom || value.isBottom()) {
            return BOTTOM;
        }
        Map<String, Interval> newValues = new HashMap<>(values);
        if (value.isTop()) {
            newValues.remove(variable);
        } else {
            newValues.put(variable, value);
        }
        return new IntervalStore(false, newValues);
    }

    @Override
    public IntervalStore leastUpperBound(IntervalStore other) {
        if (isBottom) {
            return other;
        }
        if (other.isBottom) {
            return this;
        }
        Map<String, Interval> joined = new HashMap<>();
        for (Map.Entry<String, Interval> entry : values.entrySet()) {
            Interval otherValue = other.values.get(entry.getKey());
            if (otherValue != null) {
                Interval value = entry.getValue().join(otherValue);
                if (!value.isTop()) {
                    joined.put(entry.getKey(), value);
                }
            }
        }
        return new IntervalStore(false, joined);
    }

    @Override
    public boolean isLessOrEqual(IntervalStore other) {
        if (isBottom) {
            return true;
        }
        if (other.isBottom) {
            return false;
        }
        for (Map.Entry<String, Interval> entry : other.values.entrySet()) {
            if (!get(entry.getKey()).isLessOrEqual(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public IntervalStore widenedUpperBound(IntervalStore next, int numIterations) {
        if (isBottom) {
            return next;
        }
        if (next.isBottom) {
            return this;
        }
        Map<String, Interval> widened = new HashMap<>();
        for (Map.Entry<String, Interval> entry : values.entrySet()) {
            Interval nextValue = next.values.get(entry.getKey());
            if (nextValue != null) {
                Interval value = entry.getValue().widen(nextValue);
                if (!value.isTop()) {
                    widened.put(entry.getKey(), value);
                }
            }
        }
        return new IntervalStore(false, widened);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof IntervalStore)) {
            return false;
        }
        IntervalStore other = (IntervalStore) obj;
        return isBottom == other.isBottom && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return isBottom ? 1 : values.hashCode();
    }

    @Override
    public String toString() {
        if (isBottom) {
            return "bottom";
        }
        return new TreeMap<>(values).toString();
    }
}
