package org.absint.dataflow.interval;

/**
 * An interval of {@code long} values. {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE} stand for
 * the infinite bounds; arithmetic saturates at them. The empty interval is {@link #BOTTOM}.
 */
public final class Interval {

    /** The negative infinite bound. */
    public static final long MINUS_INFINITY = Long.MIN_VALUE;

    /** The positive infinite bound. */
    public static final long PLUS_INFINITY = Long.MAX_VALUE;

    /** The empty interval. */
    public static final Interval BOTTOM = new Interval(1, 0);

    /** The interval of all values. */
    public static final Interval TOP = new Interval(MINUS_INFINITY, PLUS_INFINITY);

    private final long lower;
    private final long upper;

    private Interval(long lower, long upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @param lower the lower bound, inclusive
     * @param upper the upper bound, inclusive
     * @return the interval, {@link #BOTTOM} if {@code lower > upper}
     */
    public static Interval of(long lower, long upper) {
        if (lower > upper) {
            return BOTTOM;
        }
        if (lower == MINUS_INFINITY && upper == PLUS_INFINITY) {
            return TOP;
        }
        return new Interval(lower, upper);
    }

    /**
     * @param value the value
     * @return the interval containing only {@code value}
     */
    public static Interval constant(long value) {
        return of(value, value);
    }

    /** @return the lower bound; meaningless for {@link #BOTTOM} */
    public long getLower() {
        return lower;
    }

    /** @return the upper bound; meaningless for {@link #BOTTOM} */
    public long getUpper() {
        return upper;
    }

    /** @return true if this is the empty interval */
    public boolean isBottom() {
        return lower > upper;
    }

    /** @return true if this interval contains all values */
    public boolean isTop() {
        return lower == MINUS_INFINITY && upper == PLUS_INFINITY;
    }

    /**
     * @param other the other interval
     * @return the smallest interval containing both
     */
    public Interval join(Interval other) {
        if (isBottom()) {
            return other;
        }
        if (other.isBottom()) {
            return this;
        }
        return of(Math.min(lower, other.lower), Math.max(upper, other.upper));
    }

    /**
     * @param other the other interval
     * @return the intersection of both
     */
    public Interval meet(Interval other) {
        if (isBottom() || other.isBottom()) {
            return BOTTOM;
        }
        return of(Math.max(lower, other.lower), Math.min(upper, other.upper));
    }

    /**
     * Widen this interval with {@code next}: a bound that grows jumps to infinity.
     *
     * @param next the new interval
     * @return the widened interval
     */
    public Interval widen(Interval next) {
        if (isBottom()) {
            return next;
        }
        if (next.isBottom()) {
            return this;
        }
        long newLower = next.lower < lower ? MINUS_INFINITY : lower;
        long newUpper = next.upper > upper ? PLUS_INFINITY : upper;
        return of(newLower, newUpper);
    }

    /**
     * @param other the other interval
     * @return true if this interval is included in {@code other}
     */
    public boolean isLessOrEqual(Interval other) {
        if (isBottom()) {
            return true;
        }
        if (other.isBottom()) {
            return false;
        }
        return other.lower <= lower && upper <= other.upper;
    }

    /**
     * @param delta the value to add
     * @return this interval shifted by {@code delta}, saturating at the infinite bounds
     */
    public Interval add(long delta) {
        if (isBottom()) {
            return this;
        }
        return of(saturatingAdd(lower, delta), saturatingAdd(upper, delta));
    }

    private static long saturatingAdd(long bound, long delta) {
        if (bound == MINUS_INFINITY || bound == PLUS_INFINITY) {
            return bound;
        }
        long sum = bound + delta;
        // overflow iff both operands have the sign opposite to the result
        if (((bound ^ sum) & (delta ^ sum)) < 0) {
            return delta > 0 ? PLUS_INFINITY : MINUS_INFINITY;
        }
        return sum;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Interval)) {
            return false;
        }
        Interval other = (Interval) obj;
        if (isBottom() || other.isBottom()) {
            return isBottom() && other.isBottom();
        }
        return lower == other.lower && upper == other.upper;
    }

    @Override
    public int hashCode() {
        return isBottom() ? 0 : Long.hashCode(lower) * 31 + Long.hashCode(upper);
    }

    @Override
    public String toString() {
        if (isBottom()) {
            return "bottom";
        }
        return "["
                + (lower == MINUS_INFINITY ? "-oo" : Long.toString(lower))
                + ", "
                + (upper == PLUS_INFINITY ? "+oo" : Long.toString(upper))
                + "]";
    }
}
