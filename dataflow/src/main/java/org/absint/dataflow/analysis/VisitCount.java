package org.absint.dataflow.analysis;

/**
 * A capped, monotone visit counter. Counting past the configured maximum number of widenings
 * means the widening operator of the domain does not stabilize; that is reported as a {@link
 * DivergenceException}.
 */
public final class VisitCount implements Comparable<VisitCount> {

    private static final VisitCount FIRST_TIME = new VisitCount(1);

    /** The number of visits, at least one. */
    private final int count;

    private VisitCount(int count) {
        this.count = count;
    }

    /** @return the count of a node that has been visited once */
    public static VisitCount first() {
        return FIRST_TIME;
    }

    /**
     * Count one more visit.
     *
     * @param maxWidens the largest count allowed
     * @return the incremented count
     * @throws DivergenceException if the incremented count exceeds {@code maxWidens}
     */
    public VisitCount next(int maxWidens) {
        int next = count + 1;
        if (next > maxWidens) {
            throw new DivergenceException(maxWidens);
        }
        return new VisitCount(next);
    }

    /** @return the number of visits */
    public int intValue() {
        return count;
    }

    @Override
    public int compareTo(VisitCount other) {
        return Integer.compare(count, other.count);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof VisitCount && ((VisitCount) obj).count == count;
    }

    @Override
    public int hashCode() {
        return count;
    }

    @Override
    public String toString() {
        return Integer.toString(count);
    }
}
