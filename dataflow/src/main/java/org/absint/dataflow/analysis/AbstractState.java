package org.absint.dataflow.analysis;

/**
 * An abstract state: an element of the lattice a client analysis computes over. Implementations
 * are expected to be immutable; the engine compares states with {@link #isLessOrEqual} and may
 * compare them by reference to detect that an operation returned one of its arguments unchanged.
 *
 * <p>{@link #toString()} is used as the pretty printer of the domain.
 *
 * @param <S> the type of the implementing state
 */
public interface AbstractState<S extends AbstractState<S>> {

    /**
     * Compute the least upper bound (join) of two states.
     *
     * @param other the other state
     * @return the least upper bound of this state and {@code other}
     */
    S leastUpperBound(S other);

    /**
     * Compare two states in the precision order of the lattice.
     *
     * @param other the state to compare against
     * @return true if this state is below or equal to {@code other}
     */
    boolean isLessOrEqual(S other);

    /**
     * Compute an upper bound of this (previous) state and {@code next} that guarantees the
     * termination of ascending chains. The receiver is the value stored at a loop head, {@code
     * next} the newly computed candidate.
     *
     * @param next the new candidate state
     * @param numIterations how many times the loop head has been visited so far
     * @return an upper bound of this state and {@code next}
     */
    S widenedUpperBound(S next, int numIterations);
}
