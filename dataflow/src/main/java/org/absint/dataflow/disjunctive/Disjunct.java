package org.absint.dataflow.disjunctive;

/**
 * A single disjunct of a {@link DisjunctiveState}.
 *
 * <p>Disjuncts are compared cheaply with {@link #equalFast}, which defaults to object identity:
 * the combinator relies on the client reusing the same object for a state that did not change.
 *
 * @param <D> the disjunct type itself
 */
public interface Disjunct<D extends Disjunct<D>> {

    /**
     * A sound but incomplete equality test. Returning {@code false} for equal disjuncts only costs
     * precision or time, never soundness.
     *
     * @param other the other disjunct
     * @return true if this disjunct is known to equal {@code other}
     */
    default boolean equalFast(D other) {
        return this == other;
    }

    /**
     * The partial order on disjuncts, used to drop subsumed disjuncts when widening.
     *
     * @param other the other disjunct
     * @return true if this disjunct is implied by {@code other}
     */
    boolean isLessOrEqual(D other);

    /** @return true if this disjunct describes normal execution */
    default boolean isNormal() {
        return true;
    }

    /** @return true if this disjunct describes an exception being propagated */
    default boolean isExceptional() {
        return !isNormal();
    }

    /**
     * Whether execution can continue from this disjunct. A disjunct describing, for instance, a
     * program that already aborted is not executable.
     *
     * @return true if execution can continue from this disjunct
     */
    default boolean isExecutable() {
        return isNormal();
    }

    /**
     * Turn an exceptional disjunct into a normal one, when it flows into an exception handler.
     *
     * @return the normal counterpart of this disjunct
     */
    D exceptionalToNormal();
}
