package org.absint.dataflow.analysis;

/**
 * A polled cancellation point. The engines call {@link #check()} once per executed instruction,
 * and the disjunctive domain once per executed disjunct.
 */
@FunctionalInterface
public interface CancellationCheck {

    /** A check that never cancels. */
    CancellationCheck NONE = () -> {};

    /**
     * Return normally if the run may continue.
     *
     * @throws AnalysisTimeoutException if the run must stop
     */
    void check();
}
