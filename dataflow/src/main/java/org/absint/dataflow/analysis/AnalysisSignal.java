package org.absint.dataflow.analysis;

/**
 * Base class of the exceptions that abort the analysis of a procedure as part of expected control
 * flow: cancellation, a request to reschedule the procedure, or a missing result of another
 * procedure. The engines let them through without reporting them as errors; the caller decides
 * whether and when to retry.
 */
public abstract class AnalysisSignal extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Create a signal.
     *
     * @param message the detail message
     */
    protected AnalysisSignal(String message) {
        super(message);
    }
}
