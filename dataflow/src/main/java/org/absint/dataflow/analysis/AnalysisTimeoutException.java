package org.absint.dataflow.analysis;

/** Raised by a {@link CancellationCheck} when the current run must stop. */
public class AnalysisTimeoutException extends AnalysisSignal {

    private static final long serialVersionUID = 1L;

    /**
     * Create a cancellation signal.
     *
     * @param message why the run was cancelled
     */
    public AnalysisTimeoutException(String message) {
        super(message);
    }
}
