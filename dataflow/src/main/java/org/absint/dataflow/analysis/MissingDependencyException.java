package org.absint.dataflow.analysis;

/**
 * Raised by a transfer function that needs the result of another procedure's analysis that has
 * not been computed. The caller is expected to compute the dependency and retry.
 */
public class MissingDependencyException extends AnalysisSignal {

    private static final long serialVersionUID = 1L;

    /**
     * Create a missing-dependency signal.
     *
     * @param dependency a description of the missing result
     */
    public MissingDependencyException(String dependency) {
        super("Missing dependency: " + dependency);
    }
}
