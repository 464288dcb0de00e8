package org.absint.dataflow.analysis;

/**
 * Raised by a transfer function that cannot make progress right now, for instance because the
 * summary of a callee is being computed elsewhere. The procedure should be analyzed again later.
 */
public class RestartSchedulerException extends AnalysisSignal {

    private static final long serialVersionUID = 1L;

    /** The name of the procedure whose availability caused the restart. */
    private final String procedureName;

    /**
     * Create a restart request.
     *
     * @param procedureName the procedure that is not available yet
     */
    public RestartSchedulerException(String procedureName) {
        super("Procedure " + procedureName + " is already being analyzed");
        this.procedureName = procedureName;
    }

    /** @return the procedure that is not available yet */
    public String getProcedureName() {
        return procedureName;
    }
}
