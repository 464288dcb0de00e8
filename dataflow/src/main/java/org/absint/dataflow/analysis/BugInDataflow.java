package org.absint.dataflow.analysis;

/**
 * Exception type indicating a bug in the fixpoint engine or in the control flow graph it was
 * given, such as a node reached with no computed predecessor state or a start node that is part
 * of a loop. It always aborts the current run.
 */
public class BugInDataflow extends RuntimeException {

    /** The serial version identifier. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new BugInDataflow with the specified detail message.
     *
     * @param message the detail message
     */
    public BugInDataflow(String message) {
        super(message);
    }

    /**
     * Constructs a new BugInDataflow with a detail message built by {@link String#format}.
     *
     * @param fmt the format string
     * @param args the arguments for the format string
     */
    public BugInDataflow(String fmt, Object... args) {
        this(String.format(fmt, args));
    }

    /**
     * Constructs a new BugInDataflow with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public BugInDataflow(String message, Throwable cause) {
        super(message, cause);
    }
}
