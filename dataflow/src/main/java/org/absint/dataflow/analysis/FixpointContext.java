package org.absint.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The mutable state of one run of a fixpoint engine, together with the client data of that run.
 *
 * <p>A context is owned by exactly one run at a time: {@link #enter()} fails with a {@link
 * BugInDataflow} if the context is already in use. An analysis that starts a nested run (for
 * example to analyze a callee while executing a call instruction) gives it the context returned
 * by {@link #nested}. The nested context has its own disjunct budget, but shares the cancellation
 * check and the error-reporting streak of its parent, so that a failure is logged only by the
 * innermost run it passes through.
 *
 * @param <A> the type of the client data
 */
public final class FixpointContext<A> {

    /** The client data, passed to the transfer function unchanged. */
    private final A analysisData;

    /** Polled once per executed instruction and disjunct. */
    private final CancellationCheck cancellation;

    /** The failure streak, shared by a root context and all contexts nested in it. */
    private final ErrorStreak errorStreak;

    /** Whether this context was created by {@link #nested}. */
    private final boolean isNested;

    /**
     * Disjuncts the disjunctive domain may still produce for the node being executed, or {@code
     * null} outside of a node execution.
     */
    private @Nullable Integer remainingDisjuncts = null;

    /** Whether a run is currently using this context. */
    private boolean isRunning = false;

    /**
     * Create a context.
     *
     * @param analysisData the client data
     * @param cancellation the cancellation check to poll
     */
    public FixpointContext(A analysisData, CancellationCheck cancellation) {
        this(analysisData, cancellation, new ErrorStreak(), false);
    }

    private FixpointContext(
            A analysisData,
            CancellationCheck cancellation,
            ErrorStreak errorStreak,
            boolean isNested) {
        this.analysisData = analysisData;
        this.cancellation = cancellation;
        this.errorStreak = errorStreak;
        this.isNested = isNested;
    }

    /**
     * Create a context whose cancellation check implements the timeout of {@code options}.
     *
     * @param analysisData the client data
     * @param options the engine options
     * @return a fresh context
     */
    public static <A> FixpointContext<A> create(A analysisData, FixpointOptions options) {
        return new FixpointContext<>(analysisData, options.newCancellationCheck());
    }

    /**
     * Create the context of a run started from within the run using this context.
     *
     * @param analysisData the client data of the nested run
     * @return a context sharing the cancellation check and the failure streak of this one
     */
    public <B> FixpointContext<B> nested(B analysisData) {
        return new FixpointContext<>(analysisData, cancellation, errorStreak, true);
    }

    /** @return the client data */
    public A getAnalysisData() {
        return analysisData;
    }

    /**
     * Poll the cancellation check.
     *
     * @throws AnalysisTimeoutException if the run must stop
     */
    public void checkCancelled() {
        cancellation.check();
    }

    /** Mark the start of a run using this context. */
    void enter() {
        if (isRunning) {
            throw new BugInDataflow(
                    "FixpointContext is already used by a running analysis;"
                            + " nested runs need their own context");
        }
        isRunning = true;
        if (!isNested) {
            errorStreak.logged = false;
        }
    }

    /** Mark the end of a run using this context. */
    void exit() {
        isRunning = false;
        remainingDisjuncts = null;
    }

    /** @return true if a run is currently using this context */
    public boolean isRunning() {
        return isRunning;
    }

    /** @return whether the current streak of instruction failures was already logged */
    boolean hasLoggedError() {
        return errorStreak.logged;
    }

    /** @param loggedError whether the current streak of failures has been logged */
    void setLoggedError(boolean loggedError) {
        errorStreak.logged = loggedError;
    }

    /**
     * Set how many disjuncts the instructions of the node being executed may still produce.
     *
     * @param remaining the remaining budget
     */
    public void setRemainingDisjuncts(int remaining) {
        this.remainingDisjuncts = remaining;
    }

    /**
     * @return how many disjuncts the instructions of the node being executed may still produce
     * @throws BugInDataflow if no budget was set for the current node
     */
    public int getRemainingDisjuncts() {
        if (remainingDisjuncts == null) {
            throw new BugInDataflow("remaining disjuncts read outside of a node execution");
        }
        return remainingDisjuncts;
    }

    /** Whether the current streak of instruction failures has already been logged. */
    private static final class ErrorStreak {
        boolean logged = false;
    }
}
