package org.absint.dataflow.analysis;

/**
 * A {@link CancellationCheck} that cancels the run once a wall-clock budget is spent, or as soon
 * as the analyzing thread is interrupted.
 */
public final class Deadline implements CancellationCheck {

    private final long deadlineNanos;
    private final long timeoutMillis;

    private Deadline(long deadlineNanos, long timeoutMillis) {
        this.deadlineNanos = deadlineNanos;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Start a deadline now.
     *
     * @param timeoutMillis the budget in milliseconds, must be positive
     * @return a deadline expiring {@code timeoutMillis} from now
     */
    public static Deadline startingNow(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeoutMillis);
        }
        return new Deadline(System.nanoTime() + timeoutMillis * 1_000_000L, timeoutMillis);
    }

    @Override
    public void check() {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisTimeoutException("Analysis thread was interrupted");
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new AnalysisTimeoutException("Analysis timed out after " + timeoutMillis + "ms");
        }
    }
}
