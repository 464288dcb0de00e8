package org.absint.dataflow.analysis;

/**
 * Thrown when a node is visited more often than the configured maximum number of widenings. This
 * signals a broken widening operator rather than a recoverable condition: the analysis of the
 * current procedure is aborted, but a caller analyzing many procedures can catch it and skip just
 * that one.
 */
public class DivergenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The threshold that was exceeded. */
    private final int maxWidens;

    /**
     * Create a divergence error.
     *
     * @param maxWidens the threshold that was exceeded
     */
    public DivergenceException(int maxWidens) {
        super(
                "Exceeded max widening threshold "
                        + maxWidens
                        + ". Please check your widening operator or increase the threshold");
        this.maxWidens = maxWidens;
    }

    /** @return the threshold that was exceeded */
    public int getMaxWidens() {
        return maxWidens;
    }
}
