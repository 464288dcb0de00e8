package org.absint.dataflow.analysis;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The states of a procedure at its normal exit and at its exception sink.
 *
 * @param <S> the abstract state type
 */
public final class PostPair<S> {

    private final @Nullable S exitPost;
    private final @Nullable S exceptionSinkPost;

    /**
     * @param exitPost the post-state of the exit node, if reached
     * @param exceptionSinkPost the post-state of the exception sink, if there is one and it was
     *     reached
     */
    public PostPair(@Nullable S exitPost, @Nullable S exceptionSinkPost) {
        this.exitPost = exitPost;
        this.exceptionSinkPost = exceptionSinkPost;
    }

    /** @return the post-state of the exit node, or {@code null} if it was not reached */
    public @Nullable S getExitPost() {
        return exitPost;
    }

    /**
     * @return the post-state of the exception sink, or {@code null} if there is none or it was
     *     not reached
     */
    public @Nullable S getExceptionSinkPost() {
        return exceptionSinkPost;
    }

    @Override
    public String toString() {
        return "(exit: " + exitPost + ", exceptions: " + exceptionSinkPost + ")";
    }
}
