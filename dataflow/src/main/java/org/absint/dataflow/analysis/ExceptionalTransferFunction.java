package org.absint.dataflow.analysis;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A transfer function whose domain distinguishes normal from exceptional states, and which
 * controls how predecessor states are joined.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public interface ExceptionalTransferFunction<N, I, S extends AbstractState<S>, A>
        extends TransferFunction<N, I, S, A> {

    /**
     * Join the states flowing in from predecessors.
     *
     * @param states the states to join, in predecessor order
     * @param into a state the result should be joined into; it is preferred over {@code states}
     *     when the domain has to drop information
     * @return the joined state, or {@code null} if {@code states} is empty and {@code into} is
     *     {@code null}
     */
    @Nullable S joinAll(List<S> states, @Nullable S into);

    /**
     * Refine a state to its non-exceptional concrete states; bottom if there are none.
     *
     * @param state the state to refine
     * @return the normal part of {@code state}
     */
    S filterNormal(S state);

    /**
     * Refine a state to its exceptional concrete states; bottom if there are none.
     *
     * @param state the state to refine
     * @return the exceptional part of {@code state}
     */
    S filterExceptional(S state);

    /**
     * Change the nature of a state flowing along an exceptional edge. A forward analysis turns
     * exceptional states into normal ones, a backward analysis does the reverse.
     *
     * @param state the state on the source side of the edge
     * @return the state on the target side of the edge
     */
    S transformOnExceptionalEdge(S state);
}
