package org.absint.dataflow.cfg;

import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The description of one procedure as produced by a front end: its nodes, their instructions,
 * and the normal and exceptional edges between them. Analyses do not work on a procedure
 * directly but on one of its {@link ControlFlowGraph} views.
 *
 * @param <N> the node type; nodes are used as map keys and must implement {@code equals} and
 *     {@code hashCode} consistently (identity is fine)
 * @param <I> the instruction type
 */
public interface Procedure<N, I> {

    /** @return the name of the procedure, used in diagnostics */
    String getName();

    /** @return all nodes of the procedure */
    Collection<N> getNodes();

    /** @return the node control enters the procedure through */
    N getStartNode();

    /** @return the node of the normal exit */
    N getExitNode();

    /** @return the node exceptions escaping the procedure flow to, if there is one */
    @Nullable N getExceptionSinkNode();

    /**
     * @param node a node of this procedure
     * @return the instructions of the node, in execution order
     */
    List<I> getInstructions(N node);

    /**
     * @param node a node of this procedure
     * @return the successors of the node along normal edges
     */
    List<N> getNormalSuccessors(N node);

    /**
     * @param node a node of this procedure
     * @return the successors of the node along exceptional edges
     */
    List<N> getExceptionalSuccessors(N node);

    /**
     * @param node a node of this procedure
     * @return the predecessors of the node along normal edges
     */
    List<N> getNormalPredecessors(N node);

    /**
     * @param node a node of this procedure
     * @return the predecessors of the node along exceptional edges
     */
    List<N> getExceptionalPredecessors(N node);
}
