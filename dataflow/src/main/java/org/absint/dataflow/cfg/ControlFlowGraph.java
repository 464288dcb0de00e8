package org.absint.dataflow.cfg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The view of a procedure a fixpoint engine iterates over. The view fixes the direction of the
 * analysis and which edges are visible: in a backward view the start node is the exit of the
 * procedure and predecessors are the procedure's successors.
 *
 * @param <N> the node type
 * @param <I> the instruction type
 */
public interface ControlFlowGraph<N, I> {

    /** @return the procedure this graph is a view of */
    Procedure<N, I> getProcedure();

    /** @return all nodes of the graph */
    Collection<N> getNodes();

    /** @return the node the analysis starts from */
    N getStartNode();

    /** @return the node whose post-state is the result of the analysis */
    N getExitNode();

    /** @return the node collecting escaping exceptions, if this view has one */
    @Nullable N getExceptionSinkNode();

    /**
     * @param node a node of the graph
     * @return the instructions of the node, in the order the analysis executes them
     */
    List<I> getInstructions(N node);

    /**
     * @param node a node of the graph
     * @return the successors along normal edges
     */
    List<N> getNormalSuccessors(N node);

    /**
     * @param node a node of the graph
     * @return the successors along exceptional edges
     */
    List<N> getExceptionalSuccessors(N node);

    /**
     * @param node a node of the graph
     * @return the predecessors along normal edges
     */
    List<N> getNormalPredecessors(N node);

    /**
     * @param node a node of the graph
     * @return the predecessors along exceptional edges
     */
    List<N> getExceptionalPredecessors(N node);

    /**
     * @param node a node of the graph
     * @return the normal successors followed by the exceptional ones, without duplicates
     */
    default List<N> getSuccessors(N node) {
        return concat(getNormalSuccessors(node), getExceptionalSuccessors(node));
    }

    /**
     * @param node a node of the graph
     * @return the normal predecessors followed by the exceptional ones, without duplicates
     */
    default List<N> getPredecessors(N node) {
        return concat(getNormalPredecessors(node), getExceptionalPredecessors(node));
    }

    /**
     * @param node a node of the graph
     * @return true if the node heads a loop, that is, a component of the weak topological order
     */
    boolean isLoopHead(N node);

    /** @return the weak topological order of the nodes reachable from the start node */
    Partition<N> getWeakTopologicalOrder();

    /**
     * Concatenate two node lists, dropping duplicates.
     *
     * @param first the first list
     * @param second the second list
     * @return the concatenation
     */
    static <N> List<N> concat(List<N> first, List<N> second) {
        if (second.isEmpty()) {
            return first;
        }
        if (first.isEmpty()) {
            return second;
        }
        Set<N> result = new LinkedHashSet<>(first);
        result.addAll(second);
        return new ArrayList<>(result);
    }
}
