package org.absint.dataflow.analysis;

import org.absint.dataflow.cfg.ControlFlowGraph;
import org.absint.dataflow.cfg.Procedure;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * General fixpoint engine interface. An engine computes, for every node of a control flow graph,
 * an invariant over-approximating (or, with a bounded disjunctive domain, deliberately
 * under-approximating) the states reaching it, given a transfer function and an initial state at
 * the start node.
 *
 * <p>An engine has one direction, fixed by the {@link ControlFlowGraph} view it builds from a
 * {@link Procedure}: a backward engine analyzes the reversed graph, starting from the exit.
 *
 * <p>Every entry point creates a fresh {@link InvariantMap} owned by that call. A call either
 * returns a complete invariant map or throws exactly one exception.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public interface AbstractInterpreter<N, I, S extends AbstractState<S>, A> {

    /** The direction of an engine instance. */
    enum Direction {
        /** The forward direction. */
        FORWARD,
        /** The backward direction. */
        BACKWARD
    }

    /**
     * Get the direction of this engine.
     *
     * @return the direction of this engine
     */
    Direction getDirection();

    /**
     * Get the node-level transfer function of this engine.
     *
     * @return the transfer function
     */
    NodeTransferFunction<N, I, S, A> getTransferFunction();

    /**
     * Get the options of this engine.
     *
     * @return the options
     */
    FixpointOptions getOptions();

    /**
     * Build the view of a procedure this engine iterates over.
     *
     * @param procedure the procedure
     * @return its control flow graph in the direction of this engine
     */
    ControlFlowGraph<N, I> cfgOf(Procedure<N, I> procedure);

    /**
     * Compute the invariant map of a control flow graph, using a fresh context.
     *
     * @param cfg the graph
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param doNarrowing whether to refine the widened invariants by narrowing, for engines that
     *     support it
     * @return the invariant map
     */
    InvariantMap<N, S> execCfg(
            ControlFlowGraph<N, I> cfg, A analysisData, S initial, boolean doNarrowing);

    /**
     * Compute the invariant map of a control flow graph within a caller-supplied context.
     *
     * @param cfg the graph
     * @param context the context of this run; it must not be in use by another run
     * @param initial the state before the start node
     * @param doNarrowing whether to refine the widened invariants by narrowing
     * @return the invariant map
     */
    InvariantMap<N, S> execCfg(
            ControlFlowGraph<N, I> cfg, FixpointContext<A> context, S initial, boolean doNarrowing);

    /**
     * Compute the invariant map of a procedure.
     *
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param procedure the procedure
     * @param doNarrowing whether to refine the widened invariants by narrowing
     * @return the invariant map, keyed by the nodes of the procedure
     */
    InvariantMap<N, S> execProcedure(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing);

    /**
     * Compute the post-state of a procedure at its exit node.
     *
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param procedure the procedure
     * @param doNarrowing whether to refine the widened invariants by narrowing
     * @return the post-state of the exit node, or {@code null} if the exit is unreachable
     */
    @Nullable S computePost(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing);

    /**
     * Compute the post-states of a procedure at its exit node and at its exception sink.
     *
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param procedure the procedure
     * @param doNarrowing whether to refine the widened invariants by narrowing
     * @return the two post-states
     */
    PostPair<S> computePostIncludingExceptional(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing);

    /**
     * Compute the invariant map of a procedure without narrowing.
     *
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param procedure the procedure
     * @return the invariant map
     */
    default InvariantMap<N, S> execProcedure(A analysisData, S initial, Procedure<N, I> procedure) {
        return execProcedure(analysisData, initial, procedure, false);
    }

    /**
     * Compute the post-state of a procedure at its exit node without narrowing.
     *
     * @param analysisData the client data
     * @param initial the state before the start node
     * @param procedure the procedure
     * @return the post-state of the exit node, or {@code null} if the exit is unreachable
     */
    default @Nullable S computePost(A analysisData, S initial, Procedure<N, I> procedure) {
        return computePost(analysisData, initial, procedure, false);
    }
}
