package org.absint.dataflow.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The reversal of a forward view: the analysis starts at the exit of the procedure, flows against
 * the edges, and executes the instructions of each node from last to first. Exceptional edges are
 * reversed too, so exceptional successors of a node in the procedure become its exceptional
 * predecessors here.
 *
 * @param <N> the node type
 * @param <I> the instruction type
 */
public final class BackwardCfg<N, I> extends AbstractControlFlowGraph<N, I> {

    /** The forward view being reversed. */
    private final ControlFlowGraph<N, I> base;

    /**
     * Reverse a forward view.
     *
     * @param base the forward view
     */
    public BackwardCfg(ControlFlowGraph<N, I> base) {
        super(base.getProcedure());
        this.base = base;
    }

    /**
     * @param procedure a procedure
     * @return the backward view of the procedure including its exceptional edges
     */
    public static <N, I> BackwardCfg<N, I> of(Procedure<N, I> procedure) {
        return new BackwardCfg<>(ProcedureCfg.exceptional(procedure));
    }

    @Override
    public N getStartNode() {
        return base.getExitNode();
    }

    @Override
    public N getExitNode() {
        return base.getStartNode();
    }

    /** A backward view has no exception sink: exceptions flow towards the start node. */
    @Override
    public @Nullable N getExceptionSinkNode() {
        return null;
    }

    @Override
    public List<I> getInstructions(N node) {
        List<I> instrs = base.getInstructions(node);
        if (instrs.size() < 2) {
            return instrs;
        }
        List<I> reversed = new ArrayList<>(instrs);
        Collections.reverse(reversed);
        return reversed;
    }

    @Override
    public List<N> getNormalSuccessors(N node) {
        return base.getNormalPredecessors(node);
    }

    @Override
    public List<N> getExceptionalSuccessors(N node) {
        return base.getExceptionalPredecessors(node);
    }

    @Override
    public List<N> getNormalPredecessors(N node) {
        return base.getNormalSuccessors(node);
    }

    @Override
    public List<N> getExceptionalPredecessors(N node) {
        return base.getExceptionalSuccessors(node);
    }
}
