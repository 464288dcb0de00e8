package org.absint.dataflow.cfg;

import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Forward views of a {@link Procedure}. The {@linkplain #normal normal} view hides exceptional
 * edges altogether, the {@linkplain #exceptional exceptional} view exposes them so that the
 * analysis can treat them with {@link
 * org.absint.dataflow.analysis.NodeTransferFunction#transformOnExceptionalEdge}.
 *
 * @param <N> the node type
 * @param <I> the instruction type
 */
public final class ProcedureCfg<N, I> extends AbstractControlFlowGraph<N, I> {

    /** Whether exceptional edges are part of this view. */
    private final boolean withExceptions;

    private ProcedureCfg(Procedure<N, I> procedure, boolean withExceptions) {
        super(procedure);
        this.withExceptions = withExceptions;
    }

    /**
     * @param procedure a procedure
     * @return a forward view of the procedure without exceptional edges
     */
    public static <N, I> ProcedureCfg<N, I> normal(Procedure<N, I> procedure) {
        return new ProcedureCfg<>(procedure, false);
    }

    /**
     * @param procedure a procedure
     * @return a forward view of the procedure with both normal and exceptional edges
     */
    public static <N, I> ProcedureCfg<N, I> exceptional(Procedure<N, I> procedure) {
        return new ProcedureCfg<>(procedure, true);
    }

    /** @return true if exceptional edges are part of this view */
    public boolean hasExceptionalEdges() {
        return withExceptions;
    }

    @Override
    public N getStartNode() {
        return procedure.getStartNode();
    }

    @Override
    public N getExitNode() {
        return procedure.getExitNode();
    }

    @Override
    public @Nullable N getExceptionSinkNode() {
        return procedure.getExceptionSinkNode();
    }

    @Override
    public List<I> getInstructions(N node) {
        return procedure.getInstructions(node);
    }

    @Override
    public List<N> getNormalSuccessors(N node) {
        return procedure.getNormalSuccessors(node);
    }

    @Override
    public List<N> getExceptionalSuccessors(N node) {
        return withExceptions
                ? procedure.getExceptionalSuccessors(node)
                : Collections.<N>emptyList();
    }

    @Override
    public List<N> getNormalPredecessors(N node) {
        return procedure.getNormalPredecessors(node);
    }

    @Override
    public List<N> getExceptionalPredecessors(N node) {
        return withExceptions
                ? procedure.getExceptionalPredecessors(node)
                : Collections.<N>emptyList();
    }
}
