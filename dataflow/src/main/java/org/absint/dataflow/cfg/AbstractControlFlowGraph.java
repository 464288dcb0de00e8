package org.absint.dataflow.cfg;

import java.util.Collection;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class of the procedure views. Computes the weak topological order on first use and
 * derives the loop heads from it.
 *
 * @param <N> the node type
 * @param <I> the instruction type
 */
public abstract class AbstractControlFlowGraph<N, I> implements ControlFlowGraph<N, I> {

    /** The procedure this is a view of. */
    protected final Procedure<N, I> procedure;

    /** The weak topological order, computed lazily. */
    private @Nullable Partition<N> wto = null;

    /** The heads of the components of {@link #wto}. */
    private @Nullable Set<N> loopHeads = null;

    /**
     * Create a view of a procedure.
     *
     * @param procedure the procedure
     */
    protected AbstractControlFlowGraph(Procedure<N, I> procedure) {
        this.procedure = procedure;
    }

    @Override
    public Procedure<N, I> getProcedure() {
        return procedure;
    }

    @Override
    public Collection<N> getNodes() {
        return procedure.getNodes();
    }

    @Override
    public Partition<N> getWeakTopologicalOrder() {
        if (wto == null) {
            wto = WeakTopologicalOrder.compute(this);
        }
        return wto;
    }

    @Override
    public boolean isLoopHead(N node) {
        if (loopHeads == null) {
            loopHeads = getWeakTopologicalOrder().getHeads();
        }
        return loopHeads.contains(node);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + procedure.getName() + ")";
    }
}
