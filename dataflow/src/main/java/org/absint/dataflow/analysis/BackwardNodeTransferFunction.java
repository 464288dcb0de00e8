package org.absint.dataflow.analysis;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node-level adapter for backward analyses over a {@link
 * org.absint.dataflow.cfg.BackwardCfg}.
 *
 * <p>In a backward node, each instruction receives the normal state of the instruction after it
 * plus the exceptional states coming from the exceptional successor nodes:
 *
 * <pre>
 *   instr1;  &lt;-- exceptional states of the exceptional successors
 *   instr2;  &lt;-- exceptional states of the exceptional successors
 *   instr3;  &lt;-- exceptional states of the exceptional successors
 *     ^
 *     |-- normal states of the normal successors
 * </pre>
 *
 * The backward post of a node is assumed not to contain exceptional states.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public class BackwardNodeTransferFunction<N, I, S extends AbstractState<S>, A>
        implements NodeTransferFunction<N, I, S, A> {

    /** The client transfer function. */
    protected final ExceptionalTransferFunction<N, I, S, A> transfer;

    /**
     * Create a backward node-level adapter.
     *
     * @param transfer the client transfer function
     */
    public BackwardNodeTransferFunction(ExceptionalTransferFunction<N, I, S, A> transfer) {
        this.transfer = transfer;
    }

    @Override
    public @Nullable S joinAll(List<S> states, @Nullable S into) {
        return transfer.joinAll(states, into);
    }

    @Override
    public S filterNormal(S state) {
        return transfer.filterNormal(state);
    }

    @Override
    public S filterExceptional(S state) {
        return transfer.filterExceptional(state);
    }

    @Override
    public S transformOnExceptionalEdge(S state) {
        return transfer.transformOnExceptionalEdge(state);
    }

    @Override
    public S execInstr(S pre, FixpointContext<A> context, N node, int instrIndex, I instr) {
        return transfer.execInstr(pre, context.getAnalysisData(), node, instrIndex, instr);
    }

    @Override
    public S execNodeInstrs(
            @Nullable State<S> oldState,
            InstructionExecutor<I, S> executor,
            S pre,
            List<I> instrs,
            FixpointContext<A> context) {
        S preExceptional = transfer.filterExceptional(pre);
        S state = pre;
        for (int i = 0; i < instrs.size(); i++) {
            state = executor.exec(i, state.leastUpperBound(preExceptional), instrs.get(i));
        }
        return state;
    }
}
