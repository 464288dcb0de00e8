package org.absint.dataflow.analysis;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Adapts an instruction-level {@link TransferFunction} to the node level: predecessor states are
 * joined with {@link AbstractState#leastUpperBound}, the instructions of a node are folded from
 * first to last, and exceptions are not modeled (all filters are the identity).
 *
 * <p>If the domain has to take exceptions into account, it needs a dedicated exceptional state;
 * see {@link ExceptionalTransferFunction}.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public class SimpleNodeTransferFunction<N, I, S extends AbstractState<S>, A>
        implements NodeTransferFunction<N, I, S, A> {

    /** The instruction-level transfer function. */
    protected final TransferFunction<N, I, S, A> transfer;

    /**
     * Create a node-level adapter.
     *
     * @param transfer the instruction-level transfer function
     */
    public SimpleNodeTransferFunction(TransferFunction<N, I, S, A> transfer) {
        this.transfer = transfer;
    }

    /**
     * Fold {@code states} into {@code into} with {@link AbstractState#leastUpperBound}.
     *
     * @param states the states to join
     * @param into the accumulator to start from, may be {@code null}
     * @return the join, or {@code null} if there was nothing to join
     */
    public static <S extends AbstractState<S>> @Nullable S joinAllStates(
            List<S> states, @Nullable S into) {
        S result = into;
        for (S state : states) {
            result = result == null ? state : result.leastUpperBound(state);
        }
        return result;
    }

    @Override
    public @Nullable S joinAll(List<S> states, @Nullable S into) {
        return joinAllStates(states, into);
    }

    @Override
    public S filterNormal(S state) {
        return state;
    }

    @Override
    public S filterExceptional(S state) {
        return state;
    }

    @Override
    public S transformOnExceptionalEdge(S state) {
        return state;
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
        S state = pre;
        for (int i = 0; i < instrs.size(); i++) {
            state = executor.exec(i, state, instrs.get(i));
        }
        return state;
    }
}
