package org.absint.dataflow.analysis;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The transfer function contract the fixpoint engines work with: an {@link
 * ExceptionalTransferFunction} that also decides how the instructions of a whole node are
 * executed. Clients rarely implement this directly; see {@link SimpleNodeTransferFunction},
 * {@link BackwardNodeTransferFunction} and {@link
 * org.absint.dataflow.disjunctive.DisjunctiveTransferFunction}.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public interface NodeTransferFunction<N, I, S extends AbstractState<S>, A> {

    /** @see ExceptionalTransferFunction#joinAll */
    @Nullable S joinAll(List<S> states, @Nullable S into);

    /** @see ExceptionalTransferFunction#filterNormal */
    S filterNormal(S state);

    /** @see ExceptionalTransferFunction#filterExceptional */
    S filterExceptional(S state);

    /** @see ExceptionalTransferFunction#transformOnExceptionalEdge */
    S transformOnExceptionalEdge(S state);

    /**
     * Execute a single instruction. The context gives access to the client data as well as to
     * the per-run state set up by {@link #execNodeInstrs}.
     *
     * @param pre the state before the instruction
     * @param context the context of the current run
     * @param node the node the instruction belongs to
     * @param instrIndex the index of the instruction within the node
     * @param instr the instruction
     * @return the state after the instruction
     */
    S execInstr(S pre, FixpointContext<A> context, N node, int instrIndex, I instr);

    /**
     * Symbolically execute the instructions of a node, using {@code executor} for each single
     * instruction.
     *
     * @param oldState the state stored for the node by a previous visit, or {@code null} on the
     *     first visit
     * @param executor executes one instruction
     * @param pre the state before the node
     * @param instrs the instructions of the node
     * @param context the context of the current run
     * @return the state after the node
     */
    S execNodeInstrs(
            @Nullable State<S> oldState,
            InstructionExecutor<I, S> executor,
            S pre,
            List<I> instrs,
            FixpointContext<A> context);
}
