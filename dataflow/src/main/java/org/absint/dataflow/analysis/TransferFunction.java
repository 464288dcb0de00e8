package org.absint.dataflow.analysis;

/**
 * Interface of an instruction-level transfer function for the abstract interpretation used by
 * the fixpoint engines.
 *
 * <p><em>Important</em>: a transfer function must not mutate the state it receives. Abstract
 * states are shared between the invariant map and the scheduler, so the result has to be a new
 * value (or the argument itself, when nothing changed).
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public interface TransferFunction<N, I, S extends AbstractState<S>, A> {

    /**
     * Symbolically execute a single instruction.
     *
     * @param pre the state before the instruction
     * @param analysisData the client data of the current run
     * @param node the node the instruction belongs to
     * @param instrIndex the index of the instruction within the node
     * @param instr the instruction
     * @return the state after the instruction
     */
    S execInstr(S pre, A analysisData, N node, int instrIndex, I instr);
}
