package org.absint.dataflow.analysis;

/**
 * Executes one instruction of the node currently being analyzed. Handed by the engines to
 * {@link NodeTransferFunction#execNodeInstrs}; it wraps the instruction-level transfer function
 * with error reporting and cancellation checks.
 *
 * @param <I> the instruction type
 * @param <S> the abstract state type
 */
@FunctionalInterface
public interface InstructionExecutor<I, S> {

    /**
     * Execute an instruction.
     *
     * @param instrIndex the index of the instruction within its node
     * @param pre the state before the instruction
     * @param instr the instruction
     * @return the state after the instruction
     */
    S exec(int instrIndex, S pre, I instr);
}
