package org.absint.dataflow.disjunctive;

import org.absint.dataflow.analysis.AbstractState;
import org.absint.dataflow.analysis.FixpointContext;

/**
 * A transfer function that executes an instruction from one disjunct at a time. Wrap it in a
 * {@link DisjunctiveTransferFunction} to run it on {@link DisjunctiveState}s.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <D> the disjunct type
 * @param <ND> the non-disjunctive state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public interface DisjunctReadyTransferFunction<
        N, I, D extends Disjunct<D>, ND extends AbstractState<ND>, A> {

    /**
     * Execute an instruction from a single disjunct. The context tells, through {@link
     * FixpointContext#getRemainingDisjuncts()}, how many disjuncts the instruction may usefully
     * return; extra ones are dropped.
     *
     * @param disjunct the disjunct before the instruction
     * @param nonDisjunct the non-disjunctive state before the instruction
     * @param context the context of the current run, giving access to the client data
     * @param node the node the instruction belongs to
     * @param instrIndex the index of the instruction within the node
     * @param instr the instruction
     * @return the disjuncts and non-disjunctive state after the instruction
     */
    ExecutionResult<D, ND> execInstr(
            D disjunct,
            ND nonDisjunct,
            FixpointContext<A> context,
            N node,
            int instrIndex,
            I instr);
}
