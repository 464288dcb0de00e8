package org.absint.dataflow.interval;

import org.absint.dataflow.analysis.TransferFunction;

/**
 * The transfer function of {@link IntervalInstruction}s over {@link IntervalStore}s. It does not
 * depend on the node or on any client data.
 *
 * @param <N> the node type of the control flow graph
 * @param <A> the type of the client data, ignored
 */
public class IntervalTransferFunction<N, A>
        implements TransferFunction<N, IntervalInstruction, IntervalStore, A> {

    @Override
    public IntervalStore execInstr(
            IntervalStore pre, A analysisData, N node, int instrIndex, IntervalInstruction instr) {
        if (pre.isBottom()) {
            return pre;
        }
        return instr.execute(pre);
    }
}
