package org.absint.dataflow.analysis;

import java.util.function.Function;
import org.absint.dataflow.analysis.AbstractInterpreter.Direction;
import org.absint.dataflow.cfg.BackwardCfg;
import org.absint.dataflow.cfg.ControlFlowGraph;
import org.absint.dataflow.cfg.Procedure;
import org.absint.dataflow.cfg.ProcedureCfg;
import org.absint.dataflow.cfg.ReversePostorderScheduler;
import org.absint.dataflow.disjunctive.DisjunctReadyTransferFunction;
import org.absint.dataflow.disjunctive.Disjunct;
import org.absint.dataflow.disjunctive.DisjunctiveDomain;
import org.absint.dataflow.disjunctive.DisjunctiveState;
import org.absint.dataflow.disjunctive.DisjunctiveTransferFunction;

/**
 * Static factories for the standard engine configurations.
 *
 * <p>Forward engines built from a plain {@link TransferFunction} iterate over the normal view of
 * a procedure, ignoring exceptional edges. Backward engines iterate over the reversed exceptional
 * view. Disjunctive engines iterate over the exceptional view, so that exceptional disjuncts
 * reach exception handlers.
 */
public final class AbstractInterpreters {

    /** Do not instantiate. */
    private AbstractInterpreters() {}

    /**
     * A forward worklist engine visiting nodes in reverse postorder, with default options.
     *
     * @param transfer the transfer function
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> rpo(
            TransferFunction<N, I, S, A> transfer) {
        return rpo(transfer, FixpointOptions.defaults());
    }

    /**
     * A forward worklist engine visiting nodes in reverse postorder.
     *
     * @param transfer the transfer function
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> rpo(
            TransferFunction<N, I, S, A> transfer, FixpointOptions options) {
        return rpo(new SimpleNodeTransferFunction<>(transfer), ProcedureCfg::normal, options);
    }

    /**
     * A forward worklist engine visiting nodes in reverse postorder, over a custom view.
     *
     * @param transfer the node-level transfer function
     * @param cfgFactory builds the view of a procedure to iterate over
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> rpo(
            NodeTransferFunction<N, I, S, A> transfer,
            Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory,
            FixpointOptions options) {
        return new WorklistInterpreter<>(
                Direction.FORWARD,
                transfer,
                cfgFactory,
                ReversePostorderScheduler.<N>factory(),
                options);
    }

    /**
     * A forward engine iterating over the weak topological order, with default options.
     *
     * @param transfer the transfer function
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> wto(
            TransferFunction<N, I, S, A> transfer) {
        return wto(transfer, FixpointOptions.defaults());
    }

    /**
     * A forward engine iterating over the weak topological order.
     *
     * @param transfer the transfer function
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> wto(
            TransferFunction<N, I, S, A> transfer, FixpointOptions options) {
        return wto(new SimpleNodeTransferFunction<>(transfer), ProcedureCfg::normal, options);
    }

    /**
     * A forward engine iterating over the weak topological order of a custom view.
     *
     * @param transfer the node-level transfer function
     * @param cfgFactory builds the view of a procedure to iterate over
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A> AbstractInterpreter<N, I, S, A> wto(
            NodeTransferFunction<N, I, S, A> transfer,
            Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory,
            FixpointOptions options) {
        return new WtoInterpreter<>(Direction.FORWARD, transfer, cfgFactory, options);
    }

    /**
     * A backward worklist engine visiting the reversed graph in reverse postorder.
     *
     * @param transfer the transfer function
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A>
            AbstractInterpreter<N, I, S, A> backwardRpo(
                    ExceptionalTransferFunction<N, I, S, A> transfer, FixpointOptions options) {
        return new WorklistInterpreter<>(
                Direction.BACKWARD,
                new BackwardNodeTransferFunction<>(transfer),
                BackwardCfg::of,
                ReversePostorderScheduler.<N>factory(),
                options);
    }

    /**
     * A backward engine iterating over the weak topological order of the reversed graph.
     *
     * @param transfer the transfer function
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, S extends AbstractState<S>, A>
            AbstractInterpreter<N, I, S, A> backwardWto(
                    ExceptionalTransferFunction<N, I, S, A> transfer, FixpointOptions options) {
        return new WtoInterpreter<>(
                Direction.BACKWARD,
                new BackwardNodeTransferFunction<>(transfer),
                BackwardCfg::of,
                options);
    }

    /**
     * A forward engine over the weak topological order of the exceptional view, running a
     * single-disjunct transfer function on disjunctive states.
     *
     * @param domain the disjunctive domain
     * @param transfer the single-disjunct transfer function
     * @param options the engine options
     * @return the engine
     */
    public static <N, I, D extends Disjunct<D>, ND extends AbstractState<ND>, A>
            AbstractInterpreter<N, I, DisjunctiveState<D, ND>, A> disjunctive(
                    DisjunctiveDomain<D, ND> domain,
                    DisjunctReadyTransferFunction<N, I, D, ND, A> transfer,
                    FixpointOptions options) {
        return new WtoInterpreter<>(
                Direction.FORWARD,
                new DisjunctiveTransferFunction<>(domain, transfer),
                ProcedureCfg::exceptional,
                options);
    }
}
