package org.absint.dataflow.analysis;

import java.util.function.Function;
import org.absint.dataflow.cfg.ControlFlowGraph;
import org.absint.dataflow.cfg.Procedure;
import org.absint.dataflow.cfg.Scheduler;
import org.absint.dataflow.cfg.Scheduler.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixpoint engine driven by a {@link Scheduler}: every time a node changes, its successors are
 * scheduled again, until the worklist is empty. Loop heads, as given by {@link
 * ControlFlowGraph#isLoopHead}, are widened. This engine never narrows; the {@code doNarrowing}
 * flag is accepted and ignored.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public class WorklistInterpreter<N, I, S extends AbstractState<S>, A>
        extends AbstractInterpreterBase<N, I, S, A> {

    private static final Logger logger = LoggerFactory.getLogger(WorklistInterpreter.class);

    /** Creates the worklist of each run. */
    protected final Scheduler.Factory<N> schedulerFactory;

    /**
     * Create a worklist engine.
     *
     * @param direction the direction implied by {@code cfgFactory}
     * @param transferFunction the transfer function
     * @param cfgFactory builds the view of a procedure to iterate over
     * @param schedulerFactory creates the worklist of each run
     * @param options the engine options
     */
    public WorklistInterpreter(
            Direction direction,
            NodeTransferFunction<N, I, S, A> transferFunction,
            Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory,
            Scheduler.Factory<N> schedulerFactory,
            FixpointOptions options) {
        super(direction, transferFunction, cfgFactory, options);
        this.schedulerFactory = schedulerFactory;
    }

    @Override
    protected InvariantMap<N, S> performAnalysis(
            ControlFlowGraph<N, I> cfg,
            FixpointContext<A> context,
            S initial,
            boolean doNarrowing) {
        InvariantMap<N, S> invMap = new InvariantMap<>();
        N start = cfg.getStartNode();
        execNode(cfg, context, start, false, false, initial, invMap);

        Scheduler<N> scheduler = schedulerFactory.empty(cfg);
        scheduler.scheduleSuccessors(start);
        WorkItem<N> item;
        while ((item = scheduler.pop()) != null) {
            if (item.getReadyPredecessors().isEmpty()) {
                continue;
            }
            N node = item.getNode();
            S pre = computePre(cfg, node, invMap);
            if (pre == null) {
                continue;
            }
            NodeExecResult result =
                    execNode(cfg, context, node, cfg.isLoopHead(node), false, pre, invMap);
            if (result == NodeExecResult.DID_NOT_REACH_FIXPOINT) {
                scheduler.scheduleSuccessors(node);
            }
        }
        logger.debug(
                "Analyzed {} nodes of {}", invMap.size(), cfg.getProcedure().getName());
        return invMap;
    }
}
