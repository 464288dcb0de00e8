package org.absint.dataflow.analysis;

import java.util.function.Function;
import org.absint.dataflow.cfg.ControlFlowGraph;
import org.absint.dataflow.cfg.Partition;
import org.absint.dataflow.cfg.Procedure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixpoint engine following the recursive iteration strategy over a weak topological order:
 * plain nodes are executed once in order, and every component is iterated until its head
 * stabilizes, widening at the head.
 *
 * <p>With narrowing enabled, every component is first stabilized by widening and then refined
 * by narrowing, after which a final narrowing pass is made over the whole graph. Narrowing is
 * bounded by {@link FixpointOptions#getMaxNarrows()} and stops at a node as soon as its inputs
 * become incomparable.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public class WtoInterpreter<N, I, S extends AbstractState<S>, A>
        extends AbstractInterpreterBase<N, I, S, A> {

    private static final Logger logger = LoggerFactory.getLogger(WtoInterpreter.class);

    /** The iteration mode of a traversal of the weak topological order. */
    protected enum Mode {
        /** Widen at component heads. */
        WIDEN,
        /** Stabilize each component by widening, then refine it by narrowing. */
        WIDEN_THEN_NARROW,
        /** Narrow at component heads. */
        NARROW;

        boolean isNarrowing() {
            return this == NARROW;
        }
    }

    /**
     * Create a WTO engine.
     *
     * @param direction the direction implied by {@code cfgFactory}
     * @param transferFunction the transfer function
     * @param cfgFactory builds the view of a procedure to iterate over
     * @param options the engine options
     */
    public WtoInterpreter(
            Direction direction,
            NodeTransferFunction<N, I, S, A> transferFunction,
            Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory,
            FixpointOptions options) {
        super(direction, transferFunction, cfgFactory, options);
    }

    @Override
    protected InvariantMap<N, S> performAnalysis(
            ControlFlowGraph<N, I> cfg,
            FixpointContext<A> context,
            S initial,
            boolean doNarrowing) {
        InvariantMap<N, S> invMap = new InvariantMap<>();
        Partition<N> wto = cfg.getWeakTopologicalOrder();
        logger.debug("Weak topological order of {}: {}", cfg.getProcedure().getName(), wto);
        switch (wto.getKind()) {
            case EMPTY:
                return invMap;
            case COMPONENT:
                throw new BugInDataflow("Did not expect the start node to be part of a loop");
            case NODE:
                break;
            default:
                throw new BugInDataflow("Unexpected partition kind: " + wto.getKind());
        }
        Partition.NodeElement<N> first = (Partition.NodeElement<N>) wto;
        execNode(cfg, context, first.getNode(), false, false, initial, invMap);
        Run run = new Run(cfg, context, invMap, doNarrowing);
        if (doNarrowing) {
            run.execPartition(Mode.WIDEN_THEN_NARROW, true, first.getNext());
            run.execPartition(Mode.NARROW, true, first.getNext());
        } else {
            run.execPartition(Mode.WIDEN, true, first.getNext());
        }
        return invMap;
    }

    /** The traversal of the weak topological order of one graph. */
    private final class Run {
        /** The graph being analyzed. */
        private final ControlFlowGraph<N, I> cfg;

        /** The context of the run. */
        private final FixpointContext<A> context;

        /** The invariants computed so far, updated in place. */
        private final InvariantMap<N, S> invMap;

        /** Whether components entered for the first time are narrowed after widening. */
        private final boolean doNarrowing;

        Run(
                ControlFlowGraph<N, I> cfg,
                FixpointContext<A> context,
                InvariantMap<N, S> invMap,
                boolean doNarrowing) {
            this.cfg = cfg;
            this.context = context;
            this.invMap = invMap;
            this.doNarrowing = doNarrowing;
        }

        NodeExecResult execWtoNode(Mode mode, boolean isLoopHead, N node) {
            S pre = computePre(cfg, node, invMap);
            if (pre == null) {
                throw new BugInDataflow("Could not compute the pre of a node");
            }
            return execNode(cfg, context, node, isLoopHead, mode.isNarrowing(), pre, invMap);
        }

        void execPartition(Mode mode, boolean isFirstVisit, Partition<N> partition) {
            Partition<N> current = partition;
            while (current.getKind() != Partition.Kind.EMPTY) {
                if (current.getKind() == Partition.Kind.NODE) {
                    Partition.NodeElement<N> element = (Partition.NodeElement<N>) current;
                    execWtoNode(mode, false, element.getNode());
                    current = element.getNext();
                } else {
                    Partition.Component<N> component = (Partition.Component<N>) current;
                    boolean widenThenNarrow =
                            mode == Mode.WIDEN_THEN_NARROW
                                    || (mode == Mode.WIDEN && isFirstVisit && doNarrowing);
                    if (widenThenNarrow) {
                        execComponent(Mode.WIDEN, isFirstVisit, component);
                        execComponent(Mode.NARROW, isFirstVisit, component);
                    } else {
                        execComponent(mode, isFirstVisit, component);
                    }
                    current = component.getNext();
                }
            }
        }

        /**
         * Iterate a component until its head reaches a fixpoint. The head is not widened on
         * entry, only on the subsequent iterations. When narrowing a component for the first
         * time, its body is executed once more after the head stabilized, so that the narrowed
         * head value reaches the body.
         */
        void execComponent(Mode mode, boolean isFirstVisit, Partition.Component<N> component) {
            N head = component.getHead();
            boolean isLoopHead = false;
            boolean firstVisit = isFirstVisit;
            while (true) {
                NodeExecResult result = execWtoNode(mode, isLoopHead, head);
                if (result == NodeExecResult.REACHED_FIXPOINT
                        && !(mode.isNarrowing() && firstVisit)) {
                    return;
                }
                execPartition(mode, firstVisit, component.getRest());
                isLoopHead = true;
                firstVisit = false;
            }
        }
    }
}
