package org.absint.dataflow.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.absint.dataflow.cfg.ControlFlowGraph;
import org.absint.dataflow.cfg.Procedure;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of the parts common to all fixpoint engines: computing the input state of a node
 * from its predecessors, executing a node and deciding whether it reached its fixpoint, and the
 * entry points built on top of {@link #execCfg(ControlFlowGraph, FixpointContext, AbstractState,
 * boolean)}.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <S> the abstract state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public abstract class AbstractInterpreterBase<N, I, S extends AbstractState<S>, A>
        implements AbstractInterpreter<N, I, S, A> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractInterpreterBase.class);

    /** The direction of this engine. */
    protected final Direction direction;

    /** The transfer function used to execute nodes. */
    protected final NodeTransferFunction<N, I, S, A> transferFunction;

    /** Builds the view of a procedure this engine iterates over. */
    protected final Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory;

    /** Limits on widening and narrowing, and the timeout of each run. */
    protected final FixpointOptions options;

    /**
     * Create an engine.
     *
     * @param direction the direction implied by {@code cfgFactory}
     * @param transferFunction the transfer function
     * @param cfgFactory builds the view of a procedure to iterate over
     * @param options the engine options
     */
    protected AbstractInterpreterBase(
            Direction direction,
            NodeTransferFunction<N, I, S, A> transferFunction,
            Function<Procedure<N, I>, ? extends ControlFlowGraph<N, I>> cfgFactory,
            FixpointOptions options) {
        this.direction = direction;
        this.transferFunction = transferFunction;
        this.cfgFactory = cfgFactory;
        this.options = options;
    }

    @Override
    public Direction getDirection() {
        return direction;
    }

    @Override
    public NodeTransferFunction<N, I, S, A> getTransferFunction() {
        return transferFunction;
    }

    @Override
    public FixpointOptions getOptions() {
        return options;
    }

    @Override
    public ControlFlowGraph<N, I> cfgOf(Procedure<N, I> procedure) {
        return cfgFactory.apply(procedure);
    }

    /**
     * Run the engine on {@code cfg}. Implementations start from an empty invariant map and
     * execute the start node with {@code initial}.
     *
     * @param cfg the graph
     * @param context the context of this run
     * @param initial the state before the start node
     * @param doNarrowing whether to refine the widened invariants by narrowing
     * @return the invariant map
     */
    protected abstract InvariantMap<N, S> performAnalysis(
            ControlFlowGraph<N, I> cfg, FixpointContext<A> context, S initial, boolean doNarrowing);

    @Override
    public InvariantMap<N, S> execCfg(
            ControlFlowGraph<N, I> cfg, A analysisData, S initial, boolean doNarrowing) {
        return execCfg(cfg, FixpointContext.create(analysisData, options), initial, doNarrowing);
    }

    @Override
    public InvariantMap<N, S> execCfg(
            ControlFlowGraph<N, I> cfg,
            FixpointContext<A> context,
            S initial,
            boolean doNarrowing) {
        context.enter();
        try {
            return performAnalysis(cfg, context, initial, doNarrowing);
        } finally {
            context.exit();
        }
    }

    @Override
    public InvariantMap<N, S> execProcedure(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing) {
        return execCfg(cfgOf(procedure), analysisData, initial, doNarrowing);
    }

    @Override
    public @Nullable S computePost(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing) {
        ControlFlowGraph<N, I> cfg = cfgOf(procedure);
        InvariantMap<N, S> invMap = execCfg(cfg, analysisData, initial, doNarrowing);
        S post = invMap.extractPost(cfg.getExitNode());
        if (post == null) {
            logger.debug(
                    "Exit node {} of {} is unreachable", cfg.getExitNode(), procedure.getName());
        }
        return post;
    }

    @Override
    public PostPair<S> computePostIncludingExceptional(
            A analysisData, S initial, Procedure<N, I> procedure, boolean doNarrowing) {
        ControlFlowGraph<N, I> cfg = cfgOf(procedure);
        InvariantMap<N, S> invMap = execCfg(cfg, analysisData, initial, doNarrowing);
        N sink = cfg.getExceptionSinkNode();
        S exceptionalPost = sink == null ? null : invMap.extractPost(sink);
        return new PostPair<>(invMap.extractPost(cfg.getExitNode()), exceptionalPost);
    }

    /**
     * Compute the input state of {@code node}: the join of the filtered post-states of its normal
     * predecessors, into which the transformed post-states of its exceptional predecessors are
     * joined. Predecessors without a post-state are ignored. The post-states are handed to {@link
     * NodeTransferFunction#joinAll} last predecessor first, which decides whose disjuncts are kept
     * when a disjunct limit is reached.
     *
     * @param cfg the graph
     * @param node the node
     * @param invMap the invariants computed so far
     * @return the input state, or {@code null} if no predecessor has been analyzed yet
     */
    protected @Nullable S computePre(
            ControlFlowGraph<N, I> cfg, N node, InvariantMap<N, S> invMap) {
        List<S> normalPosts = new ArrayList<>();
        for (N pred : cfg.getNormalPredecessors(node)) {
            S post = invMap.extractPost(pred);
            if (post != null) {
                normalPosts.add(transferFunction.filterNormal(post));
            }
        }
        Collections.reverse(normalPosts);
        S pre = transferFunction.joinAll(normalPosts, null);
        List<S> exceptionalPosts = new ArrayList<>();
        for (N pred : cfg.getExceptionalPredecessors(node)) {
            S post = invMap.extractPost(pred);
            if (post != null) {
                exceptionalPosts.add(transferFunction.transformOnExceptionalEdge(post));
            }
        }
        Collections.reverse(exceptionalPosts);
        return transferFunction.joinAll(exceptionalPosts, pre);
    }

    /**
     * Execute {@code node} with input {@code pre} and update {@code invMap}.
     *
     * <p>On the first visit the node is executed and recorded with visit count one. Later visits
     * first widen the stored input with {@code pre} when {@code isLoopHead} and not narrowing,
     * then test for convergence against the stored input: when widening, the node converged if
     * the new input is below the old one; when narrowing, it converged if the narrowing limit is
     * exceeded, the old input is below the new one, or the two are incomparable. A node that did
     * not converge is re-executed and recorded with its visit count incremented.
     *
     * @param cfg the graph
     * @param context the context of the run
     * @param node the node to execute
     * @param isLoopHead whether to widen at this node
     * @param isNarrowing whether the run is in a narrowing phase
     * @param pre the new input state of the node
     * @param invMap the invariants computed so far
     * @return whether the node reached its fixpoint
     * @throws DivergenceException if the node was widened more often than allowed
     */
    protected NodeExecResult execNode(
            ControlFlowGraph<N, I> cfg,
            FixpointContext<A> context,
            N node,
            boolean isLoopHead,
            boolean isNarrowing,
            S pre,
            InvariantMap<N, S> invMap) {
        State<S> oldState = invMap.extractState(node);
        if (oldState == null) {
            S post = execNodeInstrs(cfg, context, node, null, pre);
            invMap.put(node, new State<>(pre, post, VisitCount.first()));
            return NodeExecResult.DID_NOT_REACH_FIXPOINT;
        }

        S oldPre = oldState.getPre();
        VisitCount visitCount = oldState.getVisitCount();
        S newPre;
        if (isLoopHead && !isNarrowing) {
            newPre = oldPre.widenedUpperBound(pre, visitCount.intValue());
        } else {
            newPre = pre;
        }

        boolean converged;
        if (isNarrowing) {
            if (visitCount.intValue() > options.getMaxNarrows() || oldPre.isLessOrEqual(newPre)) {
                converged = true;
            } else if (!newPre.isLessOrEqual(oldPre)) {
                logger.debug(
                        "Stop narrowing at {}: the new input is not comparable to the old one",
                        node);
                converged = true;
            } else {
                converged = false;
            }
        } else {
            converged = newPre.isLessOrEqual(oldPre);
        }

        if (converged) {
            logger.trace("Fixpoint reached at {} after {} visits", node, visitCount);
            return NodeExecResult.REACHED_FIXPOINT;
        }
        S post = execNodeInstrs(cfg, context, node, oldState, newPre);
        invMap.put(node, new State<>(newPre, post, visitCount.next(options.getMaxWidens())));
        return NodeExecResult.DID_NOT_REACH_FIXPOINT;
    }

    /**
     * Execute the instructions of {@code node}. A failure of the transfer function is logged
     * once, together with the instruction and node where it happened, and propagated unchanged;
     * control signals pass through without being logged.
     *
     * @param cfg the graph
     * @param context the context of the run
     * @param node the node
     * @param oldState the state stored for the node, or {@code null} on the first visit
     * @param pre the input state
     * @return the output state
     */
    protected S execNodeInstrs(
            ControlFlowGraph<N, I> cfg,
            FixpointContext<A> context,
            N node,
            @Nullable State<S> oldState,
            S pre) {
        InstructionExecutor<I, S> executor =
                (instrIndex, state, instr) -> execInstr(context, node, instrIndex, state, instr);
        return transferFunction.execNodeInstrs(
                oldState, executor, pre, cfg.getInstructions(node), context);
    }

    private S execInstr(FixpointContext<A> context, N node, int instrIndex, S pre, I instr) {
        S post;
        try {
            post = transferFunction.execInstr(pre, context, node, instrIndex, instr);
            context.checkCancelled();
        } catch (AnalysisSignal signal) {
            throw signal;
        } catch (RuntimeException e) {
            if (!context.hasLoggedError()) {
                logger.error("Failure in instruction {} of node {}", instr, node, e);
                context.setLoggedError(true);
            }
            throw e;
        }
        context.setLoggedError(false);
        return post;
    }
}
