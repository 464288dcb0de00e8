package org.absint.dataflow.disjunctive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.absint.dataflow.analysis.AbstractState;
import org.absint.dataflow.analysis.FixpointContext;
import org.absint.dataflow.analysis.InstructionExecutor;
import org.absint.dataflow.analysis.NodeTransferFunction;
import org.absint.dataflow.analysis.State;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link DisjunctReadyTransferFunction} on {@link DisjunctiveState}s.
 *
 * <p>A node is executed once per disjunct of its input, each time starting from that disjunct
 * alone, and the results are accumulated into the previous output of the node. Before each
 * disjunct, the number of disjuncts the node may still produce is stored in the {@link
 * FixpointContext}; instructions stop executing disjuncts once it is used up. On a revisit, input
 * disjuncts that were already part of the previous input are not executed again.
 *
 * @param <N> the node type of the control flow graph
 * @param <I> the instruction type
 * @param <D> the disjunct type
 * @param <ND> the non-disjunctive state type
 * @param <A> the type of the client data passed through the analysis unchanged
 */
public class DisjunctiveTransferFunction<
                N, I, D extends Disjunct<D>, ND extends AbstractState<ND>, A>
        implements NodeTransferFunction<N, I, DisjunctiveState<D, ND>, A> {

    private static final Logger logger =
            LoggerFactory.getLogger(DisjunctiveTransferFunction.class);

    /** The domain of the states. */
    protected final DisjunctiveDomain<D, ND> domain;

    /** The single-disjunct transfer function. */
    protected final DisjunctReadyTransferFunction<N, I, D, ND, A> transfer;

    /**
     * @param domain the domain of the states
     * @param transfer the single-disjunct transfer function
     */
    public DisjunctiveTransferFunction(
            DisjunctiveDomain<D, ND> domain,
            DisjunctReadyTransferFunction<N, I, D, ND, A> transfer) {
        this.domain = domain;
        this.transfer = transfer;
    }

    /** @return the domain of the states */
    public DisjunctiveDomain<D, ND> getDomain() {
        return domain;
    }

    @Override
    public @Nullable DisjunctiveState<D, ND> joinAll(
            List<DisjunctiveState<D, ND>> states, @Nullable DisjunctiveState<D, ND> into) {
        return domain.joinAll(states, into);
    }

    @Override
    public DisjunctiveState<D, ND> filterNormal(DisjunctiveState<D, ND> state) {
        return domain.filterNormal(state);
    }

    @Override
    public DisjunctiveState<D, ND> filterExceptional(DisjunctiveState<D, ND> state) {
        return domain.filterExceptional(state);
    }

    @Override
    public DisjunctiveState<D, ND> transformOnExceptionalEdge(DisjunctiveState<D, ND> state) {
        return domain.transformOnExceptionalEdge(state);
    }

    @Override
    public DisjunctiveState<D, ND> execInstr(
            DisjunctiveState<D, ND> pre,
            FixpointContext<A> context,
            N node,
            int instrIndex,
            I instr) {
        int limit = context.getRemainingDisjuncts();
        List<D> post = Collections.emptyList();
        List<ND> nonDisjuncts = new ArrayList<>();
        List<D> preDisjuncts = pre.getDisjuncts();
        for (int i = 0; i < preDisjuncts.size(); i++) {
            if (post.size() >= limit) {
                logger.trace("Reached the disjunct limit, skipping disjunct #{} at {}", i, node);
                continue;
            }
            context.checkCancelled();
            ExecutionResult<D, ND> result =
                    transfer.execInstr(
                            preDisjuncts.get(i),
                            pre.getNonDisjunct(),
                            context,
                            node,
                            instrIndex,
                            instr);
            post = DisjunctiveDomain.joinUpTo(limit, post, result.getDisjuncts());
            nonDisjuncts.add(result.getNonDisjunct());
        }
        ND nonDisjunct;
        if (post.isEmpty()) {
            nonDisjunct = pre.getNonDisjunct();
        } else {
            nonDisjunct = domain.getLattice().bottom();
            for (ND other : nonDisjuncts) {
                nonDisjunct = nonDisjunct.leastUpperBound(other);
            }
        }
        return domain.state(post, nonDisjunct);
    }

    @Override
    public DisjunctiveState<D, ND> execNodeInstrs(
            @Nullable State<DisjunctiveState<D, ND>> oldState,
            InstructionExecutor<I, DisjunctiveState<D, ND>> executor,
            DisjunctiveState<D, ND> pre,
            List<I> instrs,
            FixpointContext<A> context) {
        int disjunctLimit = domain.getConfig().getDisjunctLimit();
        List<D> previousPre =
                oldState == null
                        ? Collections.<D>emptyList()
                        : oldState.getPre().getDisjuncts();
        List<D> post;
        ND nonDisjunct;
        if (oldState == null) {
            post = Collections.emptyList();
            nonDisjunct = domain.getLattice().bottom();
        } else {
            post = oldState.getPost().getDisjuncts();
            nonDisjunct = oldState.getPost().getNonDisjunct();
        }

        List<D> preDisjuncts = pre.getDisjuncts();
        for (int i = 0; i < preDisjuncts.size(); i++) {
            D disjunct = preDisjuncts.get(i);
            int limit = disjunctLimit - post.size();
            context.setRemainingDisjuncts(limit);
            if (limit <= 0) {
                logger.trace("Reached the disjunct limit, skipping disjunct #{}", i);
                continue;
            }
            if (containsFast(previousPre, disjunct)) {
                logger.trace("Skipping already visited disjunct #{}", i);
                continue;
            }
            logger.trace("Executing disjunct #{} with remaining budget {}", i, limit);
            DisjunctiveState<D, ND> state = domain.singleton(disjunct, pre.getNonDisjunct());
            for (int j = 0; j < instrs.size(); j++) {
                state = executor.exec(j, state, instrs.get(j));
            }
            post = DisjunctiveDomain.joinUpTo(disjunctLimit, post, state.getDisjuncts());
            nonDisjunct = nonDisjunct.leastUpperBound(state.getNonDisjunct());
        }

        if (!post.isEmpty() && !anyExecutable(post)) {
            nonDisjunct =
                    domain.getConfig().isBottomWhenExhausted()
                            ? domain.getLattice().bottom()
                            : domain.getLattice().top();
        }
        return domain.state(post, nonDisjunct);
    }

    private static <D extends Disjunct<D>> boolean containsFast(List<D> disjuncts, D disjunct) {
        for (D other : disjuncts) {
            if (other.equalFast(disjunct)) {
                return true;
            }
        }
        return false;
    }

    private static <D extends Disjunct<D>> boolean anyExecutable(List<D> disjuncts) {
        for (D disjunct : disjuncts) {
            if (disjunct.isExecutable()) {
                return true;
            }
        }
        return false;
    }
}
