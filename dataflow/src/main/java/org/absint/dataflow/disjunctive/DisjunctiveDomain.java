package org.absint.dataflow.disjunctive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import org.absint.dataflow.analysis.AbstractState;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifts a domain of disjuncts and a non-disjunctive domain into a bounded disjunctive domain of
 * {@link DisjunctiveState}s.
 *
 * <p>The number of disjuncts of a state never exceeds {@link DisjunctiveConfig#getDisjunctLimit()}.
 * Disjuncts that do not fit are dropped, so the domain under-approximates past the limit. When
 * merging disjunct lists, the disjuncts already present are kept in preference to incoming ones,
 * and incoming disjuncts are only checked for subsumption against the disjuncts present before the
 * merge.
 *
 * @param <D> the disjunct type
 * @param <ND> the non-disjunctive state type
 */
public final class DisjunctiveDomain<D extends Disjunct<D>, ND extends AbstractState<ND>> {

    private static final Logger logger = LoggerFactory.getLogger(DisjunctiveDomain.class);

    /** The disjunct limit and widening policy. */
    private final DisjunctiveConfig config;

    /** The extremal elements of the non-disjunctive domain. */
    private final NonDisjunctiveLattice<ND> lattice;

    /**
     * Create a disjunctive domain.
     *
     * @param config the disjunct limit and widening policy
     * @param lattice the extremal elements of the non-disjunctive domain
     */
    public DisjunctiveDomain(DisjunctiveConfig config, NonDisjunctiveLattice<ND> lattice) {
        this.config = config;
        this.lattice = lattice;
    }

    /** @return the configuration of this domain */
    public DisjunctiveConfig getConfig() {
        return config;
    }

    /** @return the extremal elements of the non-disjunctive domain */
    public NonDisjunctiveLattice<ND> getLattice() {
        return lattice;
    }

    /** @return the state with no disjunct and a bottom non-disjunctive part */
    public DisjunctiveState<D, ND> bottom() {
        return new DisjunctiveState<>(this, Collections.<D>emptyList(), lattice.bottom());
    }

    /**
     * @param disjunct the only disjunct
     * @param nonDisjunct the non-disjunctive part
     * @return a state with a single disjunct
     */
    public DisjunctiveState<D, ND> singleton(D disjunct, ND nonDisjunct) {
        return new DisjunctiveState<>(this, Collections.singletonList(disjunct), nonDisjunct);
    }

    /**
     * Create a state. The list is copied; it may be longer than the disjunct limit, in which case
     * the first joins involving the state will cap it.
     *
     * @param disjuncts the disjuncts, oldest first
     * @param nonDisjunct the non-disjunctive part
     * @return the state
     */
    public DisjunctiveState<D, ND> state(List<D> disjuncts, ND nonDisjunct) {
        return new DisjunctiveState<>(this, new ArrayList<>(disjuncts), nonDisjunct);
    }

    /**
     * Merge {@code rhs} into {@code lhs}. {@code lhs} is first capped to its {@code limit} oldest
     * disjuncts. Then the disjuncts of {@code rhs} are appended in order, skipping those that are
     * {@code leq} one of the disjuncts of the capped {@code lhs}, until the result holds {@code
     * limit} disjuncts.
     *
     * @param limit the maximal number of disjuncts of the result
     * @param leq the subsumption test, called with an incoming disjunct first
     * @param lhs the disjuncts to keep
     * @param rhs the incoming disjuncts
     * @return the merged list, oldest first; {@code lhs} itself when nothing changed
     */
    static <D> List<D> joinUpToWithLeq(
            int limit, BiPredicate<D, D> leq, List<D> lhs, List<D> rhs) {
        List<D> kept = lhs.size() > limit ? lhs.subList(0, limit) : lhs;
        if (kept == rhs || kept.size() >= limit) {
            return kept;
        }
        List<D> result = null;
        int size = kept.size();
        for (D incoming : rhs) {
            if (size >= limit) {
                break;
            }
            if (hasGeqDisjunct(leq, incoming, kept)) {
                continue;
            }
            if (result == null) {
                result = new ArrayList<>(kept);
            }
            result.add(incoming);
            size++;
        }
        return result == null ? kept : result;
    }

    /**
     * {@link #joinUpToWithLeq} with {@link Disjunct#equalFast} as the subsumption test.
     *
     * @param limit the maximal number of disjuncts of the result
     * @param lhs the disjuncts to keep
     * @param rhs the incoming disjuncts
     * @return the merged list, oldest first
     */
    static <D extends Disjunct<D>> List<D> joinUpTo(int limit, List<D> lhs, List<D> rhs) {
        return joinUpToWithLeq(limit, Disjunct::equalFast, lhs, rhs);
    }

    private static <D> boolean hasGeqDisjunct(BiPredicate<D, D> leq, D disjunct, List<D> in) {
        for (D other : in) {
            if (leq.test(disjunct, other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether the disjuncts of {@code disjuncts} appear in {@code of} in the same order,
     * comparing them with {@link Disjunct#equalFast}.
     *
     * @param disjuncts the candidate subsequence
     * @param of the sequence
     * @return true if {@code disjuncts} is a subsequence of {@code of}
     */
    static <D extends Disjunct<D>> boolean isTrivialSubset(List<D> disjuncts, List<D> of) {
        int j = 0;
        for (D disjunct : disjuncts) {
            while (j < of.size() && !disjunct.equalFast(of.get(j))) {
                j++;
            }
            if (j == of.size()) {
                return false;
            }
            j++;
        }
        return true;
    }

    /**
     * Join two states: the disjuncts of {@code rhs} are merged into those of {@code lhs} up to the
     * disjunct limit, and the non-disjunctive parts are joined.
     *
     * @param lhs the state whose disjuncts are kept first
     * @param rhs the other state
     * @return the join
     */
    public DisjunctiveState<D, ND> join(DisjunctiveState<D, ND> lhs, DisjunctiveState<D, ND> rhs) {
        List<D> disjuncts =
                joinUpTo(config.getDisjunctLimit(), lhs.getDisjuncts(), rhs.getDisjuncts());
        return new DisjunctiveState<>(
                this, disjuncts, lhs.getNonDisjunct().leastUpperBound(rhs.getNonDisjunct()));
    }

    /**
     * A cheap and incomplete order: {@code lhs} is below {@code rhs} if they are the same object,
     * or if the disjuncts of {@code lhs} form an ordered subsequence of those of {@code rhs} and
     * the non-disjunctive parts are ordered.
     *
     * @param lhs the left state
     * @param rhs the right state
     * @return true if {@code lhs} is known to be below {@code rhs}
     */
    public boolean leq(DisjunctiveState<D, ND> lhs, DisjunctiveState<D, ND> rhs) {
        return lhs == rhs
                || (isTrivialSubset(lhs.getDisjuncts(), rhs.getDisjuncts())
                        && lhs.getNonDisjunct().isLessOrEqual(rhs.getNonDisjunct()));
    }

    /**
     * Widen {@code prev} with {@code next}. Past {@link DisjunctiveConfig#getWidenIterations()}
     * iterations, {@code prev} is returned unchanged, which may drop the states of {@code next}.
     * Otherwise the disjuncts of {@code next} not subsumed by one of {@code prev} are added up to
     * the limit and the non-disjunctive parts are widened.
     *
     * @param prev the previous state
     * @param next the new state
     * @param numIterations the number of times the node was visited
     * @return the widened state; {@code prev} if it is not below it
     */
    public DisjunctiveState<D, ND> widen(
            DisjunctiveState<D, ND> prev, DisjunctiveState<D, ND> next, int numIterations) {
        if (prev == next) {
            return prev;
        }
        if (numIterations > config.getWidenIterations()) {
            logger.debug(
                    "Iteration {} is past the widening limit {}, keeping the previous state",
                    numIterations,
                    config.getWidenIterations());
            return prev;
        }
        List<D> disjuncts =
                joinUpToWithLeq(
                        config.getDisjunctLimit(),
                        Disjunct::isLessOrEqual,
                        prev.getDisjuncts(),
                        next.getDisjuncts());
        DisjunctiveState<D, ND> post =
                new DisjunctiveState<>(
                        this,
                        disjuncts,
                        prev.getNonDisjunct()
                                .widenedUpperBound(next.getNonDisjunct(), numIterations));
        return leq(post, prev) ? prev : post;
    }

    /**
     * Join many states at once. The disjuncts are taken round-robin from the states (the first
     * disjunct of each state, then the second of each, and so on) after those of {@code into},
     * skipping disjuncts already present, until the limit is reached. The non-disjunctive part is
     * the join of all non-disjunctive parts, starting from that of {@code into} or bottom.
     *
     * @param states the states to join
     * @param into the state to join into, or {@code null}
     * @return the join, or {@code null} if both {@code states} is empty and {@code into} is
     *     {@code null}
     */
    public @Nullable DisjunctiveState<D, ND> joinAll(
            List<DisjunctiveState<D, ND>> states, @Nullable DisjunctiveState<D, ND> into) {
        if (states.isEmpty()) {
            return into;
        }
        if (states.size() == 1 && into == null) {
            return states.get(0);
        }
        List<D> disjuncts =
                into == null ? new ArrayList<D>() : new ArrayList<>(into.getDisjuncts());
        ND nonDisjunct = into == null ? lattice.bottom() : into.getNonDisjunct();

        Deque<Iterator<D>> toJoin = new ArrayDeque<>();
        for (DisjunctiveState<D, ND> state : states) {
            toJoin.addLast(state.getDisjuncts().iterator());
            nonDisjunct = nonDisjunct.leastUpperBound(state.getNonDisjunct());
        }
        int limit = config.getDisjunctLimit();
        while (disjuncts.size() < limit && !toJoin.isEmpty()) {
            Iterator<D> next = toJoin.pollFirst();
            if (!next.hasNext()) {
                continue;
            }
            D disjunct = next.next();
            if (!hasGeqDisjunct(Disjunct::equalFast, disjunct, disjuncts)) {
                disjuncts.add(disjunct);
            }
            toJoin.addLast(next);
        }
        return new DisjunctiveState<>(this, disjuncts, nonDisjunct);
    }

    /**
     * Keep the disjuncts satisfying {@code filter}. If there were disjuncts and none is kept, the
     * non-disjunctive part becomes bottom as well.
     *
     * @param state the state
     * @param filter the disjuncts to keep
     * @return the filtered state
     */
    public DisjunctiveState<D, ND> filterDisjuncts(
            DisjunctiveState<D, ND> state, Predicate<D> filter) {
        List<D> filtered = new ArrayList<>();
        for (D disjunct : state.getDisjuncts()) {
            if (filter.test(disjunct)) {
                filtered.add(disjunct);
            }
        }
        if (filtered.size() == state.size()) {
            return state;
        }
        if (filtered.isEmpty()) {
            return bottom();
        }
        return new DisjunctiveState<>(this, filtered, state.getNonDisjunct());
    }

    /**
     * @param state the state
     * @return the state restricted to its normal disjuncts
     */
    public DisjunctiveState<D, ND> filterNormal(DisjunctiveState<D, ND> state) {
        return filterDisjuncts(state, Disjunct::isNormal);
    }

    /**
     * @param state the state
     * @return the state restricted to its exceptional disjuncts
     */
    public DisjunctiveState<D, ND> filterExceptional(DisjunctiveState<D, ND> state) {
        return filterDisjuncts(state, Disjunct::isExceptional);
    }

    /**
     * Restrict a state to its exceptional disjuncts and turn them into normal ones, as when
     * entering an exception handler.
     *
     * @param state the state
     * @return the transformed state
     */
    public DisjunctiveState<D, ND> transformOnExceptionalEdge(DisjunctiveState<D, ND> state) {
        DisjunctiveState<D, ND> exceptional = filterExceptional(state);
        List<D> normal = new ArrayList<>(exceptional.size());
        for (D disjunct : exceptional.getDisjuncts()) {
            normal.add(disjunct.exceptionalToNormal());
        }
        return new DisjunctiveState<>(this, normal, exceptional.getNonDisjunct());
    }
}
