package org.absint.dataflow.disjunctive;

import java.util.Collections;
import java.util.List;
import org.absint.dataflow.analysis.AbstractState;

/**
 * An abstract state made of an ordered list of disjuncts, oldest first, and one non-disjunctive
 * state holding what is true of all of them. The state keeps a reference to the {@link
 * DisjunctiveDomain} that built it, so that its lattice operations use the configured disjunct
 * limit.
 *
 * <p>States are immutable. Equality is object identity.
 *
 * @param <D> the disjunct type
 * @param <ND> the non-disjunctive state type
 */
public final class DisjunctiveState<D extends Disjunct<D>, ND extends AbstractState<ND>>
        implements AbstractState<DisjunctiveState<D, ND>> {

    /** The domain implementing the lattice operations of this state. */
    private final DisjunctiveDomain<D, ND> domain;

    /** The disjuncts, oldest first; unmodifiable. */
    private final List<D> disjuncts;

    /** The state shared by all disjuncts. */
    private final ND nonDisjunct;

    /**
     * Create a state. Use the factory methods of {@link DisjunctiveDomain}.
     *
     * @param domain the domain
     * @param disjuncts the disjuncts, oldest first; the list must not be modified afterwards
     * @param nonDisjunct the non-disjunctive state
     */
    DisjunctiveState(DisjunctiveDomain<D, ND> domain, List<D> disjuncts, ND nonDisjunct) {
        this.domain = domain;
        this.disjuncts = Collections.unmodifiableList(disjuncts);
        this.nonDisjunct = nonDisjunct;
    }

    /** @return the domain this state belongs to */
    public DisjunctiveDomain<D, ND> getDomain() {
        return domain;
    }

    /** @return the disjuncts, oldest first */
    public List<D> getDisjuncts() {
        return disjuncts;
    }

    /** @return the non-disjunctive state */
    public ND getNonDisjunct() {
        return nonDisjunct;
    }

    /** @return the number of disjuncts */
    public int size() {
        return disjuncts.size();
    }

    @Override
    public DisjunctiveState<D, ND> leastUpperBound(DisjunctiveState<D, ND> other) {
        return domain.join(this, other);
    }

    @Override
    public boolean isLessOrEqual(DisjunctiveState<D, ND> other) {
        return domain.leq(this, other);
    }

    @Override
    public DisjunctiveState<D, ND> widenedUpperBound(
            DisjunctiveState<D, ND> next, int numIterations) {
        return domain.widen(this, next, numIterations);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(disjuncts.size()).append(" disjuncts:\n");
        for (int i = 0; i < disjuncts.size(); i++) {
            sb.append("  #").append(i).append(": ").append(disjuncts.get(i)).append('\n');
        }
        sb.append("Non-disj state: ").append(nonDisjunct);
        return sb.toString();
    }
}
