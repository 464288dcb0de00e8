package org.absint.dataflow.disjunctive;

import org.absint.dataflow.analysis.AbstractState;

/**
 * The extremal elements of the domain tracked next to the disjuncts.
 *
 * @param <ND> the non-disjunctive state type
 */
public interface NonDisjunctiveLattice<ND extends AbstractState<ND>> {

    /** @return the least element */
    ND bottom();

    /** @return the greatest element */
    ND top();
}
