package org.absint.dataflow.disjunctive;

import java.util.Collections;
import java.util.List;

/**
 * What executing one instruction from one disjunct produces: any number of disjuncts, and a
 * non-disjunctive state.
 *
 * @param <D> the disjunct type
 * @param <ND> the non-disjunctive state type
 */
public final class ExecutionResult<D, ND> {

    private final List<D> disjuncts;
    private final ND nonDisjunct;

    private ExecutionResult(List<D> disjuncts, ND nonDisjunct) {
        this.disjuncts = disjuncts;
        this.nonDisjunct = nonDisjunct;
    }

    /**
     * @param disjuncts the resulting disjuncts, oldest first; may be empty if the instruction
     *     cannot complete
     * @param nonDisjunct the resulting non-disjunctive state
     * @return the result
     */
    public static <D, ND> ExecutionResult<D, ND> of(List<D> disjuncts, ND nonDisjunct) {
        return new ExecutionResult<>(Collections.unmodifiableList(disjuncts), nonDisjunct);
    }

    /**
     * @param disjunct the single resulting disjunct
     * @param nonDisjunct the resulting non-disjunctive state
     * @return the result
     */
    public static <D, ND> ExecutionResult<D, ND> single(D disjunct, ND nonDisjunct) {
        return new ExecutionResult<>(Collections.singletonList(disjunct), nonDisjunct);
    }

    /** @return the resulting disjuncts */
    public List<D> getDisjuncts() {
        return disjuncts;
    }

    /** @return the resulting non-disjunctive state */
    public ND getNonDisjunct() {
        return nonDisjunct;
    }
}
