package org.absint.dataflow.analysis;

/**
 * The invariant recorded for one node: the state before the node, the state after it, and how
 * many times the node has been executed.
 *
 * @param <S> the abstract state type
 */
public final class State<S> {

    /** The input state of the node. */
    private final S pre;

    /** The output state of the node. */
    private final S post;

    /** How many times the node was executed. */
    private final VisitCount visitCount;

    /**
     * Create a node invariant.
     *
     * @param pre the state before the node
     * @param post the state after the node
     * @param visitCount how many times the node has been executed
     */
    public State(S pre, S post, VisitCount visitCount) {
        this.pre = pre;
        this.post = post;
        this.visitCount = visitCount;
    }

    /** @return the state before the node */
    public S getPre() {
        return pre;
    }

    /** @return the state after the node */
    public S getPost() {
        return post;
    }

    /** @return how many times the node has been executed */
    public VisitCount getVisitCount() {
        return visitCount;
    }

    @Override
    public String toString() {
        return "{pre=" + pre + ", post=" + post + ", visits=" + visitCount + "}";
    }
}
