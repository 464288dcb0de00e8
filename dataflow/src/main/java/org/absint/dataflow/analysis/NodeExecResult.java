package org.absint.dataflow.analysis;

/** Whether executing a node changed its recorded state. */
public enum NodeExecResult {
    /** The stored state already over-approximates the new input; nothing was updated. */
    REACHED_FIXPOINT,
    /** The node was executed and its state updated; its successors need to be revisited. */
    DID_NOT_REACH_FIXPOINT
}
