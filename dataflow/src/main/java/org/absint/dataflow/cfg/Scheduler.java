package org.absint.dataflow.cfg;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides the order in which a worklist engine visits nodes. A scheduler is created empty for one
 * graph and one run; nodes enter it when one of their predecessors changed.
 *
 * @param <N> the node type
 */
public interface Scheduler<N> {

    /**
     * Creates empty schedulers.
     *
     * @param <N> the node type
     */
    @FunctionalInterface
    interface Factory<N> {
        /**
         * @param cfg the graph to schedule
         * @return an empty scheduler for {@code cfg}
         */
        Scheduler<N> empty(ControlFlowGraph<N, ?> cfg);
    }

    /**
     * Schedule the successors of a node whose post-state changed.
     *
     * @param node the node
     */
    void scheduleSuccessors(N node);

    /**
     * Remove the next node to visit.
     *
     * @return the next node and the predecessors that scheduled it, or {@code null} when there is
     *     no more work
     */
    @Nullable WorkItem<N> pop();

    /**
     * A scheduled node.
     *
     * @param <N> the node type
     */
    final class WorkItem<N> {
        private final N node;
        private final List<N> readyPredecessors;

        /**
         * @param node the node to visit
         * @param readyPredecessors the predecessors whose change scheduled the node
         */
        public WorkItem(N node, List<N> readyPredecessors) {
            this.node = node;
            this.readyPredecessors = readyPredecessors;
        }

        /** @return the node to visit */
        public N getNode() {
            return node;
        }

        /**
         * @return the predecessors whose change scheduled the node; empty if the node carries no
         *     pending work
         */
        public List<N> getReadyPredecessors() {
            return readyPredecessors;
        }
    }
}
