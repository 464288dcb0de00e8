package org.absint.dataflow.cfg;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Scheduler} that always visits the pending node that comes first in reverse postorder.
 * Along acyclic paths a node is therefore first visited after all of its predecessors; nodes in
 * loops are visited again whenever a back edge changes their input.
 *
 * @param <N> the node type
 */
public final class ReversePostorderScheduler<N> implements Scheduler<N> {

    private final ControlFlowGraph<N, ?> cfg;

    /** Reverse postorder index of every node reachable from the start node. */
    private final Map<N, Integer> order;

    /** Indices handed out to nodes not reachable from the start node. */
    private int nextUnreachableIndex;

    /** Pending work, by reverse postorder index. */
    private final TreeMap<Integer, WorkUnit<N>> worklist = new TreeMap<>();

    private ReversePostorderScheduler(ControlFlowGraph<N, ?> cfg) {
        this.cfg = cfg;
        this.order = reversePostorder(cfg);
        this.nextUnreachableIndex = order.size();
    }

    /** @return a factory of reverse postorder schedulers */
    public static <N> Scheduler.Factory<N> factory() {
        return ReversePostorderScheduler::new;
    }

    /**
     * Create an empty scheduler.
     *
     * @param cfg the graph to schedule
     * @return an empty scheduler
     */
    public static <N> ReversePostorderScheduler<N> empty(ControlFlowGraph<N, ?> cfg) {
        return new ReversePostorderScheduler<>(cfg);
    }

    /**
     * Number the nodes reachable from the start node in reverse postorder of a depth-first
     * traversal.
     *
     * @param cfg the graph
     * @return the index of every reachable node
     */
    static <N> Map<N, Integer> reversePostorder(ControlFlowGraph<N, ?> cfg) {
        List<N> postorder = new ArrayList<>();
        Set<N> visited = new HashSet<>();
        // explicit stack of (node, index of the next successor to explore)
        List<N> nodeStack = new ArrayList<>();
        List<Integer> succIndexStack = new ArrayList<>();
        N start = cfg.getStartNode();
        visited.add(start);
        nodeStack.add(start);
        succIndexStack.add(0);
        while (!nodeStack.isEmpty()) {
            int top = nodeStack.size() - 1;
            N node = nodeStack.get(top);
            List<N> succs = cfg.getSuccessors(node);
            int next = succIndexStack.get(top);
            if (next < succs.size()) {
                succIndexStack.set(top, next + 1);
                N succ = succs.get(next);
                if (visited.add(succ)) {
                    nodeStack.add(succ);
                    succIndexStack.add(0);
                }
            } else {
                postorder.add(node);
                nodeStack.remove(top);
                succIndexStack.remove(top);
            }
        }
        Map<N, Integer> order = new HashMap<>();
        for (int i = postorder.size() - 1, index = 0; i >= 0; i--, index++) {
            order.put(postorder.get(i), index);
        }
        return order;
    }

    private int indexOf(N node) {
        Integer index = order.get(node);
        if (index == null) {
            index = nextUnreachableIndex++;
            order.put(node, index);
        }
        return index;
    }

    @Override
    public void scheduleSuccessors(N node) {
        for (N succ : cfg.getSuccessors(node)) {
            int index = indexOf(succ);
            WorkUnit<N> unit = worklist.get(index);
            if (unit == null) {
                unit = new WorkUnit<>(succ);
                worklist.put(index, unit);
            }
            unit.readyPredecessors.add(node);
        }
    }

    @Override
    public @Nullable WorkItem<N> pop() {
        Map.Entry<Integer, WorkUnit<N>> first = worklist.pollFirstEntry();
        if (first == null) {
            return null;
        }
        WorkUnit<N> unit = first.getValue();
        return new WorkItem<>(unit.node, new ArrayList<>(unit.readyPredecessors));
    }

    /** @return true if no work is pending */
    public boolean isEmpty() {
        return worklist.isEmpty();
    }

    /** A pending node and the predecessors that scheduled it. */
    private static final class WorkUnit<N> {
        final N node;
        final Set<N> readyPredecessors = new LinkedHashSet<>();

        WorkUnit(N node) {
            this.node = node;
        }
    }
}
