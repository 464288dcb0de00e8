package org.absint.dataflow.cfg;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the weak topological order of a control flow graph with Bourdoncle's recursive
 * strategy ("Efficient chaotic iteration strategies with widenings", 1993). Only nodes reachable
 * from the start node appear in the result.
 *
 * <p>The recursion of the algorithm is driven by an explicit stack of frames, so the depth of the
 * graph is not limited by the Java call stack.
 *
 * @param <N> the node type
 */
public final class WeakTopologicalOrder<N> {

    /** Depth-first number of a node that has been assigned to the partition. */
    private static final int DONE = Integer.MAX_VALUE;

    /** The graph being ordered. */
    private final ControlFlowGraph<N, ?> cfg;

    /** Depth-first numbers; absent means not visited yet. */
    private final Map<N, Integer> dfn = new HashMap<>();

    /** The visited nodes not yet assigned to the partition, most recent first. */
    private final Deque<N> stack = new ArrayDeque<>();

    /** The pending visits; the top frame is the one being executed. */
    private final Deque<Frame> frames = new ArrayDeque<>();

    /** The last depth-first number handed out. */
    private int num = 0;

    private WeakTopologicalOrder(ControlFlowGraph<N, ?> cfg) {
        this.cfg = cfg;
    }

    /**
     * Compute the weak topological order of a graph, following both normal and exceptional
     * successors.
     *
     * @param cfg the graph
     * @return its weak topological order
     */
    public static <N> Partition<N> compute(ControlFlowGraph<N, ?> cfg) {
        WeakTopologicalOrder<N> builder = new WeakTopologicalOrder<>(cfg);
        Sequence<N> order = new Sequence<>();
        builder.frames.push(builder.new Visit(cfg.getStartNode(), order, null));
        while (!builder.frames.isEmpty()) {
            builder.frames.peek().step();
        }
        return order.partition;
    }

    private int dfn(N node) {
        Integer n = dfn.get(node);
        return n == null ? 0 : n;
    }

    /** A partition under construction, built back to front. */
    private static final class Sequence<N> {
        /** The elements closed so far. */
        Partition<N> partition = Partition.empty();
    }

    /** A suspended call of the traversal. */
    private abstract class Frame {
        /** Run until the frame either calls a new visit or completes and pops itself. */
        abstract void step();
    }

    /** The visit of a node, closing the node or its component into {@code out}. */
    private final class Visit extends Frame {
        /** The visited node. */
        private final N vertex;

        /** The successors of the node not handled yet. */
        private final Iterator<N> successors;

        /** The partition the node is added to. */
        private final Sequence<N> out;

        /** The visit that called this one, if it waits for the reached depth-first number. */
        private final @Nullable Visit caller;

        /** The smallest depth-first number reachable from the node so far. */
        private int head;

        /** Whether a successor reaches back to the node or above. */
        private boolean loop = false;

        Visit(N vertex, Sequence<N> out, @Nullable Visit caller) {
            this.vertex = vertex;
            this.out = out;
            this.caller = caller;
            stack.push(vertex);
            num++;
            dfn.put(vertex, num);
            this.head = num;
            this.successors = cfg.getSuccessors(vertex).iterator();
        }

        void reached(int min) {
            if (min <= head) {
                head = min;
                loop = true;
            }
        }

        @Override
        void step() {
            while (successors.hasNext()) {
                N succ = successors.next();
                int succDfn = dfn(succ);
                if (succDfn == 0) {
                    frames.push(new Visit(succ, out, this));
                    return;
                }
                reached(succDfn);
            }
            frames.pop();
            if (head == dfn(vertex)) {
                dfn.put(vertex, DONE);
                N element = stack.pop();
                if (loop) {
                    while (!element.equals(vertex)) {
                        dfn.remove(element);
                        element = stack.pop();
                    }
                    frames.push(new ComponentVisit(vertex, out));
                } else {
                    out.partition = Partition.node(vertex, out.partition);
                }
            }
            if (caller != null) {
                caller.reached(head);
            }
        }
    }

    /** The construction of the component headed by a node, closed into {@code out}. */
    private final class ComponentVisit extends Frame {
        /** The head of the component. */
        private final N head;

        /** The successors of the head not handled yet. */
        private final Iterator<N> successors;

        /** The nested partition of the component. */
        private final Sequence<N> rest = new Sequence<>();

        /** The partition the component is added to. */
        private final Sequence<N> out;

        ComponentVisit(N head, Sequence<N> out) {
            this.head = head;
            this.out = out;
            this.successors = cfg.getSuccessors(head).iterator();
        }

        @Override
        void step() {
            while (successors.hasNext()) {
                N succ = successors.next();
                if (dfn(succ) == 0) {
                    frames.push(new Visit(succ, rest, null));
                    return;
                }
            }
            frames.pop();
            out.partition = Partition.component(head, rest.partition, out.partition);
        }
    }
}
