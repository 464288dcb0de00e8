package org.absint.dataflow.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Procedure} held in memory, built node by node with a {@link Builder}. Front ends that
 * already have their own graph representation implement {@link Procedure} directly instead.
 *
 * @param <I> the instruction type
 */
public final class SimpleProcedure<I> implements Procedure<SimpleNode, I> {

    private final String name;
    private final List<SimpleNode> nodes;
    private final List<List<I>> instructions;
    private final List<List<SimpleNode>> normalSuccs;
    private final List<List<SimpleNode>> exceptionalSuccs;
    private final List<List<SimpleNode>> normalPreds;
    private final List<List<SimpleNode>> exceptionalPreds;
    private final SimpleNode start;
    private final SimpleNode exit;
    private final @Nullable SimpleNode exceptionSink;

    private SimpleProcedure(Builder<I> builder) {
        this.name = builder.name;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.nodes));
        this.instructions = freeze(builder.instructions);
        this.normalSuccs = freeze(builder.normalSuccs);
        this.exceptionalSuccs = freeze(builder.exceptionalSuccs);
        this.normalPreds = freeze(builder.normalPreds);
        this.exceptionalPreds = freeze(builder.exceptionalPreds);
        this.start = builder.start;
        this.exit = builder.exit;
        this.exceptionSink = builder.exceptionSink;
    }

    private static <T> List<List<T>> freeze(List<List<T>> lists) {
        List<List<T>> result = new ArrayList<>(lists.size());
        for (List<T> list : lists) {
            result.add(Collections.unmodifiableList(new ArrayList<>(list)));
        }
        return result;
    }

    /**
     * Start building a procedure.
     *
     * @param name the name of the procedure
     * @return a builder
     */
    public static <I> Builder<I> builder(String name) {
        return new Builder<>(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Collection<SimpleNode> getNodes() {
        return nodes;
    }

    @Override
    public SimpleNode getStartNode() {
        return start;
    }

    @Override
    public SimpleNode getExitNode() {
        return exit;
    }

    @Override
    public @Nullable SimpleNode getExceptionSinkNode() {
        return exceptionSink;
    }

    @Override
    public List<I> getInstructions(SimpleNode node) {
        return instructions.get(index(node));
    }

    @Override
    public List<SimpleNode> getNormalSuccessors(SimpleNode node) {
        return normalSuccs.get(index(node));
    }

    @Override
    public List<SimpleNode> getExceptionalSuccessors(SimpleNode node) {
        return exceptionalSuccs.get(index(node));
    }

    @Override
    public List<SimpleNode> getNormalPredecessors(SimpleNode node) {
        return normalPreds.get(index(node));
    }

    @Override
    public List<SimpleNode> getExceptionalPredecessors(SimpleNode node) {
        return exceptionalPreds.get(index(node));
    }

    private int index(SimpleNode node) {
        int id = node.getId();
        if (id < 0 || id >= nodes.size() || nodes.get(id) != node) {
            throw new IllegalArgumentException(node + " is not a node of " + name);
        }
        return id;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Builder for {@link SimpleProcedure}. The first node added is the start node and the last
     * one the exit node, unless set explicitly.
     *
     * @param <I> the instruction type
     */
    public static final class Builder<I> {
        private final String name;
        private final List<SimpleNode> nodes = new ArrayList<>();
        private final List<List<I>> instructions = new ArrayList<>();
        private final List<List<SimpleNode>> normalSuccs = new ArrayList<>();
        private final List<List<SimpleNode>> exceptionalSuccs = new ArrayList<>();
        private final List<List<SimpleNode>> normalPreds = new ArrayList<>();
        private final List<List<SimpleNode>> exceptionalPreds = new ArrayList<>();
        private @Nullable SimpleNode start = null;
        private @Nullable SimpleNode exit = null;
        private @Nullable SimpleNode exceptionSink = null;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Add a node.
         *
         * @param label a name used when printing the node
         * @param instrs the instructions of the node
         * @return the new node
         */
        @SafeVarargs
        public final SimpleNode addNode(String label, I... instrs) {
            return addNode(label, Arrays.asList(instrs));
        }

        /**
         * Add a node.
         *
         * @param label a name used when printing the node
         * @param instrs the instructions of the node
         * @return the new node
         */
        public SimpleNode addNode(String label, List<I> instrs) {
            SimpleNode node = new SimpleNode(nodes.size(), label);
            nodes.add(node);
            instructions.add(new ArrayList<>(instrs));
            normalSuccs.add(new ArrayList<>());
            exceptionalSuccs.add(new ArrayList<>());
            normalPreds.add(new ArrayList<>());
            exceptionalPreds.add(new ArrayList<>());
            return node;
        }

        /**
         * Add a normal edge.
         *
         * @param from the source node
         * @param to the target node
         * @return this builder
         */
        public Builder<I> addEdge(SimpleNode from, SimpleNode to) {
            checkOwned(from);
            checkOwned(to);
            normalSuccs.get(from.getId()).add(to);
            normalPreds.get(to.getId()).add(from);
            return this;
        }

        /**
         * Add an exceptional edge.
         *
         * @param from the node that may throw
         * @param to the handler or exception sink
         * @return this builder
         */
        public Builder<I> addExceptionalEdge(SimpleNode from, SimpleNode to) {
            checkOwned(from);
            checkOwned(to);
            exceptionalSuccs.get(from.getId()).add(to);
            exceptionalPreds.get(to.getId()).add(from);
            return this;
        }

        /**
         * @param start the node control enters through
         * @return this builder
         */
        public Builder<I> setStartNode(SimpleNode start) {
            checkOwned(start);
            this.start = start;
            return this;
        }

        /**
         * @param exit the node of the normal exit
         * @return this builder
         */
        public Builder<I> setExitNode(SimpleNode exit) {
            checkOwned(exit);
            this.exit = exit;
            return this;
        }

        /**
         * @param exceptionSink the node escaping exceptions flow to
         * @return this builder
         */
        public Builder<I> setExceptionSinkNode(SimpleNode exceptionSink) {
            checkOwned(exceptionSink);
            this.exceptionSink = exceptionSink;
            return this;
        }

        private void checkOwned(SimpleNode node) {
            int id = node.getId();
            if (id >= nodes.size() || nodes.get(id) != node) {
                throw new IllegalArgumentException(node + " was not added to " + name);
            }
        }

        /** @return the procedure */
        public SimpleProcedure<I> build() {
            if (nodes.isEmpty()) {
                throw new IllegalStateException("procedure " + name + " has no nodes");
            }
            if (start == null) {
                start = nodes.get(0);
            }
            if (exit == null) {
                exit = nodes.get(nodes.size() - 1);
            }
            return new SimpleProcedure<>(this);
        }
    }
}
