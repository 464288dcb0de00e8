package org.absint.dataflow.cfg;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A weak topological order: an immutable linked sequence of elements, each either a single node
 * or a component. A component has a head that dominates the cycles formed by the nodes of its
 * own nested partition (its {@linkplain Component#getRest() rest}).
 *
 * <p>The sequence is terminated by {@link #empty()}. Written with parentheses around components,
 * {@code 1 2 (3 4 (5 6) 7) 8} is {@code Node(1, Node(2, Component(3, Node(4, Component(5,
 * Node(6, Empty), Node(7, Empty))), Node(8, Empty))))}.
 *
 * @param <N> the node type
 */
public abstract class Partition<N> {

    /** The kinds of partition elements. */
    public enum Kind {
        /** The end of a sequence. */
        EMPTY,
        /** A single node. */
        NODE,
        /** A loop component. */
        COMPONENT
    }

    private Partition() {}

    /** @return the kind of this element */
    public abstract Kind getKind();

    /** @return the end of a sequence */
    public static <N> Partition<N> empty() {
        return new Empty<>();
    }

    /**
     * @param node a node
     * @param next the rest of the sequence
     * @return a sequence starting with {@code node}
     */
    public static <N> Partition<N> node(N node, Partition<N> next) {
        return new NodeElement<>(node, next);
    }

    /**
     * @param head the head of the component
     * @param rest the nested partition of the component
     * @param next the rest of the sequence
     * @return a sequence starting with the component
     */
    public static <N> Partition<N> component(N head, Partition<N> rest, Partition<N> next) {
        return new Component<>(head, rest, next);
    }

    /** @return the heads of all components, nested ones included */
    public Set<N> getHeads() {
        Set<N> heads = new LinkedHashSet<>();
        collectHeads(this, heads);
        return heads;
    }

    private static <N> void collectHeads(Partition<N> partition, Set<N> heads) {
        Partition<N> current = partition;
        while (current.getKind() != Kind.EMPTY) {
            if (current.getKind() == Kind.COMPONENT) {
                Component<N> component = (Component<N>) current;
                heads.add(component.head);
                collectHeads(component.rest, heads);
                current = component.next;
            } else {
                current = ((NodeElement<N>) current).next;
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString().trim();
    }

    private void appendTo(StringBuilder sb) {
        Partition<N> current = this;
        while (current.getKind() != Kind.EMPTY) {
            if (current.getKind() == Kind.COMPONENT) {
                Component<N> component = (Component<N>) current;
                sb.append('(').append(component.head).append(' ');
                component.rest.appendTo(sb);
                if (sb.charAt(sb.length() - 1) == ' ') {
                    sb.setLength(sb.length() - 1);
                }
                sb.append(") ");
                current = component.next;
            } else {
                NodeElement<N> element = (NodeElement<N>) current;
                sb.append(element.node).append(' ');
                current = element.next;
            }
        }
    }

    /** The end of a sequence. */
    private static final class Empty<N> extends Partition<N> {
        @Override
        public Kind getKind() {
            return Kind.EMPTY;
        }
    }

    /** A single node followed by the rest of the sequence. */
    public static final class NodeElement<N> extends Partition<N> {
        private final N node;
        private final Partition<N> next;

        private NodeElement(N node, Partition<N> next) {
            this.node = node;
            this.next = next;
        }

        @Override
        public Kind getKind() {
            return Kind.NODE;
        }

        /** @return the node */
        public N getNode() {
            return node;
        }

        /** @return the rest of the sequence */
        public Partition<N> getNext() {
            return next;
        }
    }

    /** A loop component followed by the rest of the sequence. */
    public static final class Component<N> extends Partition<N> {
        private final N head;
        private final Partition<N> rest;
        private final Partition<N> next;

        private Component(N head, Partition<N> rest, Partition<N> next) {
            this.head = head;
            this.rest = rest;
            this.next = next;
        }

        @Override
        public Kind getKind() {
            return Kind.COMPONENT;
        }

        /** @return the head of the loop */
        public N getHead() {
            return head;
        }

        /** @return the nested partition of the loop body */
        public Partition<N> getRest() {
            return rest;
        }

        /** @return the rest of the sequence */
        public Partition<N> getNext() {
            return next;
        }
    }
}
