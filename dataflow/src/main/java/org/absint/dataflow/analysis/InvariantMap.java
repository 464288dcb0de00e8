package org.absint.dataflow.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@link InvariantMap} represents the result of a fixpoint computation over one control flow
 * graph: the {@link State} reached at every node that was analyzed. Nodes that the analysis never
 * reached have no entry.
 *
 * <p>Each engine run creates its own map and is the only one to update it; the accessors are safe
 * to use once the run returned.
 *
 * @param <N> the node type of the control flow graph
 * @param <S> the abstract state type
 */
public final class InvariantMap<N, S> {

    /** The states of the analyzed nodes, in the order the nodes were first reached. */
    private final Map<N, State<S>> states;

    /** Create an empty invariant map. */
    public InvariantMap() {
        this.states = new LinkedHashMap<>();
    }

    /**
     * Return the state of {@code node}, or {@code null} if the node was not analyzed.
     *
     * @param node the node
     * @return the state of the node
     */
    public @Nullable State<S> extractState(N node) {
        return states.get(node);
    }

    /**
     * Return the state before {@code node}, or {@code null} if the node was not analyzed.
     *
     * @param node the node
     * @return the pre-state of the node
     */
    public @Nullable S extractPre(N node) {
        State<S> state = states.get(node);
        return state == null ? null : state.getPre();
    }

    /**
     * Return the state after {@code node}, or {@code null} if the node was not analyzed.
     *
     * @param node the node
     * @return the post-state of the node
     */
    public @Nullable S extractPost(N node) {
        State<S> state = states.get(node);
        return state == null ? null : state.getPost();
    }

    /**
     * @param node the node
     * @return true if the node has been analyzed
     */
    public boolean contains(N node) {
        return states.containsKey(node);
    }

    /**
     * Record the state of a node, replacing any previous one.
     *
     * @param node the node
     * @param state its new state
     */
    void put(N node, State<S> state) {
        states.put(node, state);
    }

    /** @return the number of analyzed nodes */
    public int size() {
        return states.size();
    }

    /** @return an unmodifiable view of all node states */
    public Map<N, State<S>> asMap() {
        return Collections.unmodifiableMap(states);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<N, State<S>> entry : states.entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}
