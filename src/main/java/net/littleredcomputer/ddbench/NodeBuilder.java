// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

/**
 * An append-only session for building a diagram by hand, leaves first. Each node refers to
 * nodes built earlier in the same session (or terminals), whose variables must be strictly
 * larger than its own. Levels are visited in non-increasing order: once a node for variable x
 * has been made, no node for a variable above x may follow it. Several nodes may share a level.
 *
 * @param <D> the backend's diagram handle
 */
public interface NodeBuilder<D> {
    /** A terminal. Terminals can be used at any point of the session. */
    D leaf(boolean value);

    /**
     * The node "if var then high else low". When low and high are the same function, the
     * backend may return it directly (a "don't care" node).
     *
     * @throws IllegalArgumentException if var is above a level already visited, or if a child
     *         does not lie strictly below var
     * @throws IllegalStateException if the session was already finished
     */
    D node(int var, D low, D high);

    /**
     * Finish the session and return the most recently built node as the root. If no inner
     * node was built, the most recent terminal is returned, and {@code false} if there was none.
     */
    D build();
}
