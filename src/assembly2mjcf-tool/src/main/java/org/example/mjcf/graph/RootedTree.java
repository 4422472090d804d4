package org.example.mjcf.graph;

import java.util.List;

/**
 * Directed tree with edges pointing from parent to child. Every node except
 * {@link #root()} has exactly one incoming edge.
 */
public record RootedTree(Node root, Graph graph) {

    public List<Node> children(Node node) {
        return graph.neighbors(node);
    }
}
