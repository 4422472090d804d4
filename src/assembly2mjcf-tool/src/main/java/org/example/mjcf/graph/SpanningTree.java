package org.example.mjcf.graph;

import java.util.List;

/**
 * Result of the spanning-tree reduction: an acyclic undirected graph over all
 * input nodes and the edges that were left out because they close a loop.
 */
public record SpanningTree(Graph tree, List<Graph.Link> unusedEdges) {

    public SpanningTree {
        unusedEdges = List.copyOf(unusedEdges);
    }

    public boolean hasLoops() {
        return !unusedEdges.isEmpty();
    }
}
