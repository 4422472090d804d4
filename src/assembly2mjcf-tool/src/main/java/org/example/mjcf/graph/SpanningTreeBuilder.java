package org.example.mjcf.graph;

import org.example.mjcf.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Kruskal reduction of the connectivity graph.
 *
 * Edges are taken in ascending weight order (stable, so equal weights keep
 * their enumeration order). With the joint weight table this keeps revolute
 * joints ahead of fixed ones: a rigid connection that closes a loop is the
 * one that ends up as a weld constraint.
 */
public final class SpanningTreeBuilder {

    private SpanningTreeBuilder() {
    }

    public static SpanningTree build(Graph graph) {
        List<Graph.Link> sorted = new ArrayList<>(graph.edges());
        sorted.sort(Comparator.comparingDouble(link -> link.edge().weight()));

        Graph tree = Graph.undirected();
        for (Node node : graph.nodes()) {
            tree.addNode(node);
        }

        DisjointSet sets = new DisjointSet(graph.nodes());
        List<Graph.Link> unused = new ArrayList<>();
        for (Graph.Link link : sorted) {
            if (sets.union(link.from(), link.to())) {
                tree.addEdge(link.from(), link.to(), link.edge());
            } else {
                Logger.debug("Joint '%s' closes a loop between '%s' and '%s'",
                    link.edge().name(), link.from().key(), link.to().key());
                unused.add(link);
            }
        }

        Logger.info("Spanning tree: %d edge(s) kept, %d loop edge(s)", tree.edgeCount(), unused.size());
        return new SpanningTree(tree, unused);
    }
}
