package org.example.mjcf.graph;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Union-find over graph nodes with path compression and union by rank.
 */
public class DisjointSet {

    private final Map<Node, Node> parent = new HashMap<>();
    private final Map<Node, Integer> rank = new HashMap<>();

    public DisjointSet(Collection<Node> nodes) {
        for (Node node : nodes) {
            parent.put(node, node);
            rank.put(node, 0);
        }
    }

    public Node findRoot(Node node) {
        Node p = parent.get(node);
        if (p == null) {
            throw new IllegalArgumentException("Node '" + node + "' is not part of this set");
        }
        if (!p.equals(node)) {
            Node root = findRoot(p);
            parent.put(node, root);
            return root;
        }
        return node;
    }

    /**
     * Merges the sets of {@code a} and {@code b}.
     *
     * @return {@code true} if they were disconnected before, {@code false} if
     *         they already shared a root (the connecting edge closes a cycle)
     */
    public boolean union(Node a, Node b) {
        Node rootA = findRoot(a);
        Node rootB = findRoot(b);
        if (rootA.equals(rootB)) return false;

        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else if (rankA > rankB) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootB, rootA);
            rank.put(rootA, rankA + 1);
        }
        return true;
    }

    int rank(Node node) {
        return rank.get(node);
    }
}
