package org.example.mjcf.graph;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.ConsistencyException;
import org.example.mjcf.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the root of the spanning tree and orients every edge away from it.
 */
public final class TreeRooting {

    private TreeRooting() {
    }

    /**
     * Chooses the root node.
     *
     * <ol>
     *   <li>an explicitly requested part, which must be a node of the tree;</li>
     *   <li>the grounded part;</li>
     *   <li>the first part with exactly one neighbor in the connectivity graph.</li>
     * </ol>
     *
     * Leaves are counted in the connectivity graph rather than in the reduced
     * tree: a part with a single neighbor there is also a leaf of the tree, but
     * a closed loop without any dangling part (a four-bar linkage) has no
     * natural anchor and is rejected instead of being rooted at an arbitrary
     * link.
     */
    public static Node selectRoot(AssemblyGraph connectivity, Graph tree, Optional<String> requestedRoot) {
        if (tree.size() == 0) {
            throw new ConfigurationException("Cannot root an empty assembly");
        }

        if (requestedRoot.isPresent()) {
            String name = requestedRoot.get();
            return tree.node(name).orElseThrow(() -> new ConfigurationException(
                "Requested root part '" + name + "' is not part of the assembly"));
        }

        if (connectivity.grounded().isPresent()) {
            Node grounded = connectivity.grounded().get();
            return tree.node(grounded.key()).orElseThrow(() -> new ConfigurationException(
                "Grounded part '" + grounded.key() + "' is not part of the kinematic tree"));
        }

        Graph graph = connectivity.graph();
        for (Node node : graph.nodes()) {
            if (graph.neighbors(node).size() == 1) {
                Logger.info("No grounded part; using leaf part '%s' as root", node.key());
                return tree.node(node.key()).orElseThrow(() -> new ConsistencyException(
                    "Leaf part '" + node.key() + "' missing from the spanning tree"));
            }
        }
        throw new ConfigurationException("No grounded part and no leaf part to use as root; "
            + "ground one part or pass --root");
    }

    /**
     * Depth-first orientation of {@code tree} from {@code root}. Neighbors are
     * visited in insertion order, so the result matches a recursive walk.
     *
     * @throws ConfigurationException if some parts are not reachable from the
     *         root (the assembly is disconnected)
     */
    public static RootedTree orient(Graph tree, Node root) {
        if (!tree.contains(root)) {
            throw new ConfigurationException("Root part '" + root.key() + "' is not part of the tree");
        }

        Graph directed = Graph.directed();
        directed.addNode(root);

        Set<Node> visited = new HashSet<>();
        Deque<Node[]> stack = new ArrayDeque<>();
        stack.push(new Node[]{root, null});

        while (!stack.isEmpty()) {
            Node[] frame = stack.pop();
            Node node = frame[0];
            Node parent = frame[1];
            if (!visited.add(node)) continue;

            if (parent != null) {
                Edge edge = tree.edge(parent, node).orElseThrow(() -> new ConsistencyException(
                    "No edge between tree-adjacent parts '" + parent.key() + "' and '" + node.key() + "'"));
                directed.addEdge(parent, node, edge);
            }

            List<Node> neighbors = tree.neighbors(node);
            for (int i = neighbors.size() - 1; i >= 0; i--) {
                Node next = neighbors.get(i);
                if (!visited.contains(next)) {
                    stack.push(new Node[]{next, node});
                }
            }
        }

        if (visited.size() != tree.size()) {
            List<String> unreachable = new ArrayList<>();
            for (Node node : tree.nodes()) {
                if (!visited.contains(node)) unreachable.add(node.key());
            }
            throw new ConfigurationException("Assembly is not connected; parts not reachable from root '"
                + root.key() + "': " + String.join(", ", unreachable));
        }

        Logger.debug("Oriented tree from '%s': %d directed edge(s)", root.key(), directed.edgeCount());
        return new RootedTree(root, directed);
    }
}
