package org.example.mjcf.graph;

import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.Part;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adjacency graph over parts (nodes) and joints (edges).
 *
 * Nodes are stored by key; adjacency is {@code key -> neighbor key -> edges}.
 * More than one edge may join the same pair of nodes (parallel joints), so
 * the innermost value is a list in insertion order. In undirected mode every
 * edge is recorded under both endpoints and both lookups return the same
 * {@link Edge} instance. All iteration follows insertion order.
 */
public class Graph {

    /** One edge together with its endpoints, as returned by {@link #edges()}. */
    public record Link(Node from, Node to, Edge edge) {}

    private final boolean directed;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, List<Edge>>> adjacency = new LinkedHashMap<>();

    public Graph(boolean directed) {
        this.directed = directed;
    }

    public static Graph undirected() {
        return new Graph(false);
    }

    public static Graph directed() {
        return new Graph(true);
    }

    public boolean isDirected() {
        return directed;
    }

    // ── Mutation ─────────────────────────────────────────────────────────────

    /** Inserts the part's node if absent and returns the canonical node. */
    public Node addNode(Part part) {
        return addNode(new Node(part));
    }

    public Node addNode(Node node) {
        Node existing = nodes.putIfAbsent(node.key(), node);
        if (existing != null) return existing;
        adjacency.put(node.key(), new LinkedHashMap<>());
        return node;
    }

    /** Creates one edge for {@code joint} between the two parts. */
    public Edge addEdge(Part a, Part b, AssemblyJoint joint) {
        Edge edge = new Edge(joint);
        addEdge(addNode(a), addNode(b), edge);
        return edge;
    }

    /**
     * Records an existing edge between two nodes. Callers are expected to add
     * each joint once; nothing here deduplicates repeated inserts.
     */
    public void addEdge(Node from, Node to, Edge edge) {
        Node u = addNode(from);
        Node v = addNode(to);
        adjacency.get(u.key()).computeIfAbsent(v.key(), k -> new ArrayList<>()).add(edge);
        if (!directed) {
            adjacency.get(v.key()).computeIfAbsent(u.key(), k -> new ArrayList<>()).add(edge);
        }
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public Collection<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<Node> node(String key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public boolean contains(Node node) {
        return nodes.containsKey(node.key());
    }

    public int size() {
        return nodes.size();
    }

    /** Distinct nodes reachable over one edge (outgoing edges in directed mode). */
    public List<Node> neighbors(Node node) {
        Map<String, List<Edge>> adj = adjacency.get(node.key());
        if (adj == null) return List.of();
        List<Node> result = new ArrayList<>(adj.size());
        for (String key : adj.keySet()) {
            result.add(nodes.get(key));
        }
        return result;
    }

    /** The first edge between {@code u} and {@code v}; empty when they are not adjacent. */
    public Optional<Edge> edge(Node u, Node v) {
        Map<String, List<Edge>> adj = adjacency.get(u.key());
        if (adj == null) return Optional.empty();
        List<Edge> between = adj.get(v.key());
        if (between == null || between.isEmpty()) return Optional.empty();
        return Optional.of(between.get(0));
    }

    /**
     * Every edge exactly once. In undirected mode the endpoints are ordered by
     * key so that {@code from.key() <= to.key()}. Order: first endpoint in
     * node insertion order, then neighbor insertion order, then parallel
     * edges in insertion order.
     */
    public List<Link> edges() {
        List<Link> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<Edge>>> entry : adjacency.entrySet()) {
            Node u = nodes.get(entry.getKey());
            for (Map.Entry<String, List<Edge>> neighbor : entry.getValue().entrySet()) {
                Node v = nodes.get(neighbor.getKey());
                if (!directed && u.key().compareTo(v.key()) > 0) continue;
                for (Edge edge : neighbor.getValue()) {
                    result.add(new Link(u, v, edge));
                }
            }
        }
        return result;
    }

    public int edgeCount() {
        return edges().size();
    }

    /** Number of edges pointing at {@code node}; only meaningful in directed mode. */
    public int inDegree(Node node) {
        int count = 0;
        for (Map<String, List<Edge>> adj : adjacency.values()) {
            List<Edge> in = adj.get(node.key());
            if (in != null) count += in.size();
        }
        return count;
    }
}
