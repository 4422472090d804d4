package org.example.mjcf.graph;

import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.JointKind;
import org.example.mjcf.model.Part;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.example.mjcf.TestAssemblies.joint;
import static org.example.mjcf.TestAssemblies.part;
import static org.example.mjcf.TestAssemblies.revolute;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphTest {

    @Test
    void addNodeIsIdempotentByName() {
        Graph graph = Graph.undirected();
        Node first = graph.addNode(part("A"));
        Node second = graph.addNode(part("A"));

        assertSame(first, second);
        assertEquals(1, graph.size());
        assertEquals(new Node(part("A")), first);
    }

    @Test
    void undirectedEdgeIsSharedByBothEndpoints() {
        Graph graph = Graph.undirected();
        Edge edge = graph.addEdge(part("A"), part("B"), revolute("J1", "A", "B"));
        Node a = graph.node("A").orElseThrow();
        Node b = graph.node("B").orElseThrow();

        assertSame(edge, graph.edge(a, b).orElseThrow());
        assertSame(edge, graph.edge(b, a).orElseThrow());
        assertEquals(List.of(b), graph.neighbors(a));
        assertEquals(List.of(a), graph.neighbors(b));
    }

    @Test
    void directedEdgeExistsOnlyInInsertedDirection() {
        Graph graph = Graph.directed();
        graph.addEdge(part("A"), part("B"), revolute("J1", "A", "B"));
        Node a = graph.node("A").orElseThrow();
        Node b = graph.node("B").orElseThrow();

        assertTrue(graph.edge(a, b).isPresent());
        assertTrue(graph.edge(b, a).isEmpty());
        assertTrue(graph.neighbors(b).isEmpty());
        assertEquals(1, graph.inDegree(b));
        assertEquals(0, graph.inDegree(a));
    }

    @Test
    void missingEdgeIsEmptyNotAnError() {
        Graph graph = Graph.undirected();
        Node a = graph.addNode(part("A"));
        Node unknown = new Node(part("Z"));

        assertTrue(graph.edge(a, unknown).isEmpty());
        assertTrue(graph.edge(unknown, a).isEmpty());
        assertTrue(graph.neighbors(unknown).isEmpty());
    }

    @Test
    void edgesListsEachUndirectedEdgeOnceWithCanonicalOrder() {
        Graph graph = Graph.undirected();
        graph.addEdge(part("C"), part("A"), revolute("J1", "C", "A"));
        graph.addEdge(part("A"), part("B"), revolute("J2", "A", "B"));

        List<Graph.Link> edges = graph.edges();

        assertEquals(2, edges.size());
        for (Graph.Link link : edges) {
            assertTrue(link.from().key().compareTo(link.to().key()) < 0, link.toString());
        }
        assertEquals("A", edges.get(0).from().key());
        assertEquals("C", edges.get(0).to().key());
        assertEquals("J1", edges.get(0).edge().name());
    }

    @Test
    void parallelJointsAreKeptAsSeparateEdges() {
        Graph graph = Graph.undirected();
        Part a = part("A");
        Part b = part("B");
        AssemblyJoint fixed = joint("F", JointKind.FIXED, "A", "B");
        graph.addEdge(a, b, fixed);
        graph.addEdge(a, b, revolute("R", "A", "B"));

        assertEquals(2, graph.edgeCount());
        assertEquals(1, graph.neighbors(graph.node("A").orElseThrow()).size());
        assertEquals("F", graph.edge(graph.node("A").orElseThrow(), graph.node("B").orElseThrow())
            .orElseThrow().name());
    }

    @Test
    void edgeEqualityFollowsJointName() {
        Edge a = new Edge(revolute("J1", "A", "B"));
        Edge b = new Edge(revolute("J1", "X", "Y"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(JointKind.REVOLUTE.weight(), a.weight());
    }
}
