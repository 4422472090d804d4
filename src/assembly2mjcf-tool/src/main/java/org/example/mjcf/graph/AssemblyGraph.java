package org.example.mjcf.graph;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.Logger;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.Part;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Connectivity graph of an assembly plus the part pinned to the world, if any.
 */
public record AssemblyGraph(Graph graph, Optional<Node> grounded) {

    /**
     * Builds the undirected connectivity graph in one pass over the joints.
     * Every part becomes a node, even when no joint references it. A grounded
     * joint contributes no edge; it only marks its part.
     */
    public static AssemblyGraph build(Assembly assembly) {
        Graph graph = Graph.undirected();
        for (Part part : assembly.parts()) {
            graph.addNode(part);
        }

        Node grounded = null;
        Set<String> jointNames = new HashSet<>();
        for (AssemblyJoint joint : assembly.joints()) {
            // edges are identified by joint name
            if (!jointNames.add(joint.name())) {
                throw new ConfigurationException("Duplicate joint name '" + joint.name() + "'");
            }
            if (joint.grounded()) {
                Node node = resolve(graph, joint, joint.part1());
                if (grounded != null && !grounded.equals(node)) {
                    throw new ConfigurationException("More than one grounded part: '"
                        + grounded.key() + "' and '" + node.key() + "' (joint '" + joint.name() + "')");
                }
                grounded = node;
                continue;
            }

            Node a = resolve(graph, joint, joint.part1());
            Node b = resolve(graph, joint, joint.part2());
            if (a.equals(b)) {
                throw new ConfigurationException("Joint '" + joint.name() + "' connects part '"
                    + a.key() + "' to itself");
            }
            graph.addEdge(a, b, new Edge(joint));
        }

        Logger.debug("Connectivity graph: %d node(s), %d edge(s), grounded=%s",
            graph.size(), graph.edgeCount(), grounded != null ? grounded.key() : "none");
        return new AssemblyGraph(graph, Optional.ofNullable(grounded));
    }

    private static Node resolve(Graph graph, AssemblyJoint joint, String partName) {
        return graph.node(partName).orElseThrow(() -> new ConfigurationException(
            "Joint '" + joint.name() + "' references unknown part '" + partName + "'"));
    }
}
