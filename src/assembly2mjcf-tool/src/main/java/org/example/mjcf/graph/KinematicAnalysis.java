package org.example.mjcf.graph;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.model.Assembly;

import java.util.Optional;

/**
 * Graph stages of an export: connectivity graph, spanning tree with its loop
 * edges, and the tree oriented away from the chosen root.
 */
public record KinematicAnalysis(AssemblyGraph connectivity, SpanningTree spanningTree, RootedTree rootedTree) {

    public static KinematicAnalysis of(Assembly assembly, Optional<String> requestedRoot) {
        if (assembly.parts().isEmpty()) {
            throw new ConfigurationException("Assembly '" + assembly.name() + "' contains no parts");
        }
        AssemblyGraph connectivity = AssemblyGraph.build(assembly);
        SpanningTree spanning = SpanningTreeBuilder.build(connectivity.graph());
        Node root = TreeRooting.selectRoot(connectivity, spanning.tree(), requestedRoot);
        RootedTree rooted = TreeRooting.orient(spanning.tree(), root);
        return new KinematicAnalysis(connectivity, spanning, rooted);
    }
}
