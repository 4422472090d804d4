package org.example.mjcf.export;

import org.example.mjcf.Logger;
import org.example.mjcf.graph.KinematicAnalysis;
import org.example.mjcf.graph.Node;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.Part;

import java.util.List;
import java.util.Optional;

/**
 * One export pass, from assembly to document.
 *
 * <ol>
 *   <li>build the connectivity graph;</li>
 *   <li>reduce it to a spanning tree plus loop edges;</li>
 *   <li>pick the root and orient the tree;</li>
 *   <li>register meshes and materials for every part;</li>
 *   <li>emit the body hierarchy and the weld constraints;</li>
 *   <li>assemble the document.</li>
 * </ol>
 *
 * Each call works on fresh graph and catalog instances and writes nothing;
 * the caller serializes the result once the whole pass succeeded.
 */
public class AssemblyExporter {

    private final ExportSettings settings;
    private final MeshProvider meshes;
    private final Optional<String> requestedRoot;

    public AssemblyExporter(ExportSettings settings, MeshProvider meshes, Optional<String> requestedRoot) {
        this.settings = settings;
        this.meshes = meshes;
        this.requestedRoot = requestedRoot;
    }

    public AssemblyExporter(ExportSettings settings) {
        this(settings, new ShapeReferenceMeshProvider(), Optional.empty());
    }

    public ExportResult export(Assembly assembly) {
        Logger.info("Exporting assembly '%s' (%d part(s), %d joint(s))",
            assembly.name(), assembly.parts().size(), assembly.joints().size());
        KinematicAnalysis graphs = KinematicAnalysis.of(assembly, requestedRoot);

        AssetCatalog assets = new AssetCatalog(meshes, settings);
        for (Node node : graphs.connectivity().graph().nodes()) {
            assets.register(node.part());
        }

        BodyHierarchy hierarchy = new HierarchyEmitter(assets, settings).emit(graphs.rootedTree());
        List<MjcfElement> equalities = LoopConstraintHandler.constraints(graphs.spanningTree().unusedEdges());

        MjcfDocumentAssembler assembler = new MjcfDocumentAssembler(settings);
        List<Part> parts = assembly.parts();
        MjcfElement document = assembler.assemble(
            assembly.name(), assets, assembler.floorHeight(parts), hierarchy, equalities);

        Logger.info("Assembly '%s': root '%s', %d actuator(s), %d weld(s)",
            assembly.name(), graphs.rootedTree().root().key(), hierarchy.actuators().size(), equalities.size());
        return new ExportResult(document, graphs);
    }
}
