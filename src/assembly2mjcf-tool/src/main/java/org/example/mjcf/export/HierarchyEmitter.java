package org.example.mjcf.export;

import org.example.mjcf.ConsistencyException;
import org.example.mjcf.Logger;
import org.example.mjcf.graph.Edge;
import org.example.mjcf.graph.Node;
import org.example.mjcf.graph.RootedTree;
import org.example.mjcf.model.Rotation;
import org.example.mjcf.model.Vector3;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a rooted tree into nested {@code body} elements.
 *
 * Every body sits at the identity pose: the meshes are exported in assembly
 * coordinates, so only joints carry relative displacement. An edge whose joint
 * kind maps to an MJCF joint type puts a joint on the child body and a
 * position actuator plus a position sensor into the side lists; a rigid edge
 * nests the child body without any of these.
 */
public class HierarchyEmitter {

    static final String VISUAL_CLASS = "visual";

    private final AssetCatalog assets;
    private final ExportSettings settings;
    private final NameRegistry jointNames = new NameRegistry();

    private final List<MjcfElement> actuators = new ArrayList<>();
    private final List<MjcfElement> sensors = new ArrayList<>();
    private final Set<Node> emitted = new HashSet<>();

    public HierarchyEmitter(AssetCatalog assets, ExportSettings settings) {
        this.assets = assets;
        this.settings = settings;
    }

    public BodyHierarchy emit(RootedTree tree) {
        MjcfElement root = emitBody(tree, tree.root(), null);
        Logger.info("Emitted %d body(ies), %d joint(s)", emitted.size(), actuators.size());
        return new BodyHierarchy(root, actuators, sensors);
    }

    // ── Bodies ───────────────────────────────────────────────────────────────

    /**
     * Builds the body of {@code node}, its joint (from {@code incoming}) and,
     * recursively, all child bodies.
     */
    private MjcfElement emitBody(RootedTree tree, Node node, Edge incoming) {
        if (!emitted.add(node)) {
            throw new ConsistencyException("Part '" + node.key() + "' reached twice while walking the tree");
        }

        MjcfElement.Builder body = MjcfElement.builder("body")
            .attr("name", node.key())
            .attr("pos", Vector3.ZERO)
            .attr("quat", Rotation.IDENTITY);

        if (incoming != null) {
            emitJoint(incoming).ifPresent(body::child);
        }
        body.child(visualGeom(node));

        for (Node child : tree.children(node)) {
            Edge edge = tree.graph().edge(node, child).orElseThrow(() -> new ConsistencyException(
                "No edge from '" + node.key() + "' to its child '" + child.key() + "'"));
            body.child(emitBody(tree, child, edge));
        }
        return body.build();
    }

    private MjcfElement visualGeom(Node node) {
        AssetCatalog.Visual visual = assets.visual(node.key());
        return MjcfElement.builder("geom")
            .attr("name", node.key() + "_visual")
            .attr("class", VISUAL_CLASS)
            .attr("type", "mesh")
            .attr("mesh", visual.mesh())
            .attr("material", visual.material())
            .build();
    }

    // ── Joints ───────────────────────────────────────────────────────────────

    private Optional<MjcfElement> emitJoint(Edge edge) {
        Optional<String> type = edge.kind().mjcfType();
        if (type.isEmpty()) {
            Logger.debug("Joint '%s' is rigid; no joint element", edge.name());
            return Optional.empty();
        }

        JointGeometry geometry = JointGeometry.resolve(edge, settings.lengthScale());
        Optional<JointRange> range = JointRange.of(edge.joint().limits(), settings.lengthScale());
        String name = jointNames.claim(edge.joint().label());

        MjcfElement.Builder joint = MjcfElement.builder("joint")
            .attr("name", name)
            .attr("type", type.get())
            .attr("pos", geometry.position())
            .attr("axis", geometry.axis());
        range.ifPresent(r -> joint.attr("limited", "true").attr("range", r.toAttribute()));

        MjcfElement.Builder actuator = MjcfElement.builder("position")
            .attr("name", name + "_actuator")
            .attr("joint", name)
            .attr("kp", settings.actuatorGain());
        range.ifPresent(r -> actuator.attr("ctrllimited", "true").attr("ctrlrange", r.toAttribute()));
        actuators.add(actuator.build());

        sensors.add(MjcfElement.builder("jointpos")
            .attr("name", name + "_pos")
            .attr("joint", name)
            .build());

        return Optional.of(joint.build());
    }
}
