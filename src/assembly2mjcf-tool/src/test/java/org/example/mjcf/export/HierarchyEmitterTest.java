package org.example.mjcf.export;

import org.example.mjcf.TestAssemblies;
import org.example.mjcf.graph.KinematicAnalysis;
import org.example.mjcf.graph.Node;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.JointKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.example.mjcf.TestAssemblies.assembly;
import static org.example.mjcf.TestAssemblies.joint;
import static org.example.mjcf.TestAssemblies.revolute;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyEmitterTest {

    private static BodyHierarchy emit(Assembly assembly) {
        KinematicAnalysis analysis = KinematicAnalysis.of(assembly, Optional.empty());
        AssetCatalog assets = new AssetCatalog(new ShapeReferenceMeshProvider(), ExportSettings.DEFAULTS);
        for (Node node : analysis.connectivity().graph().nodes()) {
            assets.register(node.part());
        }
        return new HierarchyEmitter(assets, ExportSettings.DEFAULTS).emit(analysis.rootedTree());
    }

    @Test
    void chainBecomesNestedBodies() {
        BodyHierarchy hierarchy = emit(TestAssemblies.groundedChain());

        MjcfElement p1 = hierarchy.rootBody();
        assertEquals("P1", p1.attribute("name").orElseThrow());
        MjcfElement p2 = p1.children("body").get(0);
        MjcfElement p3 = p2.children("body").get(0);
        MjcfElement p4 = p3.children("body").get(0);
        assertEquals("P4", p4.attribute("name").orElseThrow());
        assertTrue(p4.children("body").isEmpty());

        assertTrue(p1.children("joint").isEmpty());
        assertEquals("J1", p2.child("joint").orElseThrow().attribute("name").orElseThrow());
        assertEquals("hinge", p3.child("joint").orElseThrow().attribute("type").orElseThrow());
    }

    @Test
    void everyBodyHasIdentityPoseAndOneVisual() {
        BodyHierarchy hierarchy = emit(TestAssemblies.groundedChain());

        List<MjcfElement> bodies = hierarchy.rootBody().descendants("body");
        bodies.add(0, hierarchy.rootBody());
        for (MjcfElement body : bodies) {
            assertEquals("0 0 0", body.attribute("pos").orElseThrow());
            assertEquals("1 0 0 0", body.attribute("quat").orElseThrow());
            List<MjcfElement> geoms = body.children("geom");
            assertEquals(1, geoms.size());
            String name = body.attribute("name").orElseThrow();
            assertEquals(name, geoms.get(0).attribute("mesh").orElseThrow());
            assertEquals("default", geoms.get(0).attribute("material").orElseThrow());
        }
    }

    @Test
    void jointsAreMirroredByActuatorsAndSensors() {
        BodyHierarchy hierarchy = emit(TestAssemblies.groundedChain());

        assertEquals(3, hierarchy.actuators().size());
        assertEquals(3, hierarchy.sensors().size());
        MjcfElement actuator = hierarchy.actuators().get(0);
        assertEquals("position", actuator.tag());
        assertEquals("J1", actuator.attribute("joint").orElseThrow());
        assertEquals("10", actuator.attribute("kp").orElseThrow());
        assertTrue(actuator.attribute("ctrlrange").isEmpty());
        MjcfElement sensor = hierarchy.sensors().get(2);
        assertEquals("jointpos", sensor.tag());
        assertEquals("J3", sensor.attribute("joint").orElseThrow());
    }

    @Test
    void rigidEdgeNestsBodyWithoutJoint() {
        Assembly bolted = assembly("bolted", List.of("Base", "Plate"),
            joint("Bolt", JointKind.FIXED, "Base", "Plate"),
            AssemblyJoint.grounded("GroundedJoint", "Base"));

        BodyHierarchy hierarchy = emit(bolted);

        MjcfElement plate = hierarchy.rootBody().children("body").get(0);
        assertEquals("Plate", plate.attribute("name").orElseThrow());
        assertTrue(plate.children("joint").isEmpty());
        assertTrue(hierarchy.actuators().isEmpty());
        assertTrue(hierarchy.sensors().isEmpty());
    }

    @Test
    void unrecognizedJointIsRigid() {
        Assembly geared = assembly("geared", List.of("A", "B"),
            joint("Gear", JointKind.UNRECOGNIZED, "A", "B"));

        BodyHierarchy hierarchy = emit(geared);

        assertTrue(hierarchy.rootBody().descendants("joint").isEmpty());
    }

    @Test
    void limitedJointCarriesRangeOnJointAndActuator() {
        BodyHierarchy hierarchy = emit(TestAssemblies.limitedHinge());

        MjcfElement joint = hierarchy.rootBody().descendants("joint").get(0);
        assertEquals("Elbow", joint.attribute("name").orElseThrow());
        assertEquals("0.5235987755982988 1.5707963267948966", joint.attribute("range").orElseThrow());
        assertEquals(joint.attribute("range"), hierarchy.actuators().get(0).attribute("ctrlrange"));
    }

    @Test
    void duplicateLabelsGetUniqueJointNames() {
        Assembly twins = assembly("twins", List.of("A", "B", "C"),
            revolute("J1", "A", "B").withLabel("Hinge"),
            revolute("J2", "B", "C").withLabel("Hinge"));

        BodyHierarchy hierarchy = emit(twins);

        List<String> names = hierarchy.rootBody().descendants("joint").stream()
            .map(j -> j.attribute("name").orElseThrow()).toList();
        assertEquals(List.of("Hinge", "Hinge_2"), names);
        assertEquals("Hinge_2", hierarchy.sensors().get(1).attribute("joint").orElseThrow());
    }
}
