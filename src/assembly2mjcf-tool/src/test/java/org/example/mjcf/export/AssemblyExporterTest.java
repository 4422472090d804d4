package org.example.mjcf.export;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.TestAssemblies;
import org.example.mjcf.UnsupportedFeatureException;
import org.example.mjcf.model.Assembly;
import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.AssemblyReader;
import org.example.mjcf.model.JointKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.example.mjcf.TestAssemblies.assembly;
import static org.example.mjcf.TestAssemblies.joint;
import static org.example.mjcf.TestAssemblies.revolute;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssemblyExporterTest {

    private final AssemblyExporter exporter = new AssemblyExporter(ExportSettings.DEFAULTS);

    private static MjcfElement block(MjcfElement document, String tag) {
        return document.child(tag).orElseThrow();
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(AssemblyExporterTest.class.getResource("/assemblies/" + name).toURI());
    }

    @Test
    void documentHasAllBlocksInOrder() {
        MjcfElement document = exporter.export(TestAssemblies.groundedChain()).document();

        assertEquals("mujoco", document.tag());
        assertEquals("chain", document.attribute("model").orElseThrow());
        assertEquals(List.of("option", "compiler", "default", "asset", "worldbody",
                "contact", "equality", "tendon", "actuator", "sensor"),
            document.children().stream().map(MjcfElement::tag).toList());
    }

    @Test
    void groundedChainExportsThreeHinges() {
        ExportResult result = exporter.export(TestAssemblies.groundedChain());
        MjcfElement document = result.document();

        assertEquals(3, result.analysis().spanningTree().tree().edgeCount());
        assertTrue(result.analysis().spanningTree().unusedEdges().isEmpty());

        MjcfElement root = block(document, "worldbody").children("body").get(0);
        assertEquals("P1", root.attribute("name").orElseThrow());
        List<MjcfElement> joints = root.descendants("joint");
        assertEquals(3, joints.size());
        joints.forEach(j -> assertEquals("hinge", j.attribute("type").orElseThrow()));
        assertEquals(3, block(document, "actuator").children().size());
        assertEquals(3, block(document, "sensor").children().size());
        assertTrue(block(document, "equality").children().isEmpty());
    }

    @Test
    void fourBarWithoutGroundedPartIsRejected() {
        assertThrows(ConfigurationException.class, () -> exporter.export(TestAssemblies.fourBar()));
    }

    @Test
    void fourBarCanBeRootedExplicitlyButItsRevoluteLoopIsUnsupported() {
        AssemblyExporter rooted = new AssemblyExporter(
            ExportSettings.DEFAULTS, new ShapeReferenceMeshProvider(), Optional.of("P1"));

        assertThrows(UnsupportedFeatureException.class, () -> rooted.export(TestAssemblies.fourBar()));
    }

    @Test
    void parallelFixedJointBecomesWeld() {
        MjcfElement document = exporter.export(TestAssemblies.parallelFixedAndRevolute()).document();

        List<MjcfElement> joints = document.descendants("joint");
        // default block joint + the hinge on P2
        assertEquals(2, joints.size());
        assertEquals("Hinge", joints.get(1).attribute("name").orElseThrow());

        List<MjcfElement> welds = block(document, "equality").children("weld");
        assertEquals(1, welds.size());
        assertEquals("Fixed", welds.get(0).attribute("name").orElseThrow());
        assertEquals("P1", welds.get(0).attribute("body1").orElseThrow());
        assertEquals("P2", welds.get(0).attribute("body2").orElseThrow());
    }

    @Test
    void limitedJointRangeReachesActuator() {
        MjcfElement document = exporter.export(TestAssemblies.limitedHinge()).document();

        MjcfElement joint = block(document, "worldbody").descendants("joint").get(0);
        MjcfElement actuator = block(document, "actuator").children().get(0);
        assertEquals("0.5235987755982988 1.5707963267948966", joint.attribute("range").orElseThrow());
        assertEquals("0.5235987755982988 1.5707963267948966", actuator.attribute("ctrlrange").orElseThrow());
    }

    @Test
    void exportIsRepeatable() {
        Assembly assembly = TestAssemblies.parallelFixedAndRevolute();

        ExportResult first = exporter.export(assembly);
        ExportResult second = exporter.export(assembly);

        assertEquals(first.document(), second.document());
        assertEquals(first.toXml(), second.toXml());
    }

    @Test
    void ballJointInTreeHasNoAxisRule() {
        Assembly socket = assembly("socket", List.of("A", "B"),
            joint("Socket", JointKind.BALL, "A", "B"));

        assertThrows(UnsupportedFeatureException.class, () -> exporter.export(socket));
    }

    @Test
    void floorSitsBelowLowestPart() throws Exception {
        MjcfElement document = exporter.export(AssemblyReader.read(fixture("welded_loop.json"))).document();

        MjcfElement floor = block(document, "worldbody").child("geom").orElseThrow();
        assertEquals("floor", floor.attribute("name").orElseThrow());
        assertEquals("0 0 -0.021", floor.attribute("pos").orElseThrow());
    }

    @Test
    void weldedLoopFixture() throws Exception {
        ExportResult result = exporter.export(AssemblyReader.read(fixture("welded_loop.json")));
        MjcfElement document = result.document();

        MjcfElement frame = block(document, "worldbody").children("body").get(0);
        MjcfElement lever = frame.children("body").get(0);
        MjcfElement bracket = lever.children("body").get(0);
        assertEquals("Bracket", bracket.attribute("name").orElseThrow());
        assertTrue(bracket.children("joint").isEmpty());
        assertEquals("hinge", lever.child("joint").orElseThrow().attribute("type").orElseThrow());

        MjcfElement weld = block(document, "equality").children().get(0);
        assertEquals("Weld", weld.attribute("name").orElseThrow());
        assertEquals("Bracket", weld.attribute("body1").orElseThrow());
        assertEquals("Frame", weld.attribute("body2").orElseThrow());
    }

    @Test
    void optionsComeFromSettings() {
        ExportSettings settings = new ExportSettings("RK4", 0.005, "CG", 0.5, 0.02, 0.001, 0.001, 25, "parts");
        MjcfElement document = new AssemblyExporter(settings).export(TestAssemblies.groundedChain()).document();

        MjcfElement option = block(document, "option");
        assertEquals("RK4", option.attribute("integrator").orElseThrow());
        assertEquals("0.005", option.attribute("timestep").orElseThrow());
        assertEquals("CG", option.attribute("solver").orElseThrow());
        assertEquals("parts", block(document, "compiler").attribute("meshdir").orElseThrow());
        MjcfElement jointDefaults = block(document, "default").child("joint").orElseThrow();
        assertEquals("0.5", jointDefaults.attribute("damping").orElseThrow());
        assertEquals("0.02", jointDefaults.attribute("armature").orElseThrow());
        assertEquals("25", block(document, "actuator").children().get(0).attribute("kp").orElseThrow());
    }

    @Test
    void lonelyGroundedPartExportsSingleBody() {
        Assembly single = new Assembly("single", List.of(TestAssemblies.part("Base")),
            List.of(AssemblyJoint.grounded("GroundedJoint", "Base")));

        MjcfElement document = exporter.export(single).document();

        MjcfElement base = block(document, "worldbody").children("body").get(0);
        assertEquals("Base", base.attribute("name").orElseThrow());
        assertTrue(base.children("body").isEmpty());
    }

    @Test
    void revoluteLoopNamesTheJoint() {
        Assembly triangle = assembly("triangle", List.of("A", "B", "C"),
            revolute("AB", "A", "B"),
            revolute("BC", "B", "C"),
            revolute("CA", "C", "A"),
            AssemblyJoint.grounded("GroundedJoint", "A"));

        UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
            () -> exporter.export(triangle));
        assertTrue(e.getMessage().contains("'CA'") || e.getMessage().contains("'BC'"), e.getMessage());
    }
}
