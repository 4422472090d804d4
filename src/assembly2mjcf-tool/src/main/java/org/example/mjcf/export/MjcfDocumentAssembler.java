package org.example.mjcf.export;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.model.Part;

import java.util.Collection;
import java.util.List;

/**
 * Puts the finished pieces of a model into one {@code mujoco} document. The
 * ten top-level blocks always appear, in the order MuJoCo's own exports use,
 * even when empty.
 */
public class MjcfDocumentAssembler {

    private final ExportSettings settings;

    public MjcfDocumentAssembler(ExportSettings settings) {
        this.settings = settings;
    }

    public MjcfElement assemble(String modelName,
                                AssetCatalog assets,
                                double floorHeight,
                                BodyHierarchy hierarchy,
                                List<MjcfElement> equalities) {
        return MjcfElement.builder("mujoco")
            .attr("model", modelName)
            .child(option())
            .child(compiler())
            .child(defaults())
            .child(assets.toElement())
            .child(worldBody(floorHeight, hierarchy.rootBody()))
            .child(MjcfElement.empty("contact"))
            .child(MjcfElement.builder("equality").children(equalities).build())
            .child(MjcfElement.empty("tendon"))
            .child(MjcfElement.builder("actuator").children(hierarchy.actuators()).build())
            .child(MjcfElement.builder("sensor").children(hierarchy.sensors()).build())
            .build();
    }

    /**
     * Height of the floor plane: just below the lowest part placement,
     * converted to model units.
     */
    public double floorHeight(Collection<Part> parts) {
        if (parts.isEmpty()) {
            throw new ConfigurationException("Cannot place a floor under an empty assembly");
        }
        double minZ = Double.POSITIVE_INFINITY;
        for (Part part : parts) {
            minZ = Math.min(minZ, part.placement().position().z());
        }
        return minZ * settings.lengthScale() - settings.floorMargin();
    }

    // ── Blocks ───────────────────────────────────────────────────────────────

    private MjcfElement option() {
        return MjcfElement.builder("option")
            .attr("integrator", settings.integrator())
            .attr("timestep", settings.timestep())
            .attr("solver", settings.solver())
            .build();
    }

    private MjcfElement compiler() {
        return MjcfElement.builder("compiler")
            .attr("angle", "radian")
            .attr("meshdir", settings.meshDir())
            .attr("autolimits", "true")
            .build();
    }

    private MjcfElement defaults() {
        return MjcfElement.builder("default")
            .child(MjcfElement.builder("joint")
                .attr("damping", settings.jointDamping())
                .attr("armature", settings.jointArmature())
                .build())
            .child(MjcfElement.builder("default")
                .attr("class", HierarchyEmitter.VISUAL_CLASS)
                .child(MjcfElement.builder("geom")
                    .attr("contype", "0")
                    .attr("conaffinity", "0")
                    .attr("group", "2")
                    .build())
                .build())
            .build();
    }

    private MjcfElement worldBody(double floorHeight, MjcfElement rootBody) {
        return MjcfElement.builder("worldbody")
            .child(MjcfElement.builder("light")
                .attr("name", "top")
                .attr("pos", "0 0 2")
                .attr("dir", "0 0 -1")
                .attr("directional", "true")
                .build())
            .child(MjcfElement.builder("geom")
                .attr("name", "floor")
                .attr("type", "plane")
                .attr("size", "0 0 0.05")
                .attr("pos", MjcfFormat.numbers(0, 0, floorHeight))
                .attr("material", AssetCatalog.GROUND_MATERIAL)
                .build())
            .child(rootBody)
            .build();
    }
}
