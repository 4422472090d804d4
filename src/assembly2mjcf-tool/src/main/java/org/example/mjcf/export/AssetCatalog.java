package org.example.mjcf.export;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.Logger;
import org.example.mjcf.model.Material;
import org.example.mjcf.model.Part;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Textures, materials and meshes of one model. Filled once per part before
 * the hierarchy walk; materials are keyed by name, so parts sharing an
 * appearance share one material entry (the first registration wins).
 *
 * Every part owns its mesh file. Two parts resolving to the same file, or a
 * part material named like the built-in floor material, are rejected.
 */
public class AssetCatalog {

    static final String GROUND_TEXTURE = "grid";
    static final String GROUND_MATERIAL = "groundplane";

    /** Mesh and material a body's visual geom refers to. */
    public record Visual(String mesh, String material) {}

    private final MeshProvider meshes;
    private final ExportSettings settings;
    private final Map<String, Material> materials = new LinkedHashMap<>();
    private final Map<String, String> meshFiles = new LinkedHashMap<>();
    private final Map<String, Visual> visuals = new LinkedHashMap<>();
    private final Map<String, String> meshOwners = new HashMap<>();

    public AssetCatalog(MeshProvider meshes, ExportSettings settings) {
        this.meshes = meshes;
        this.settings = settings;
    }

    public Visual register(Part part) {
        Visual existing = visuals.get(part.name());
        if (existing != null) return existing;

        Material material = part.material();
        if (GROUND_MATERIAL.equals(material.name())) {
            throw new ConfigurationException("Material name '" + GROUND_MATERIAL + "' of part '"
                + part.name() + "' is reserved for the floor");
        }
        String meshFile = meshes.meshFile(part);
        String owner = meshOwners.putIfAbsent(meshFile, part.name());
        if (owner != null) {
            throw new ConfigurationException("Parts '" + owner + "' and '" + part.name()
                + "' both reference mesh file '" + meshFile + "'");
        }

        if (!materials.containsKey(material.name())) {
            materials.put(material.name(), material);
        } else if (!materials.get(material.name()).equals(material)) {
            Logger.debug("Material '%s' of part '%s' differs from the first registration; keeping the first",
                material.name(), part.name());
        }

        meshFiles.put(part.name(), meshFile);
        Visual visual = new Visual(part.name(), material.name());
        visuals.put(part.name(), visual);
        return visual;
    }

    public Visual visual(String partName) {
        Visual visual = visuals.get(partName);
        if (visual == null) {
            throw new IllegalStateException("Part '" + partName + "' was not registered in the asset catalog");
        }
        return visual;
    }

    public int materialCount() {
        return materials.size();
    }

    public int meshCount() {
        return meshFiles.size();
    }

    public MjcfElement toElement() {
        MjcfElement.Builder asset = MjcfElement.builder("asset");
        asset.child(MjcfElement.builder("texture")
            .attr("name", GROUND_TEXTURE)
            .attr("type", "2d")
            .attr("builtin", "checker")
            .attr("rgb1", "0.1 0.2 0.3")
            .attr("rgb2", "0.2 0.3 0.4")
            .attr("width", "512")
            .attr("height", "512")
            .build());
        asset.child(MjcfElement.builder("material")
            .attr("name", GROUND_MATERIAL)
            .attr("texture", GROUND_TEXTURE)
            .attr("texrepeat", "5 5")
            .attr("reflectance", "0.2")
            .build());

        for (Material material : materials.values()) {
            asset.child(MjcfElement.builder("material")
                .attr("name", material.name())
                .attr("rgba", MjcfFormat.numbers(material.r(), material.g(), material.b(), material.a()))
                .build());
        }

        double s = settings.lengthScale();
        for (Map.Entry<String, String> mesh : meshFiles.entrySet()) {
            asset.child(MjcfElement.builder("mesh")
                .attr("name", mesh.getKey())
                .attr("file", mesh.getValue())
                .attr("scale", MjcfFormat.numbers(s, s, s))
                .build());
        }
        return asset.build();
    }
}
