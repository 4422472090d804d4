package org.example.mjcf.model;

/**
 * One rigid part of the assembly.
 *
 * @param name      stable unique name, used as graph key and body name
 * @param label     display label from the CAD tree
 * @param placement global placement in CAD units
 * @param shape     opaque shape reference handed to the mesh provider, may be {@code null}
 * @param material  appearance, never {@code null}
 */
public record Part(String name, String label, Placement placement, String shape, Material material) {
}
