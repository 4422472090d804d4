package org.example.mjcf.model;

import java.util.List;
import java.util.Optional;

/**
 * Parts and joints of one CAD assembly, in document order.
 */
public record Assembly(String name, List<Part> parts, List<AssemblyJoint> joints) {

    public Assembly {
        parts = List.copyOf(parts);
        joints = List.copyOf(joints);
    }

    public Optional<Part> part(String partName) {
        return parts.stream().filter(p -> p.name().equals(partName)).findFirst();
    }
}
