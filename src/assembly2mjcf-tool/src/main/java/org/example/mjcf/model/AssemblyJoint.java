package org.example.mjcf.model;

/**
 * One joint of the assembly. A grounded joint references only {@code part1}
 * and pins that part to the world; every other joint connects
 * {@code part1} and {@code part2}.
 *
 * @param anchor joint frame in global CAD coordinates; its Z axis is the
 *               joint axis for rotational joints
 */
public record AssemblyJoint(
        String name,
        String label,
        JointKind kind,
        boolean grounded,
        String part1,
        String part2,
        Placement anchor,
        JointLimits limits) {

    public static AssemblyJoint grounded(String name, String part) {
        return new AssemblyJoint(name, name, JointKind.FIXED, true, part, null, Placement.IDENTITY, JointLimits.NONE);
    }

    public static AssemblyJoint connecting(String name, JointKind kind, String part1, String part2) {
        return new AssemblyJoint(name, name, kind, false, part1, part2, Placement.IDENTITY, JointLimits.NONE);
    }

    public AssemblyJoint withLabel(String newLabel) {
        return new AssemblyJoint(name, newLabel, kind, grounded, part1, part2, anchor, limits);
    }

    public AssemblyJoint withAnchor(Placement newAnchor) {
        return new AssemblyJoint(name, label, kind, grounded, part1, part2, newAnchor, limits);
    }

    public AssemblyJoint withLimits(JointLimits newLimits) {
        return new AssemblyJoint(name, label, kind, grounded, part1, part2, anchor, newLimits);
    }
}
