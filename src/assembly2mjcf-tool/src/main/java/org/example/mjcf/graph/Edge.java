package org.example.mjcf.graph;

import org.example.mjcf.model.AssemblyJoint;
import org.example.mjcf.model.JointKind;

/**
 * Graph edge for one joint. The weight is fixed at construction from the
 * joint kind; geometry stays on the joint and is only resolved when the
 * edge is emitted. Two edges are equal when they wrap the same joint name.
 */
public final class Edge {

    private final AssemblyJoint joint;
    private final double weight;

    public Edge(AssemblyJoint joint) {
        this.joint = joint;
        this.weight = joint.kind().weight();
    }

    public AssemblyJoint joint() {
        return joint;
    }

    public JointKind kind() {
        return joint.kind();
    }

    public double weight() {
        return weight;
    }

    public String name() {
        return joint.name();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Edge other && joint.name().equals(other.joint.name());
    }

    @Override
    public int hashCode() {
        return joint.name().hashCode();
    }

    @Override
    public String toString() {
        return joint.name() + " [" + joint.kind() + "]";
    }
}
