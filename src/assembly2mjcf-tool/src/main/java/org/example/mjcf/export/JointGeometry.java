package org.example.mjcf.export;

import org.example.mjcf.UnsupportedFeatureException;
import org.example.mjcf.graph.Edge;
import org.example.mjcf.model.Placement;
import org.example.mjcf.model.Vector3;

/**
 * Anchor point and axis of a joint in model units.
 */
public record JointGeometry(Vector3 position, Vector3 axis) {

    /**
     * Resolves the geometry of an emitted joint. Only revolute joints have an
     * extraction rule: the anchor frame's origin is the pivot and its Z axis is
     * the hinge axis.
     *
     * @throws UnsupportedFeatureException for every other joint kind
     */
    public static JointGeometry resolve(Edge edge, double lengthScale) {
        Placement anchor = edge.joint().anchor();
        switch (edge.kind()) {
            case REVOLUTE:
                return new JointGeometry(
                    anchor.position().scale(lengthScale),
                    anchor.rotation().apply(Vector3.UNIT_Z));
            default:
                throw new UnsupportedFeatureException("No axis extraction rule for joint '"
                    + edge.name() + "' of kind " + edge.kind());
        }
    }
}
