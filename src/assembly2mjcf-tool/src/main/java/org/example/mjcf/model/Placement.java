package org.example.mjcf.model;

/** Position plus orientation, as the CAD host stores it. */
public record Placement(Vector3 position, Rotation rotation) {

    public static final Placement IDENTITY = new Placement(Vector3.ZERO, Rotation.IDENTITY);
}
