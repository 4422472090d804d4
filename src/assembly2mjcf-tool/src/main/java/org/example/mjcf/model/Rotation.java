package org.example.mjcf.model;

/**
 * Unit quaternion in (w, x, y, z) order, the order MJCF uses for {@code quat}.
 */
public record Rotation(double w, double x, double y, double z) {

    public static final Rotation IDENTITY = new Rotation(1, 0, 0, 0);

    /**
     * Rotates {@code v} by this quaternion: v + 2w(q x v) + 2 q x (q x v).
     */
    public Vector3 apply(Vector3 v) {
        Vector3 q = new Vector3(x, y, z);
        Vector3 t = q.cross(v).scale(2);
        return v.add(t.scale(w)).add(q.cross(t));
    }
}
