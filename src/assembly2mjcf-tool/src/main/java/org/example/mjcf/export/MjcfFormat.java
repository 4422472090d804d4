package org.example.mjcf.export;

import org.example.mjcf.model.Rotation;
import org.example.mjcf.model.Vector3;

/**
 * Attribute value formatting. Whole numbers print without a fraction
 * ({@code "0 0 1"}), everything else uses {@link Double#toString(double)} so
 * values survive a parse round trip unchanged.
 */
final class MjcfFormat {

    private MjcfFormat() {
    }

    static String number(double value) {
        if (value == 0) return "0";
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String numbers(double... values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(number(values[i]));
        }
        return sb.toString();
    }

    static String vector(Vector3 v) {
        return numbers(v.x(), v.y(), v.z());
    }

    static String quaternion(Rotation q) {
        return numbers(q.w(), q.x(), q.y(), q.z());
    }
}
