package org.example.mjcf.export;

import org.example.mjcf.model.JointLimits;

import java.util.Optional;

/**
 * Lower and upper joint position limit in model units (radians or meters).
 */
public record JointRange(double lower, double upper) {

    /**
     * Range of a joint from whichever limit pair is enabled. Angular limits win
     * over linear ones and are converted from degrees; linear limits are
     * scaled to model length units. A pair with only one enabled bound yields
     * no range at all.
     */
    public static Optional<JointRange> of(JointLimits limits, double lengthScale) {
        if (limits.hasAngularLimit()) {
            if (limits.enableAngleMin() && limits.enableAngleMax()) {
                return Optional.of(new JointRange(
                    Math.toRadians(limits.angleMin()), Math.toRadians(limits.angleMax())));
            }
            return Optional.empty();
        }
        if (limits.hasLinearLimit()) {
            if (limits.enableLengthMin() && limits.enableLengthMax()) {
                return Optional.of(new JointRange(
                    limits.lengthMin() * lengthScale, limits.lengthMax() * lengthScale));
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    public String toAttribute() {
        return MjcfFormat.numbers(lower, upper);
    }
}
