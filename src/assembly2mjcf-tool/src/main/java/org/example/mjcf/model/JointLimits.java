package org.example.mjcf.model;

/**
 * Limit properties of a joint as the CAD host exposes them: angular limits in
 * degrees and linear limits in CAD length units, each bound with its own
 * enable flag.
 */
public record JointLimits(
        boolean enableAngleMin, double angleMin,
        boolean enableAngleMax, double angleMax,
        boolean enableLengthMin, double lengthMin,
        boolean enableLengthMax, double lengthMax) {

    public static final JointLimits NONE = new JointLimits(false, 0, false, 0, false, 0, false, 0);

    public static JointLimits angular(double minDegrees, double maxDegrees) {
        return new JointLimits(true, minDegrees, true, maxDegrees, false, 0, false, 0);
    }

    public boolean hasAngularLimit() {
        return enableAngleMin || enableAngleMax;
    }

    public boolean hasLinearLimit() {
        return enableLengthMin || enableLengthMax;
    }
}
