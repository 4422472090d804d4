package org.example.mjcf.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Joint kinds known to the exporter, together with the two fixed lookup tables
 * that drive the conversion: the spanning-tree weight (lower weights are
 * kept in the tree first) and the MJCF joint type ({@code null} means the
 * connection is rigid and gets no joint element).
 */
public enum JointKind {
    FIXED(10.0, null),
    REVOLUTE(1.0, "hinge"),
    PRISMATIC(2.0, "slide"),
    CYLINDRICAL(3.0, "hinge"),
    BALL(5.0, "ball"),
    PLANAR(8.0, "free"),
    UNRECOGNIZED(20.0, null);

    /** CAD host type names, lower-cased. "Slider" is the host's name for prismatic. */
    private static final Map<String, JointKind> CAD_NAMES = Map.of(
        "fixed",       FIXED,
        "revolute",    REVOLUTE,
        "slider",      PRISMATIC,
        "prismatic",   PRISMATIC,
        "cylindrical", CYLINDRICAL,
        "ball",        BALL,
        "planar",      PLANAR
    );

    private final double weight;
    private final String mjcfType;

    JointKind(double weight, String mjcfType) {
        this.weight = weight;
        this.mjcfType = mjcfType;
    }

    public double weight() {
        return weight;
    }

    /** MJCF joint type, empty for connections expressed without a joint. */
    public Optional<String> mjcfType() {
        return Optional.ofNullable(mjcfType);
    }

    public boolean isRigid() {
        return mjcfType == null;
    }

    public static JointKind fromCadName(String typeName) {
        if (typeName == null) return UNRECOGNIZED;
        return CAD_NAMES.getOrDefault(typeName.trim().toLowerCase(Locale.ROOT), UNRECOGNIZED);
    }
}
