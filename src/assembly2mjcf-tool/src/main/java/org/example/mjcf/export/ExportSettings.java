package org.example.mjcf.export;

import org.example.mjcf.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

/**
 * Simulation and conversion parameters of one export.
 *
 * @param integrator     MJCF {@code option/@integrator}
 * @param timestep       MJCF {@code option/@timestep} in seconds
 * @param solver         MJCF {@code option/@solver}
 * @param jointDamping   default joint damping
 * @param jointArmature  default joint armature
 * @param lengthScale    factor from CAD length units to model units (mm to m by default)
 * @param floorMargin    gap between the lowest part placement and the floor plane, in model units
 * @param actuatorGain   {@code kp} of the position actuator attached to every joint
 * @param meshDir        MJCF {@code compiler/@meshdir}
 */
public record ExportSettings(
        String integrator,
        double timestep,
        String solver,
        double jointDamping,
        double jointArmature,
        double lengthScale,
        double floorMargin,
        double actuatorGain,
        String meshDir) {

    public static final String INTEGRATOR = "integrator";
    public static final String TIMESTEP = "timestep";
    public static final String SOLVER = "solver";
    public static final String JOINT_DAMPING = "joint.damping";
    public static final String JOINT_ARMATURE = "joint.armature";
    public static final String LENGTH_SCALE = "length.scale";
    public static final String FLOOR_MARGIN = "floor.margin";
    public static final String ACTUATOR_GAIN = "actuator.kp";
    public static final String MESH_DIR = "meshdir";

    private static final Set<String> INTEGRATORS = Set.of("Euler", "RK4", "implicit", "implicitfast");
    private static final Set<String> SOLVERS = Set.of("PGS", "CG", "Newton");

    public static final ExportSettings DEFAULTS =
        new ExportSettings("implicitfast", 0.002, "Newton", 0.1, 0.01, 0.001, 0.001, 10.0, "meshes");

    public ExportSettings {
        if (!INTEGRATORS.contains(integrator)) {
            throw new ConfigurationException("Unknown integrator '" + integrator + "', expected one of " + INTEGRATORS);
        }
        if (!SOLVERS.contains(solver)) {
            throw new ConfigurationException("Unknown solver '" + solver + "', expected one of " + SOLVERS);
        }
        if (!(timestep > 0)) {
            throw new ConfigurationException("Timestep must be positive, got " + timestep);
        }
        if (!(lengthScale > 0)) {
            throw new ConfigurationException("Length scale must be positive, got " + lengthScale);
        }
    }

    /** Reads a properties file; keys that are absent keep their default. */
    public static Properties loadProperties(Path file) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read settings '" + file + "': " + e.getMessage(), e);
        }
        return props;
    }

    public static ExportSettings fromProperties(Properties props) {
        ExportSettings d = DEFAULTS;
        return new ExportSettings(
            props.getProperty(INTEGRATOR, d.integrator).trim(),
            number(props, TIMESTEP, d.timestep),
            props.getProperty(SOLVER, d.solver).trim(),
            number(props, JOINT_DAMPING, d.jointDamping),
            number(props, JOINT_ARMATURE, d.jointArmature),
            number(props, LENGTH_SCALE, d.lengthScale),
            number(props, FLOOR_MARGIN, d.floorMargin),
            number(props, ACTUATOR_GAIN, d.actuatorGain),
            props.getProperty(MESH_DIR, d.meshDir).trim());
    }

    private static double number(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting '" + key + "' is not a number: '" + value + "'", e);
        }
    }
}
