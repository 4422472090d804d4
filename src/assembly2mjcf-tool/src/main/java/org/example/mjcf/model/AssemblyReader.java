package org.example.mjcf.model;

import org.example.mjcf.ConfigurationException;
import org.example.mjcf.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the JSON assembly description produced by the CAD extraction step.
 *
 * Layout:
 * <pre>
 * {@code
 * {
 *   "name":   "four_bar",
 *   "parts":  [ { "name", "label", "placement", "shape", "material" } ],
 *   "joints": [ { "name", "label", "type", "parts": [a, b], "anchor", "limits" } ]
 * }
 * }
 * </pre>
 *
 * Placements are {@code {"position": [x, y, z], "rotation": [w, x, y, z]}}.
 * A joint of type {@code Grounded} lists a single part. Everything except the
 * part and joint names and the joint's parts is optional.
 */
public final class AssemblyReader {

    static final String GROUNDED_TYPE = "Grounded";

    private AssemblyReader() {
    }

    public static Assembly read(Path file) {
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read assembly '" + file + "': " + e.getMessage(), e);
        }
        String fallbackName = file.getFileName().toString().replaceFirst("\\.json$", "");
        return parse(source, fallbackName);
    }

    public static Assembly parse(String source, String fallbackName) {
        JSONObject root;
        try {
            root = new JSONObject(source);
        } catch (JSONException e) {
            throw new ConfigurationException("Malformed assembly description: " + e.getMessage(), e);
        }

        try {
            String name = root.optString("name", fallbackName);
            List<Part> parts = readParts(root.optJSONArray("parts"));
            List<AssemblyJoint> joints = readJoints(root.optJSONArray("joints"));
            if (parts.isEmpty()) {
                throw new ConfigurationException("Assembly '" + name + "' contains no parts");
            }
            Logger.debug("Read assembly '%s': %d part(s), %d joint(s)", name, parts.size(), joints.size());
            return new Assembly(name, parts, joints);
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid assembly description: " + e.getMessage(), e);
        }
    }

    // ── Parts ────────────────────────────────────────────────────────────────

    private static List<Part> readParts(JSONArray array) {
        List<Part> parts = new ArrayList<>();
        if (array == null) return parts;

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject obj = array.getJSONObject(i);
            String name = requireName(obj, "part #" + i);
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate part name '" + name + "'");
            }
            parts.add(new Part(
                name,
                obj.optString("label", name),
                readPlacement(obj.optJSONObject("placement")),
                obj.has("shape") ? obj.getString("shape") : null,
                readMaterial(obj.optJSONObject("material"))));
        }
        return parts;
    }

    private static Material readMaterial(JSONObject obj) {
        if (obj == null) return Material.DEFAULT;
        String name = obj.optString("name", Material.DEFAULT.name());
        JSONArray rgba = obj.optJSONArray("rgba");
        if (rgba == null) {
            return new Material(name, Material.DEFAULT.r(), Material.DEFAULT.g(), Material.DEFAULT.b(), Material.DEFAULT.a());
        }
        return new Material(name,
            rgba.getDouble(0), rgba.getDouble(1), rgba.getDouble(2),
            rgba.length() > 3 ? rgba.getDouble(3) : 1.0);
    }

    // ── Joints ───────────────────────────────────────────────────────────────

    private static List<AssemblyJoint> readJoints(JSONArray array) {
        List<AssemblyJoint> joints = new ArrayList<>();
        if (array == null) return joints;

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject obj = array.getJSONObject(i);
            String name = requireName(obj, "joint #" + i);
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate joint name '" + name + "'");
            }
            String type = obj.optString("type", "");
            JSONArray refs = obj.optJSONArray("parts");
            if (refs == null || refs.isEmpty()) {
                throw new ConfigurationException("Joint '" + name + "' does not reference any part");
            }

            if (GROUNDED_TYPE.equalsIgnoreCase(type)) {
                joints.add(AssemblyJoint.grounded(name, refs.getString(0)));
                continue;
            }
            if (refs.length() != 2) {
                throw new ConfigurationException("Joint '" + name + "' must connect exactly two parts, found "
                    + refs.length());
            }

            JointKind kind = JointKind.fromCadName(type);
            if (kind == JointKind.UNRECOGNIZED) {
                Logger.warn("Joint '%s' has unrecognized type '%s'; treated as rigid", name, type);
            }
            joints.add(new AssemblyJoint(
                name,
                obj.optString("label", name),
                kind,
                false,
                refs.getString(0),
                refs.getString(1),
                readPlacement(obj.optJSONObject("anchor")),
                readLimits(obj.optJSONObject("limits"))));
        }
        return joints;
    }

    private static JointLimits readLimits(JSONObject obj) {
        if (obj == null) return JointLimits.NONE;
        return new JointLimits(
            obj.optBoolean("enableAngleMin"), obj.optDouble("angleMin", 0),
            obj.optBoolean("enableAngleMax"), obj.optDouble("angleMax", 0),
            obj.optBoolean("enableLengthMin"), obj.optDouble("lengthMin", 0),
            obj.optBoolean("enableLengthMax"), obj.optDouble("lengthMax", 0));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Placement readPlacement(JSONObject obj) {
        if (obj == null) return Placement.IDENTITY;
        Vector3 position = Vector3.ZERO;
        Rotation rotation = Rotation.IDENTITY;

        JSONArray pos = obj.optJSONArray("position");
        if (pos != null) {
            position = new Vector3(pos.getDouble(0), pos.getDouble(1), pos.getDouble(2));
        }
        JSONArray rot = obj.optJSONArray("rotation");
        if (rot != null) {
            rotation = new Rotation(rot.getDouble(0), rot.getDouble(1), rot.getDouble(2), rot.getDouble(3));
        }
        return new Placement(position, rotation);
    }

    private static String requireName(JSONObject obj, String what) {
        String name = obj.optString("name", "").trim();
        if (name.isEmpty()) {
            throw new ConfigurationException("Missing name for " + what);
        }
        return name;
    }
}
