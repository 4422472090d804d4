package org.example.mjcf.export;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique MJCF names. Labels from the CAD tree may contain spaces or
 * repeat across joints, so they are normalized and suffixed on collision:
 * {@code "Hinge A"}, {@code "Hinge A"} become {@code Hinge_A}, {@code Hinge_A_2}.
 */
public class NameRegistry {

    private final Set<String> used = new HashSet<>();

    public String claim(String label) {
        String base = sanitize(label);
        String name = base;
        for (int n = 2; !used.add(name); n++) {
            name = base + "_" + n;
        }
        return name;
    }

    static String sanitize(String label) {
        String cleaned = label == null ? "" : label.trim().replaceAll("[^A-Za-z0-9_.\\-]+", "_");
        return cleaned.isEmpty() ? "joint" : cleaned;
    }
}
