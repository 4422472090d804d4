package org.example.mjcf.model;

/**
 * Appearance descriptor of a part. The name is the deduplication key in the
 * asset catalog: two parts referencing the same name share one material.
 */
public record Material(String name, double r, double g, double b, double a) {

    public static final Material DEFAULT = new Material("default", 0.8, 0.8, 0.8, 1.0);
}
