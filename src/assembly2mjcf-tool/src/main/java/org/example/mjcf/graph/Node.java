package org.example.mjcf.graph;

import org.example.mjcf.model.Part;

import java.util.Objects;

/**
 * Graph vertex for one rigid part. Equality and hashing use only the key,
 * so a node rebuilt from the same part name is the same node.
 */
public final class Node {

    private final String key;
    private final Part part;

    public Node(Part part) {
        this.key = Objects.requireNonNull(part.name(), "part name");
        this.part = part;
    }

    public String key() {
        return key;
    }

    public Part part() {
        return part;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Node other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
