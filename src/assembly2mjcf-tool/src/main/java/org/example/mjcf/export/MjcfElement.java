package org.example.mjcf.export;

import org.example.mjcf.model.Rotation;
import org.example.mjcf.model.Vector3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable node of the output document. Sub-trees are built bottom-up with
 * {@link Builder} and handed to the parent builder, so a finished element can
 * be shared without any risk of later modification.
 */
public record MjcfElement(String tag, Map<String, String> attributes, List<MjcfElement> children) {

    public MjcfElement {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public static MjcfElement empty(String tag) {
        return new Builder(tag).build();
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public List<MjcfElement> children(String childTag) {
        List<MjcfElement> result = new ArrayList<>();
        for (MjcfElement child : children) {
            if (child.tag.equals(childTag)) result.add(child);
        }
        return result;
    }

    public Optional<MjcfElement> child(String childTag) {
        for (MjcfElement child : children) {
            if (child.tag.equals(childTag)) return Optional.of(child);
        }
        return Optional.empty();
    }

    /** All elements with the given tag below this one, depth-first pre-order. */
    public List<MjcfElement> descendants(String descendantTag) {
        List<MjcfElement> result = new ArrayList<>();
        collect(descendantTag, result);
        return result;
    }

    private void collect(String descendantTag, List<MjcfElement> result) {
        for (MjcfElement child : children) {
            if (child.tag.equals(descendantTag)) result.add(child);
            child.collect(descendantTag, result);
        }
    }

    public static final class Builder {
        private final String tag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<MjcfElement> children = new ArrayList<>();

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder attr(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder attr(String name, double value) {
            return attr(name, MjcfFormat.number(value));
        }

        public Builder attr(String name, Vector3 value) {
            return attr(name, MjcfFormat.vector(value));
        }

        public Builder attr(String name, Rotation value) {
            return attr(name, MjcfFormat.quaternion(value));
        }

        public Builder child(MjcfElement child) {
            children.add(child);
            return this;
        }

        public Builder children(List<MjcfElement> elements) {
            children.addAll(elements);
            return this;
        }

        public MjcfElement build() {
            return new MjcfElement(tag, attributes, children);
        }
    }
}
