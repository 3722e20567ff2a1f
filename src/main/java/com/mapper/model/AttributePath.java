package com.mapper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable dotted path from the root schema to an attribute, e.g. {@code nested_map_prop.obj.f}.
 * Used to qualify errors and to look up configured overrides.
 */
public final class AttributePath {

    private static final AttributePath ROOT = new AttributePath(Collections.emptyList());

    private final List<String> segments;

    private AttributePath(List<String> segments) {
        this.segments = segments;
    }

    public static AttributePath root() {
        return ROOT;
    }

    public static AttributePath of(String... segments) {
        AttributePath path = ROOT;
        for (String segment : segments) {
            path = path.child(segment);
        }
        return path;
    }

    public AttributePath child(String name) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(name);
        return new AttributePath(Collections.unmodifiableList(next));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AttributePath && segments.equals(((AttributePath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : String.join(".", segments);
    }
}
