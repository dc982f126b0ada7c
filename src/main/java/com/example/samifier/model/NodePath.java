package com.example.samifier.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable path from the document root to a value.
 *
 * Segments are map keys (String) or list indices (Integer). Inside intrinsic nodes the segments
 * {@link #ARGS}, {@link #VARS} and {@link #ATTR} step into the function argument, the
 * {@code Fn::Sub} variable map and the {@code GetAtt} attribute.
 */
public final class NodePath {
    public static final String ARGS = "args";
    public static final String VARS = "vars";
    public static final String ATTR = "attr";

    private static final NodePath ROOT = new NodePath(Collections.emptyList());

    private final List<Object> segments;

    private NodePath(List<Object> segments) {
        this.segments = segments;
    }

    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(Object... segments) {
        NodePath path = ROOT;
        for (Object segment : segments) {
            path = segment instanceof Integer ? path.child((Integer) segment) : path.child((String) segment);
        }
        return path;
    }

    public NodePath child(String key) {
        return append(key);
    }

    public NodePath child(int index) {
        return append(index);
    }

    private NodePath append(Object segment) {
        List<Object> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new NodePath(Collections.unmodifiableList(next));
    }

    public NodePath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        return new NodePath(segments.subList(0, segments.size() - 1));
    }

    public List<Object> getSegments() {
        return segments;
    }

    public Object last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    public Object get(int index) {
        return segments.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodePath)) {
            return false;
        }
        return segments.equals(((NodePath) o).segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                out.append('[').append(segment).append(']');
            } else {
                if (out.length() > 0) {
                    out.append('.');
                }
                out.append(segment);
            }
        }
        return out.toString();
    }
}
