package com.controls.cdl.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Qualified, structural identity of a block instance: the root instance name
 * followed by each child name on the way down, written {@code root.a.b}.
 *
 * <p>
 * Two paths are equal when their segments are equal, so the same block
 * definition instantiated in two places (or in two contexts) never aliases.
 */
public final class InstancePath implements Comparable<InstancePath> {
    private final List<String> segments;
    private final String text;

    private InstancePath(List<String> segments) {
        this.segments = segments;
        this.text = String.join(".", segments);
    }

    public static InstancePath root(String name) {
        return new InstancePath(List.of(checkSegment(name)));
    }

    /** Parses a dotted path such as {@code "model.controller.gain"}. */
    public static InstancePath parse(String text) {
        if (text == null || text.isBlank())
            throw new IllegalArgumentException("Instance path cannot be empty");
        List<String> parts = new ArrayList<>(Arrays.asList(text.strip().split("\\.")));
        for (String p : parts)
            checkSegment(p);
        return new InstancePath(Collections.unmodifiableList(parts));
    }

    public InstancePath child(String name) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(checkSegment(name));
        return new InstancePath(Collections.unmodifiableList(next));
    }

    /** The enclosing instance, or null for a root path. */
    public InstancePath parent() {
        if (segments.size() == 1)
            return null;
        return new InstancePath(segments.subList(0, segments.size() - 1));
    }

    public String name() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.size() == 1;
    }

    /** True if this path is {@code other} or one of its ancestors. */
    public boolean contains(InstancePath other) {
        if (other.segments.size() < segments.size())
            return false;
        return other.segments.subList(0, segments.size()).equals(segments);
    }

    /**
     * The segment directly below this path on the way to {@code descendant}.
     *
     * @throws IllegalArgumentException if {@code descendant} is not strictly
     *                                  below this path.
     */
    public String childSegmentTowards(InstancePath descendant) {
        if (!contains(descendant) || descendant.segments.size() == segments.size())
            throw new IllegalArgumentException(descendant + " is not below " + this);
        return descendant.segments.get(segments.size());
    }

    private static String checkSegment(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Instance name cannot be empty");
        if (name.indexOf('.') >= 0)
            throw new IllegalArgumentException("Instance name cannot contain '.': " + name);
        return name.strip();
    }

    @Override
    public int compareTo(InstancePath o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof InstancePath p && segments.equals(p.segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
