package com.controls.cdl.model;

import java.util.Objects;

/**
 * A directed edge from one connector to another inside a composite block.
 *
 * <p>
 * Three shapes are legal:
 * <ul>
 * <li>parent input to child input</li>
 * <li>child output to sibling child input</li>
 * <li>child output to parent output</li>
 * </ul>
 * Whether the named connectors have the causality the shape requires is
 * decided by the validator, which has the block definitions at hand.
 */
public final class Connection {
    private final Endpoint from;
    private final Endpoint to;
    private final String description;

    public Connection(Endpoint from, Endpoint to, String description) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.description = description;
    }

    public static Connection of(Endpoint from, Endpoint to) {
        return new Connection(from, to, null);
    }

    /** Shorthand: {@code Connection.of("gain.y", "y")}. */
    public static Connection of(String from, String to) {
        return new Connection(Endpoint.parse(from), Endpoint.parse(to), null);
    }

    public Endpoint from() {
        return from;
    }

    public Endpoint to() {
        return to;
    }

    public String description() {
        return description;
    }

    public Shape shape() {
        if (from.isBoundary() && !to.isBoundary())
            return Shape.PARENT_INPUT_TO_CHILD;
        if (!from.isBoundary() && !to.isBoundary())
            return Shape.SIBLING;
        if (!from.isBoundary())
            return Shape.CHILD_TO_PARENT_OUTPUT;
        return Shape.ILLEGAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Connection c))
            return false;
        return from.equals(c.from) && to.equals(c.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }

    /** Structural classification of a connection by its endpoints. */
    public enum Shape {
        PARENT_INPUT_TO_CHILD,
        SIBLING,
        CHILD_TO_PARENT_OUTPUT,
        ILLEGAL
    }
}
