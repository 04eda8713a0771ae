package com.controls.cdl.model;

/**
 * One end of a {@link Connection}: a connector on a child instance, or on the
 * enclosing composite's own boundary when {@code instance} is null.
 */
public record Endpoint(String instance, String connector) {
    public Endpoint {
        if (connector == null || connector.isBlank())
            throw new IllegalArgumentException("Endpoint connector cannot be empty");
        connector = connector.strip();
        instance = instance == null || instance.isBlank() ? null : instance.strip();
    }

    public static Endpoint of(String instance, String connector) {
        return new Endpoint(instance, connector);
    }

    public static Endpoint boundary(String connector) {
        return new Endpoint(null, connector);
    }

    /**
     * Parses {@code "child.connector"} or a bare {@code "connector"} for the
     * boundary.
     */
    public static Endpoint parse(String text) {
        int dot = text.lastIndexOf('.');
        return dot < 0 ? boundary(text) : of(text.substring(0, dot), text.substring(dot + 1));
    }

    public boolean isBoundary() {
        return instance == null;
    }

    @Override
    public String toString() {
        return isBoundary() ? connector : instance + "." + connector;
    }
}
