package com.controls.cdl.model;

/**
 * Override value binding a child parameter to a parameter of the enclosing
 * composite instance, resolved when the context binds parameters.
 *
 * @param name name of the parameter on the enclosing instance
 */
public record ParentParameter(String name) {
    public ParentParameter {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Parent parameter name cannot be empty");
    }

    public static ParentParameter of(String name) {
        return new ParentParameter(name);
    }
}
