package com.controls.cdl.registry;

import com.controls.cdl.api.ElementaryFunction;
import com.controls.cdl.api.ImplementationFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit mapping from elementary block type names to their implementations.
 *
 * <p>
 * A registry is an ordinary value built by the caller and passed to each
 * validator and execution context that needs it. There is no process-wide
 * instance, so independent engines (for example parallel test runs) cannot
 * see each other's registrations.
 *
 * <p>
 * Not thread-safe while being populated. Once handed to contexts it should be
 * treated as read-only.
 */
public final class ImplementationRegistry {

    private final Map<String, ImplementationFactory> factories = new LinkedHashMap<>();

    /**
     * Registers a factory that creates one implementation per instance. Use this
     * for stateful behaviors.
     *
     * @throws IllegalArgumentException if the type is already registered.
     */
    public ImplementationRegistry register(String typeName, ImplementationFactory factory) {
        if (typeName == null || typeName.isBlank())
            throw new IllegalArgumentException("Type name cannot be empty");
        if (factory == null)
            throw new IllegalArgumentException("Factory cannot be null for type " + typeName);
        if (factories.putIfAbsent(typeName, factory) != null)
            throw new IllegalArgumentException("Duplicate implementation for type: " + typeName);
        return this;
    }

    /** Registers a stateless function shared by every instance of the type. */
    public ImplementationRegistry registerFunction(String typeName, ElementaryFunction function) {
        if (function == null)
            throw new IllegalArgumentException("Function cannot be null for type " + typeName);
        return register(typeName, params -> function);
    }

    public boolean contains(String typeName) {
        return factories.containsKey(typeName);
    }

    public Optional<ImplementationFactory> find(String typeName) {
        return Optional.ofNullable(factories.get(typeName));
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under the name.
     */
    public ImplementationFactory require(String typeName) {
        ImplementationFactory f = factories.get(typeName);
        if (f == null)
            throw new IllegalArgumentException("No implementation registered for type: " + typeName);
        return f;
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public int size() {
        return factories.size();
    }
}
