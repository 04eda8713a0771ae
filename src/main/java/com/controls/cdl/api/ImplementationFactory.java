package com.controls.cdl.api;

import com.controls.cdl.engine.BoundParameters;

/**
 * Creates the {@link ElementaryFunction} for one block instance.
 *
 * <p>
 * The factory is invoked when a context initializes (and again on reset), so
 * stateful implementations get fresh state per instance. The bound parameters
 * are final for the lifetime of the returned function.
 */
@FunctionalInterface
public interface ImplementationFactory {
    ElementaryFunction create(BoundParameters parameters);
}
