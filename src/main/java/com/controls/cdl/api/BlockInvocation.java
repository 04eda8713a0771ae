package com.controls.cdl.api;

import com.controls.cdl.engine.BoundParameters;
import com.controls.cdl.model.InstancePath;

/**
 * What an {@link ElementaryFunction} sees during one evaluation: the
 * instance's identity, its bound parameters, its current inputs, and a way to
 * publish outputs.
 *
 * <p>
 * Input accessors fail on undeclared names. Inputs are always bound when a
 * function is invoked; the evaluator checks that beforehand.
 */
public interface BlockInvocation {

    InstancePath path();

    /** Number of the step being evaluated, starting at 1. */
    long step();

    BoundParameters parameters();

    Object input(String name);

    default double realInput(String name) {
        return (Double) input(name);
    }

    default int integerInput(String name) {
        return (Integer) input(name);
    }

    default boolean booleanInput(String name) {
        return (Boolean) input(name);
    }

    default String stringInput(String name) {
        return (String) input(name);
    }

    /**
     * Writes an output signal. The value must match the connector's type;
     * non-finite reals are rejected unless the engine allows them.
     */
    void setOutput(String name, Object value);

    /**
     * The value this output held after the previous step, or null if it has
     * never been written.
     */
    Object previousOutput(String name);
}
