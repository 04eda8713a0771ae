package com.controls.cdl.model;

import java.util.Objects;

/** Addresses one signal: a connector on one instance. */
public record SignalKey(InstancePath instance, String connector) {
    public SignalKey {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(connector, "connector");
    }

    public static SignalKey of(InstancePath instance, String connector) {
        return new SignalKey(instance, connector);
    }

    @Override
    public String toString() {
        return instance + "." + connector;
    }
}
