package com.controls.cdl.engine;

import com.controls.cdl.api.ElementaryFunction;
import com.controls.cdl.api.ImplementationFactory;
import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.InstancePath;

import java.util.List;

/**
 * Runtime state of one scheduled instance: its bound parameters, the resolved
 * connections that feed its inputs, and either the elementary function
 * created for it or the nested context that evaluates its sub-graph.
 *
 * <p>
 * A nested context is owned by its runtime and lives exactly as long as it.
 */
final class InstanceRuntime {
    private final InstancePath path;
    private final BlockInstance instance;
    private final BoundParameters parameters;
    private final List<SignalTransfer> inbound;
    private final ImplementationFactory factory;
    private final ExecutionContext nested;
    private ElementaryFunction function;

    private InstanceRuntime(InstancePath path, BlockInstance instance, BoundParameters parameters,
            List<SignalTransfer> inbound, ImplementationFactory factory, ExecutionContext nested) {
        this.path = path;
        this.instance = instance;
        this.parameters = parameters;
        this.inbound = List.copyOf(inbound);
        this.factory = factory;
        this.nested = nested;
    }

    static InstanceRuntime elementary(InstancePath path, BlockInstance instance, BoundParameters parameters,
            List<SignalTransfer> inbound, ImplementationFactory factory) {
        InstanceRuntime rt = new InstanceRuntime(path, instance, parameters, inbound, factory, null);
        rt.instantiate();
        return rt;
    }

    static InstanceRuntime composite(InstancePath path, BlockInstance instance, BoundParameters parameters,
            List<SignalTransfer> inbound, ExecutionContext nested) {
        return new InstanceRuntime(path, instance, parameters, inbound, null, nested);
    }

    /** Discards instance-local state: a fresh function, or a reset nested context. */
    void reinstantiate() {
        if (nested != null)
            nested.resetState();
        else
            instantiate();
    }

    private void instantiate() {
        ElementaryFunction f = factory.create(parameters);
        if (f == null)
            throw new IllegalStateException("Implementation factory for " + instance.block().typeName()
                    + " returned null for " + path);
        this.function = f;
    }

    InstancePath path() {
        return path;
    }

    Block block() {
        return instance.block();
    }

    BoundParameters parameters() {
        return parameters;
    }

    List<SignalTransfer> inbound() {
        return inbound;
    }

    boolean isComposite() {
        return nested != null;
    }

    ElementaryFunction function() {
        return function;
    }

    ExecutionContext nested() {
        return nested;
    }

    @Override
    public String toString() {
        return path + " : " + instance.block().typeName();
    }
}
