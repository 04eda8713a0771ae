package com.controls.cdl.engine;

import com.controls.cdl.api.BlockInvocation;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;

import java.util.HashMap;
import java.util.Map;

/**
 * The view an elementary function gets of its instance for one evaluation.
 * Output writes go straight into the context's signal table, so whatever a
 * failing function wrote before it threw stays visible.
 */
final class ElementaryInvocation implements BlockInvocation {
    private final InstanceRuntime runtime;
    private final ExecutionContext context;
    private final long step;
    private final Map<String, Object> previous;

    ElementaryInvocation(InstanceRuntime runtime, ExecutionContext context, long step) {
        this.runtime = runtime;
        this.context = context;
        this.step = step;
        this.previous = new HashMap<>();
        for (Connector c : runtime.block().outputs())
            previous.put(c.name(), context.signals().get(SignalKey.of(runtime.path(), c.name())));
    }

    @Override
    public InstancePath path() {
        return runtime.path();
    }

    @Override
    public long step() {
        return step;
    }

    @Override
    public BoundParameters parameters() {
        return runtime.parameters();
    }

    @Override
    public Object input(String name) {
        if (runtime.block().input(name).isEmpty())
            throw new IllegalArgumentException(
                    runtime.block().typeName() + " has no input '" + name + "' (instance " + runtime.path() + ")");
        return context.signals().get(SignalKey.of(runtime.path(), name));
    }

    @Override
    public void setOutput(String name, Object value) {
        SignalKey key = SignalKey.of(runtime.path(), name);
        Connector c = runtime.block().output(name)
                .orElseThrow(() -> new InvalidSignalException(runtime.path(), step, key,
                        "Undeclared output '" + name + "' of " + runtime.block().typeName()));
        Object v;
        try {
            v = c.type().normalize(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidSignalException(runtime.path(), step, key, "Output '" + name + "': " + e.getMessage());
        }
        String problem = BlockEvaluator.admissionProblem(c, v, context.options());
        if (problem != null)
            throw new InvalidSignalException(runtime.path(), step, key, "Output '" + name + "': " + problem);
        context.signals().put(key, v, step);
    }

    @Override
    public Object previousOutput(String name) {
        if (!previous.containsKey(name))
            throw new IllegalArgumentException(
                    runtime.block().typeName() + " has no output '" + name + "' (instance " + runtime.path() + ")");
        return previous.get(name);
    }
}
