package com.controls.cdl.util;

import com.controls.cdl.engine.DependencyGraph;
import com.controls.cdl.engine.EvaluationOrder;
import com.controls.cdl.engine.ExecutionContext;
import com.controls.cdl.engine.ExecutionEvent;
import com.controls.cdl.model.Block;
import com.controls.cdl.model.Connection;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Diagnostic utility for inspecting an initialized context.
 *
 * <p>
 * Generates human-readable views of the cached evaluation order, the wiring
 * and the current signal values. Intended for debugging sessions and error
 * reports. Do <b>not</b> use inside the step loop (allocates strings, walks
 * every nested context).
 */
public final class ContextExplain {
    private final ExecutionContext context;

    public ContextExplain(ExecutionContext context) {
        this.context = context;
    }

    /** Dumps type, parameters and every connector value of one instance. */
    public String explainInstance(InstancePath instance) {
        Block block = context.blockAt(instance);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Instance: ").append(instance).append('\n')
                .append("  Type: ").append(block.typeName()).append(" (").append(block.kind()).append(")\n")
                .append("  Parameters: ").append(context.parameters(instance)).append('\n');
        for (Connector c : block.inputs())
            appendConnector(sb, instance, c);
        for (Connector c : block.outputs())
            appendConnector(sb, instance, c);
        return sb.toString();
    }

    private void appendConnector(StringBuilder sb, InstancePath instance, Connector c) {
        Optional<Object> v = context.findSignal(instance, c.name());
        sb.append("  ").append(c).append(" = ").append(v.isPresent() ? v.get() : "<unbound>").append('\n');
    }

    /** Summary of the lifecycle position. */
    public String explainState() {
        StringBuilder sb = new StringBuilder(128);
        sb.append("Context: ").append(context.rootPath()).append(", state ").append(context.state())
                .append(", completed steps ").append(context.stepCount());
        if (context.fault() != null)
            sb.append("\n  Fault: ").append(context.fault().getMessage());
        List<ExecutionEvent> events = context.events();
        if (!events.isEmpty())
            sb.append("\n  Last event: ").append(events.get(events.size() - 1));
        return sb.toString();
    }

    /**
     * Dumps the evaluation order of the root and, indented, of every nested
     * composite, with the instances each one feeds.
     */
    public String dumpOrder() {
        StringBuilder sb = new StringBuilder(1024);
        appendOrder(sb, context, "");
        return sb.toString();
    }

    private void appendOrder(StringBuilder sb, ExecutionContext ctx, String indent) {
        EvaluationOrder order = ctx.evaluationOrder();
        Optional<DependencyGraph> graph = ctx.dependencyGraph();
        sb.append(indent).append(ctx.rootPath()).append(" (").append(order.size()).append(" instances):\n");
        for (int i = 0; i < order.size(); i++) {
            InstancePath p = order.get(i);
            sb.append(indent).append("  [").append(i).append("] ").append(p.name())
                    .append(" : ").append(ctx.blockAt(p).typeName());
            if (graph.isPresent()) {
                DependencyGraph g = graph.get();
                List<Integer> succ = g.successors(g.indexOf(p));
                if (!succ.isEmpty()) {
                    sb.append(" -> ");
                    for (int j = 0; j < succ.size(); j++) {
                        sb.append(g.node(succ.get(j)).name());
                        if (j < succ.size() - 1)
                            sb.append(", ");
                    }
                }
            }
            sb.append('\n');
            Optional<ExecutionContext> inner = ctx.nested(p.name());
            if (inner.isPresent())
                appendOrder(sb, inner.get(), indent + "    ");
        }
    }

    /** Dumps every bound signal, the root's first, then each nested context's. */
    public String dumpSignals() {
        StringBuilder sb = new StringBuilder(1024);
        appendSignals(sb, context);
        return sb.toString();
    }

    private void appendSignals(StringBuilder sb, ExecutionContext ctx) {
        for (Map.Entry<SignalKey, Object> e : ctx.signalValues().entrySet())
            sb.append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        for (InstancePath p : ctx.evaluationOrder().paths()) {
            Optional<ExecutionContext> inner = ctx.nested(p.name());
            if (inner.isPresent())
                appendSignals(sb, inner.get());
        }
    }

    /** Generates a Mermaid diagram of the root composite's wiring. */
    public String toMermaid() {
        Block block = context.block();
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph LR;\n");
        for (Connector c : block.inputs())
            sb.append("  in_").append(c.name()).append("([\"").append(c.name()).append("\"]);\n");
        for (InstancePath p : context.evaluationOrder().paths()) {
            if (p.equals(context.rootPath()))
                continue;
            sb.append("  ").append(p.name()).append("[\"").append(p.name()).append("<br/>")
                    .append(context.blockAt(p).simpleName()).append("\"];\n");
        }
        for (Connector c : block.outputs())
            sb.append("  out_").append(c.name()).append("([\"").append(c.name()).append("\"]);\n");
        for (Connection c : block.connections()) {
            String from = c.from().isBoundary() ? "in_" + c.from().connector() : c.from().instance();
            String to = c.to().isBoundary() ? "out_" + c.to().connector() : c.to().instance();
            sb.append("  ").append(from).append(" -->|").append(c.from().connector()).append(" to ")
                    .append(c.to().connector()).append("| ").append(to).append(";\n");
        }
        return sb.toString();
    }
}
