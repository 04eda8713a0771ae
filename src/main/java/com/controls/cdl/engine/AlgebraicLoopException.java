package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when instances of a composite depend on each other in a cycle. The
 * language has no implicit feedback, so such a model cannot be scheduled.
 */
public class AlgebraicLoopException extends IllegalStateException {
    private final List<List<InstancePath>> cycles;

    public AlgebraicLoopException(List<List<InstancePath>> cycles) {
        super(describe(cycles));
        this.cycles = List.copyOf(cycles);
    }

    /** Every detected cycle, each in dependency direction. */
    public List<List<InstancePath>> cycles() {
        return cycles;
    }

    /** The first cycle, starting at its earliest-declared instance. */
    public List<InstancePath> cycle() {
        return cycles.get(0);
    }

    /** Renders a cycle as {@code a -> b -> a}. */
    public static String render(List<InstancePath> cycle) {
        return cycle.stream().map(InstancePath::toString).collect(Collectors.joining(" -> "))
                + " -> " + cycle.get(0);
    }

    private static String describe(List<List<InstancePath>> cycles) {
        return "Algebraic loop detected: "
                + cycles.stream().map(AlgebraicLoopException::render).collect(Collectors.joining("; "));
    }
}
