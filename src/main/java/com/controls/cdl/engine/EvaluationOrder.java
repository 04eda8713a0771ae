package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The sequential evaluation order of one context: every instance appears
 * strictly after all instances that feed one of its inputs.
 *
 * <p>
 * Immutable. Computed once per context and never recomputed while stepping.
 */
public final class EvaluationOrder {
    private final List<InstancePath> order;
    private final Map<InstancePath, Integer> position;

    EvaluationOrder(List<InstancePath> order) {
        this.order = List.copyOf(order);
        this.position = new HashMap<>(order.size() * 2);
        for (int i = 0; i < this.order.size(); i++)
            position.put(this.order.get(i), i);
    }

    public int size() {
        return order.size();
    }

    public InstancePath get(int index) {
        return order.get(index);
    }

    public List<InstancePath> paths() {
        return order;
    }

    /** Position of an instance in the order. */
    public int positionOf(InstancePath path) {
        Integer p = position.get(path);
        if (p == null)
            throw new IllegalArgumentException("Instance not in evaluation order: " + path);
        return p;
    }

    public boolean contains(InstancePath path) {
        return position.containsKey(path);
    }

    @Override
    public String toString() {
        return order.toString();
    }
}
