package com.controls.cdl.engine;

import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.DataType;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.Parameter;
import com.controls.cdl.model.ParentParameter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The concrete parameter values of one block instance, fixed for the
 * instance's lifetime. Values are held in their canonical representation (see
 * {@link DataType}).
 */
public final class BoundParameters {
    private static final BoundParameters EMPTY = new BoundParameters(Map.of(), Map.of());

    private final Map<String, Object> values;
    private final Map<String, DataType> types;

    private BoundParameters(Map<String, Object> values, Map<String, DataType> types) {
        this.values = values;
        this.types = types;
    }

    public static BoundParameters empty() {
        return EMPTY;
    }

    /**
     * Binds an instance's parameters: the definition's default, replaced by the
     * instance override if present. {@link ParentParameter} overrides resolve
     * against {@code enclosing}.
     *
     * @throws IllegalArgumentException if a required parameter is unbound, an
     *                                  override names an unknown parameter, or a
     *                                  value violates the declared type or
     *                                  bounds. The validator reports all of these
     *                                  before a context gets this far.
     */
    public static BoundParameters bind(InstancePath path, BlockInstance instance, BoundParameters enclosing) {
        Block block = instance.block();
        for (String name : instance.overrides().keySet()) {
            if (block.parameter(name).isEmpty())
                throw new IllegalArgumentException(
                        "Unknown parameter '" + name + "' overridden on " + path);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, DataType> types = new LinkedHashMap<>();
        for (Parameter p : block.parameters()) {
            Object raw = instance.overrides().containsKey(p.name())
                    ? instance.overrides().get(p.name())
                    : p.defaultValue();
            if (raw instanceof ParentParameter ref) {
                if (enclosing == null || !enclosing.contains(ref.name()))
                    throw new IllegalArgumentException("Parameter '" + p.name() + "' of " + path
                            + " refers to unknown enclosing parameter '" + ref.name() + "'");
                raw = enclosing.get(ref.name());
            }
            if (raw == null)
                throw new IllegalArgumentException("Parameter '" + p.name() + "' of " + path + " has no value");
            String problem = p.check(raw);
            if (problem != null)
                throw new IllegalArgumentException(problem + " on " + path);
            values.put(p.name(), p.type().normalize(raw));
            types.put(p.name(), p.type());
        }
        return new BoundParameters(Collections.unmodifiableMap(values), Collections.unmodifiableMap(types));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        Object v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return v;
    }

    public DataType type(String name) {
        DataType t = types.get(name);
        if (t == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return t;
    }

    public double real(String name) {
        return (Double) typed(name, DataType.REAL);
    }

    public int integer(String name) {
        return (Integer) typed(name, DataType.INTEGER);
    }

    public boolean bool(String name) {
        return (Boolean) typed(name, DataType.BOOLEAN);
    }

    public String string(String name) {
        DataType t = type(name);
        if (t != DataType.STRING && t != DataType.ENUMERATION)
            throw new IllegalArgumentException("Parameter '" + name + "' is " + t.cdlName() + ", not String");
        return (String) values.get(name);
    }

    private Object typed(String name, DataType expected) {
        DataType t = type(name);
        if (t != expected)
            throw new IllegalArgumentException(
                    "Parameter '" + name + "' is " + t.cdlName() + ", not " + expected.cdlName());
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
