package com.controls.cdl.model;

import java.util.Objects;

/**
 * A named constant of a block, fixed for the lifetime of an instance.
 *
 * <p>
 * A parameter without a default value is required: every instance of the
 * block must supply it as an override.
 */
public final class Parameter {
    private final String name;
    private final DataType type;
    private final Object defaultValue;
    private final Double min;
    private final Double max;
    private final String unit;
    private final String description;

    private Parameter(String name, DataType type, Object defaultValue, Double min, Double max, String unit,
            String description) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Parameter name cannot be empty");
        this.name = name.strip();
        this.type = Objects.requireNonNull(type, "type");
        this.defaultValue = defaultValue;
        this.min = min;
        this.max = max;
        this.unit = unit;
        this.description = description;
    }

    /** A parameter with a default value. */
    public static Parameter of(String name, DataType type, Object defaultValue) {
        return new Parameter(name, type, defaultValue, null, null, null, null);
    }

    /** A parameter that each instance must override. */
    public static Parameter required(String name, DataType type) {
        return new Parameter(name, type, null, null, null, null, null);
    }

    public Parameter withBounds(Double min, Double max) {
        return new Parameter(name, type, defaultValue, min, max, unit, description);
    }

    public Parameter withUnit(String unit) {
        return new Parameter(name, type, defaultValue, min, max, unit, description);
    }

    public Parameter withDescription(String description) {
        return new Parameter(name, type, defaultValue, min, max, unit, description);
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Double min() {
        return min;
    }

    public Double max() {
        return max;
    }

    public String unit() {
        return unit;
    }

    public String description() {
        return description;
    }

    /**
     * Checks a candidate value against the declared type and bounds.
     *
     * @return null if acceptable, otherwise a message describing the problem.
     */
    public String check(Object value) {
        Object v;
        try {
            v = type.normalize(value);
        } catch (IllegalArgumentException e) {
            return "Parameter '" + name + "': " + e.getMessage();
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (min != null && d < min)
                return "Parameter '" + name + "' value " + v + " is less than minimum " + min;
            if (max != null && d > max)
                return "Parameter '" + name + "' value " + v + " is greater than maximum " + max;
        }
        return null;
    }

    @Override
    public String toString() {
        return "parameter " + type.cdlName() + " " + name + (hasDefault() ? " = " + defaultValue : "");
    }
}
