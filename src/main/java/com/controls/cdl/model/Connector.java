package com.controls.cdl.model;

import java.util.List;
import java.util.Objects;

/**
 * A typed, named terminal of a block.
 *
 * <p>
 * Unit, quantity and the {@code min}/{@code max}/{@code nominal} bounds are
 * metadata checked by the validator; they never influence evaluation order or
 * values. {@code start} is the value seeded into the signal table when a
 * context is initialized. Enumeration connectors may list their allowed
 * literals.
 */
public final class Connector {
    private final String name;
    private final DataType type;
    private final Causality causality;
    private final String unit;
    private final String quantity;
    private final Double min;
    private final Double max;
    private final Double nominal;
    private final Object start;
    private final List<String> allowedValues;
    private final String description;

    private Connector(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.causality = b.causality;
        this.unit = b.unit;
        this.quantity = b.quantity;
        this.min = b.min;
        this.max = b.max;
        this.nominal = b.nominal;
        this.start = b.start;
        this.allowedValues = List.copyOf(b.allowedValues);
        this.description = b.description;
    }

    public static Builder input(String name, DataType type) {
        return new Builder(name, type, Causality.INPUT);
    }

    public static Builder output(String name, DataType type) {
        return new Builder(name, type, Causality.OUTPUT);
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public Causality causality() {
        return causality;
    }

    public boolean isInput() {
        return causality == Causality.INPUT;
    }

    public boolean isOutput() {
        return causality == Causality.OUTPUT;
    }

    public String unit() {
        return unit;
    }

    public String quantity() {
        return quantity;
    }

    public Double min() {
        return min;
    }

    public Double max() {
        return max;
    }

    public Double nominal() {
        return nominal;
    }

    /** The declared start value exactly as given, or null. */
    public Object start() {
        return start;
    }

    public boolean hasStart() {
        return start != null;
    }

    public List<String> allowedValues() {
        return allowedValues;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return causality.name().toLowerCase() + " " + type.cdlName() + " " + name;
    }

    public static final class Builder {
        private final String name;
        private final DataType type;
        private final Causality causality;
        private String unit, quantity, description;
        private Double min, max, nominal;
        private Object start;
        private List<String> allowedValues = List.of();

        private Builder(String name, DataType type, Causality causality) {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("Connector name cannot be empty");
            this.name = name.strip();
            this.type = Objects.requireNonNull(type, "type");
            this.causality = causality;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder quantity(String quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder nominal(double nominal) {
            this.nominal = nominal;
            return this;
        }

        public Builder start(Object start) {
            this.start = start;
            return this;
        }

        public Builder allowedValues(String... literals) {
            this.allowedValues = List.of(literals);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Connector build() {
            return new Connector(this);
        }
    }
}
