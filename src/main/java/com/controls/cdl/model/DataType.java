package com.controls.cdl.model;

/**
 * The value types a connector or parameter can carry.
 *
 * <p>
 * Every signal held by the engine is stored in its canonical Java
 * representation:
 * <ul>
 * <li>{@link #REAL} as {@link Double}</li>
 * <li>{@link #INTEGER} as {@link Integer}</li>
 * <li>{@link #BOOLEAN} as {@link Boolean}</li>
 * <li>{@link #STRING} and {@link #ENUMERATION} as {@link String}</li>
 * </ul>
 *
 * <p>
 * {@link #normalize(Object)} maps an accepted value to that representation and
 * rejects everything else. There is no implicit coercion between types; the
 * only cross-type transfers are the ones {@link #convert(Object, DataType)}
 * supports, and the validator only lets a connection use them when they are
 * explicitly enabled.
 */
public enum DataType {
    REAL("Real"),
    INTEGER("Integer"),
    BOOLEAN("Boolean"),
    STRING("String"),
    ENUMERATION("Enumeration");

    private final String cdlName;

    DataType(String cdlName) {
        this.cdlName = cdlName;
    }

    /** The name the type carries in the modeling language. */
    public String cdlName() {
        return cdlName;
    }

    /**
     * Returns {@code value} in this type's canonical representation.
     *
     * @throws IllegalArgumentException if the value does not belong to this type.
     */
    public Object normalize(Object value) {
        if (value == null)
            throw new IllegalArgumentException("Null is not a " + cdlName + " value");
        switch (this) {
            case REAL:
                if (value instanceof Double d)
                    return d;
                if (value instanceof Float f)
                    return f.doubleValue();
                if (value instanceof Integer || value instanceof Long || value instanceof Short
                        || value instanceof Byte)
                    return ((Number) value).doubleValue();
                break;
            case INTEGER:
                if (value instanceof Integer i)
                    return i;
                if (value instanceof Short || value instanceof Byte)
                    return ((Number) value).intValue();
                if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
                    return l.intValue();
                break;
            case BOOLEAN:
                if (value instanceof Boolean)
                    return value;
                break;
            case STRING:
            case ENUMERATION:
                if (value instanceof String)
                    return value;
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Type mismatch: expected " + cdlName + ", got "
                + value.getClass().getSimpleName() + " (" + value + ")");
    }

    /** True if {@code value} normalizes to this type without error. */
    public boolean accepts(Object value) {
        try {
            normalize(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** True if a value of this type can be transferred to {@code target}. */
    public boolean canConvertTo(DataType target) {
        return this == target
                || (this == INTEGER && target == REAL)
                || (this == ENUMERATION && target == STRING);
    }

    /**
     * Transfers a canonical value of this type to {@code target}.
     *
     * @throws IllegalArgumentException if the pair is not convertible.
     */
    public Object convert(Object value, DataType target) {
        if (this == target)
            return normalize(value);
        if (!canConvertTo(target))
            throw new IllegalArgumentException("No conversion from " + cdlName + " to " + target.cdlName);
        if (this == INTEGER)
            return ((Integer) normalize(value)).doubleValue();
        return normalize(value);
    }

    /** Looks a type up by enum name or modeling-language name, ignoring case. */
    public static DataType fromString(String text) {
        for (DataType t : values()) {
            if (t.name().equalsIgnoreCase(text) || t.cdlName.equalsIgnoreCase(text))
                return t;
        }
        throw new IllegalArgumentException("Unknown DataType: " + text);
    }
}
