package com.controls.cdl.config;

import com.controls.cdl.model.DataType;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;

/**
 * Engine-wide settings shared by the validator and every execution context
 * built from them, including nested composite contexts.
 *
 * <p>
 * Defaults are strict: no cross-type connections, no non-finite reals, no
 * signal history.
 */
@Getter
@Builder(toBuilder = true)
public final class EngineOptions {

    /** Property keys understood by {@link #fromProperties(Map)}. */
    public static final String ALLOW_NON_FINITE = "cdl.allowNonFiniteReals";
    public static final String CONVERSIONS = "cdl.compatibleConversions";
    public static final String RECORD_HISTORY = "cdl.recordHistory";
    public static final String HISTORY_LIMIT = "cdl.historyLimit";
    public static final String EVENT_HISTORY_LIMIT = "cdl.eventHistoryLimit";

    private static final EngineOptions DEFAULTS = EngineOptions.builder().build();

    /** Whether Real signals may hold NaN or infinities. */
    @Builder.Default
    private final boolean allowNonFiniteReals = false;

    /**
     * Source-to-destination type pairs a connection may use besides identical
     * types. Each pair must be one {@link DataType#canConvertTo} supports.
     */
    @Builder.Default
    private final Set<Conversion> compatibleConversions = Set.of();

    /** Whether contexts keep a bounded per-signal value history. */
    @Builder.Default
    private final boolean recordHistory = false;

    /** Entries kept per signal when history is recorded. */
    @Builder.Default
    private final int historyLimit = 256;

    /** Lifecycle events kept per context. */
    @Builder.Default
    private final int eventHistoryLimit = 64;

    EngineOptions(boolean allowNonFiniteReals, Set<Conversion> compatibleConversions, boolean recordHistory,
            int historyLimit, int eventHistoryLimit) {
        if (historyLimit <= 0)
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        if (eventHistoryLimit <= 0)
            throw new IllegalArgumentException("eventHistoryLimit must be positive: " + eventHistoryLimit);
        this.allowNonFiniteReals = allowNonFiniteReals;
        this.compatibleConversions = Set.copyOf(compatibleConversions);
        this.recordHistory = recordHistory;
        this.historyLimit = historyLimit;
        this.eventHistoryLimit = eventHistoryLimit;
    }

    public static EngineOptions defaults() {
        return DEFAULTS;
    }

    /** True if a connection from {@code from} to {@code to} is permitted. */
    public boolean isCompatible(DataType from, DataType to) {
        return from == to || compatibleConversions.contains(new Conversion(from, to));
    }

    /**
     * Reads options from a flat property map. Missing keys keep their defaults;
     * unknown keys are ignored.
     *
     * @throws IllegalArgumentException on a malformed value.
     */
    public static EngineOptions fromProperties(Map<String, ?> props) {
        EngineOptionsBuilder b = EngineOptions.builder()
                .allowNonFiniteReals(getBoolean(props, ALLOW_NON_FINITE, DEFAULTS.allowNonFiniteReals))
                .recordHistory(getBoolean(props, RECORD_HISTORY, DEFAULTS.recordHistory))
                .historyLimit(getPositiveInt(props, HISTORY_LIMIT, DEFAULTS.historyLimit))
                .eventHistoryLimit(getPositiveInt(props, EVENT_HISTORY_LIMIT, DEFAULTS.eventHistoryLimit));
        Object conv = props.get(CONVERSIONS);
        if (conv != null && !conv.toString().isBlank()) {
            Set<Conversion> set = new LinkedHashSet<>();
            for (String part : conv.toString().split(","))
                set.add(Conversion.parse(part));
            b.compatibleConversions(set);
        }
        return b.build();
    }

    static boolean getBoolean(Map<String, ?> props, String key, boolean def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Boolean bool)
            return bool;
        String s = v.toString().strip();
        if (s.equalsIgnoreCase("true"))
            return true;
        if (s.equalsIgnoreCase("false"))
            return false;
        throw new IllegalArgumentException("Property " + key + " is not a boolean: " + v);
    }

    static int getPositiveInt(Map<String, ?> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        int i;
        try {
            i = v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + v, e);
        }
        if (i <= 0)
            throw new IllegalArgumentException("Property " + key + " must be positive: " + i);
        return i;
    }

    /** An explicitly allowed cross-type connection. */
    public record Conversion(DataType from, DataType to) {
        public Conversion {
            if (!from.canConvertTo(to) || from == to)
                throw new IllegalArgumentException(
                        "Unsupported conversion: " + from.cdlName() + " -> " + to.cdlName());
        }

        /** Parses {@code "INTEGER->REAL"}. */
        public static Conversion parse(String text) {
            String[] parts = text.split("->");
            if (parts.length != 2)
                throw new IllegalArgumentException("Malformed conversion: " + text);
            return new Conversion(DataType.fromString(parts[0].strip()), DataType.fromString(parts[1].strip()));
        }
    }
}
