package com.controls.cdl.engine;

import com.controls.cdl.model.SignalKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current signal values of one context, keyed by instance path and connector.
 * Values are canonical and persist across steps until overwritten. Insertion
 * order is kept so snapshots and diagnostics list signals reproducibly.
 */
final class SignalTable {
    private final Map<SignalKey, Object> values = new LinkedHashMap<>();
    private final SignalHistory history;

    /** @param history where writes are also recorded, or null */
    SignalTable(SignalHistory history) {
        this.history = history;
    }

    /** The bound value, or null. */
    Object get(SignalKey key) {
        return values.get(key);
    }

    boolean isBound(SignalKey key) {
        return values.containsKey(key);
    }

    void put(SignalKey key, Object value, long step) {
        values.put(key, value);
        if (history != null)
            history.record(key, step, value);
    }

    SignalHistory history() {
        return history;
    }

    Map<SignalKey, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    void clear() {
        values.clear();
        if (history != null)
            history.clear();
    }
}
