package com.controls.cdl.api;

import java.util.Map;

/**
 * Implemented by elementary functions that keep state across steps (an
 * accumulator, a hysteresis latch, a timer).
 *
 * <p>
 * Context snapshots capture this state per instance path and hand it back
 * after restoring. Values must be JSON-compatible: numbers, booleans, strings,
 * lists and maps of those. Numbers may come back as a different
 * {@link Number} subtype, so implementations should read them through
 * {@link Number}.
 */
public interface Snapshotable {

    /** Returns a copy of the instance-local state. */
    Map<String, Object> snapshotState();

    /** Replaces the instance-local state with a previously captured one. */
    void restoreState(Map<String, Object> state);
}
