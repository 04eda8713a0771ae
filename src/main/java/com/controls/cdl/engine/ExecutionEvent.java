package com.controls.cdl.engine;

import java.time.Instant;

/**
 * A lifecycle event of one context, kept in its bounded event history.
 *
 * @param type   what happened
 * @param step   the context's completed-step count at the time
 * @param at     wall-clock time the event began
 * @param detail free-form detail, such as the signal an input change targeted
 */
public record ExecutionEvent(Type type, long step, Instant at, String detail) {

    public static ExecutionEvent of(Type type, long step, String detail) {
        return new ExecutionEvent(type, step, Instant.now(), detail);
    }

    /** Kinds of events a context records. */
    public enum Type {
        INITIALIZE,
        INPUT_CHANGE,
        STEP,
        RESET,
        RESTORE
    }
}
