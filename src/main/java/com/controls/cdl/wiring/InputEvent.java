package com.controls.cdl.wiring;

/**
 * A mutable holder for one external input value, pre-allocated in the ring
 * buffer and reused for the lifetime of the driver.
 *
 * <ul>
 * <li>{@code instance}: root instance path, or null for the context's root</li>
 * <li>{@code connector}: name of the root input to set</li>
 * <li>{@code value}: the new value</li>
 * <li>{@code batchEnd}: forces a step after this event</li>
 * </ul>
 */
public final class InputEvent {
    private String instance;
    private String connector;
    private Object value;
    private boolean batchEnd;
    private long sequenceId;

    public void set(String instance, String connector, Object value, boolean batchEnd, long seqId) {
        this.instance = instance;
        this.connector = connector;
        this.value = value;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public String instance() {
        return instance;
    }

    public String connector() {
        return connector;
    }

    public Object value() {
        return value;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    /** Drops references so a consumed value can be collected. */
    public void clear() {
        instance = null;
        connector = null;
        value = null;
        batchEnd = false;
        sequenceId = 0;
    }

    @Override
    public String toString() {
        return "InputEvent[" + (instance == null ? "" : instance + ".") + connector + " = " + value
                + (batchEnd ? ", batchEnd" : "") + "]";
    }
}
