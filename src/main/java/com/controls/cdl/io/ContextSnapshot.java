package com.controls.cdl.io;

import java.util.Arrays;

/**
 * Opaque captured state of an execution context: every bound signal at every
 * nesting depth, the step counters, and the instance-local state of stateful
 * implementations. The evaluation order is not part of it; a restored context
 * derives that again from the block definition.
 *
 * <p>
 * Immutable. {@link #toBytes()} and {@link #fromBytes(byte[])} move a snapshot
 * through storage or across processes.
 */
public final class ContextSnapshot {
    private final byte[] bytes;
    private final SnapshotDocument document;

    private ContextSnapshot(byte[] bytes, SnapshotDocument document) {
        this.bytes = bytes;
        this.document = document;
    }

    public static ContextSnapshot of(SnapshotDocument document) {
        return new ContextSnapshot(SnapshotCodec.encode(document), document);
    }

    /**
     * @throws IllegalArgumentException if the bytes do not hold a snapshot.
     */
    public static ContextSnapshot fromBytes(byte[] bytes) {
        byte[] copy = Arrays.copyOf(bytes, bytes.length);
        return new ContextSnapshot(copy, SnapshotCodec.decode(copy));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /** Decoded form, read again from the bytes so callers cannot alias it. */
    public SnapshotDocument document() {
        return SnapshotCodec.decode(bytes);
    }

    public String modelType() {
        return document.getModelType();
    }

    /** Completed steps of the root context when the snapshot was taken. */
    public long capturedStep() {
        Long s = document.getSteps().get(document.getRoot());
        return s == null ? 0 : s;
    }

    public int sizeBytes() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return "ContextSnapshot[" + document.getRoot() + " @ step " + capturedStep() + ", " + bytes.length
                + " bytes]";
    }
}
