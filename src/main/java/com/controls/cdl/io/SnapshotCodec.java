package com.controls.cdl.io;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of {@link SnapshotDocument}. Non-finite reals are written as
 * the strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
 */
public final class SnapshotCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private SnapshotCodec() {
        // Utility class
    }

    public static byte[] encode(SnapshotDocument doc) {
        try {
            return MAPPER.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode snapshot of " + doc.getRoot(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a snapshot this
     *                                  version can read.
     */
    public static SnapshotDocument decode(byte[] bytes) {
        SnapshotDocument doc;
        try {
            doc = MAPPER.readValue(bytes, SnapshotDocument.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed snapshot: " + e.getMessage(), e);
        }
        if (doc == null || doc.getRoot() == null || doc.getModelType() == null)
            throw new IllegalArgumentException("Malformed snapshot: missing model type or root");
        if (doc.getFormatVersion() != SnapshotDocument.FORMAT_VERSION)
            throw new IllegalArgumentException("Unsupported snapshot format version " + doc.getFormatVersion());
        return doc;
    }
}
