package com.controls.cdl.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a context snapshot.
 *
 * <p>
 * Signals are grouped by the context that owns them: the root context and one
 * nested context per composite instance, each named by its root instance
 * path. A composite instance's own connectors appear twice, once in the
 * enclosing context and once on the boundary of its nested context.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SnapshotDocument {
    public static final int FORMAT_VERSION = 1;

    private int formatVersion = FORMAT_VERSION;
    private String modelType;
    private String root;
    /** Completed steps per context path. */
    private Map<String, Long> steps = new LinkedHashMap<>();
    private List<SignalEntry> signals = new ArrayList<>();
    /** Instance-local state of stateful implementations, by instance path. */
    private Map<String, Map<String, Object>> instanceStates = new LinkedHashMap<>();

    /** One bound signal. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class SignalEntry {
        private String context;
        private String instance;
        private String connector;
        private String type;
        private Object value;
    }
}
