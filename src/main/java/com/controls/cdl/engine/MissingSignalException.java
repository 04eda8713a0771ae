package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;

/**
 * A signal was required but has no value. The engine never substitutes a
 * default for it.
 */
public class MissingSignalException extends EvaluationException {
    private final SignalKey signal;

    public MissingSignalException(InstancePath instance, long step, SignalKey signal) {
        super(instance, step, "No value bound for " + signal);
        this.signal = signal;
    }

    public SignalKey signal() {
        return signal;
    }
}
