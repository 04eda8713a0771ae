package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;

/**
 * An implementation produced a value the engine cannot store: the wrong type,
 * an undeclared output, or a non-finite real where those are disallowed.
 */
public class InvalidSignalException extends EvaluationException {
    private final SignalKey signal;

    public InvalidSignalException(InstancePath instance, long step, SignalKey signal, String message) {
        super(instance, step, message);
        this.signal = signal;
    }

    public SignalKey signal() {
        return signal;
    }
}
