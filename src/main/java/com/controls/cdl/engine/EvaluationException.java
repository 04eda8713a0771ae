package com.controls.cdl.engine;

import com.controls.cdl.model.InstancePath;

/**
 * A step failed while evaluating one instance. The context that was stepping
 * is faulted.
 *
 * <p>
 * When an elementary implementation throws, its exception is this exception's
 * cause, untouched. The instance path and step number say where and when.
 */
public class EvaluationException extends RuntimeException {
    private final InstancePath instance;
    private final long step;

    public EvaluationException(InstancePath instance, long step, String message, Throwable cause) {
        super("Step " + step + ", instance " + instance + ": " + message, cause);
        this.instance = instance;
        this.step = step;
    }

    public EvaluationException(InstancePath instance, long step, String message) {
        this(instance, step, message, null);
    }

    /** Qualified path of the instance that failed. */
    public InstancePath instance() {
        return instance;
    }

    /** The step being evaluated when the failure occurred. */
    public long step() {
        return step;
    }
}
