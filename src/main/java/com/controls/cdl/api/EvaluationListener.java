package com.controls.cdl.api;

import com.controls.cdl.model.InstancePath;

/**
 * Observability hook for the step cycle of an execution context.
 *
 * <p>
 * Nested composite contexts report through the same listener, so callbacks
 * for a composite's children arrive between that composite's own
 * {@code onStepStart} and {@code onStepEnd}, each tagged with its owning
 * context's root path.
 *
 * <p>
 * Callbacks run on the stepping thread inside the evaluation loop and must be
 * cheap.
 */
public interface EvaluationListener {

    /**
     * Called before the first instance of a step is evaluated.
     *
     * @param context root path of the context that is stepping
     * @param step    the step number being evaluated (completed steps + 1)
     */
    void onStepStart(InstancePath context, long step);

    /**
     * Called after an instance evaluated successfully.
     *
     * @param step          step number
     * @param orderIndex    the instance's position in the evaluation order
     * @param instance      qualified path of the instance
     * @param durationNanos wall time spent evaluating it
     */
    void onInstanceEvaluated(long step, int orderIndex, InstancePath instance, long durationNanos);

    /** Called when an instance fails; the step is aborted right after. */
    void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error);

    /**
     * Called when a step finishes, successfully or not.
     *
     * @param evaluated number of instances evaluated in this step
     * @param completed whether the step completed and the counter advanced
     */
    void onStepEnd(InstancePath context, long step, int evaluated, boolean completed);
}
