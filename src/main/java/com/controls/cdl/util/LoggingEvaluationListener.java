package com.controls.cdl.util;

import com.controls.cdl.api.EvaluationListener;
import com.controls.cdl.model.InstancePath;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes the step cycle to the log: step boundaries at debug, each instance
 * at trace, failures at warn.
 */
public class LoggingEvaluationListener implements EvaluationListener {
    private static final Logger log = LogManager.getLogger(LoggingEvaluationListener.class);

    @Override
    public void onStepStart(InstancePath context, long step) {
        log.debug("[{}] step {} started", context, step);
    }

    @Override
    public void onInstanceEvaluated(long step, int orderIndex, InstancePath instance, long durationNanos) {
        if (log.isTraceEnabled())
            log.trace("[step {}] #{} {} evaluated in {} ns", step, orderIndex, instance, durationNanos);
    }

    @Override
    public void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error) {
        log.warn("[step {}] #{} {} failed: {}", step, orderIndex, instance, error.getMessage());
    }

    @Override
    public void onStepEnd(InstancePath context, long step, int evaluated, boolean completed) {
        log.debug("[{}] step {} {} after {} instance(s)", context, step, completed ? "completed" : "aborted",
                evaluated);
    }
}
