package com.controls.cdl.util;

import com.controls.cdl.api.EvaluationListener;
import com.controls.cdl.model.InstancePath;

import java.util.Arrays;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Fans callbacks out to several {@link EvaluationListener}s, in the order they
 * were added. Iterates a plain array so the step loop allocates nothing.
 *
 * <p>
 * A delegate that throws is logged and skipped for that callback; the other
 * delegates still run and the step is not faulted by an observer.
 */
@Log4j2
public class CompositeEvaluationListener implements EvaluationListener {
    private volatile EvaluationListener[] listeners = new EvaluationListener[0];

    public synchronized CompositeEvaluationListener add(EvaluationListener listener) {
        Objects.requireNonNull(listener, "listener");
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    /** Removes the first occurrence of {@code listener}; returns false if absent. */
    public synchronized boolean remove(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                EvaluationListener[] next = new EvaluationListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStepStart(InstancePath context, long step) {
        for (EvaluationListener l : listeners) {
            try {
                l.onStepStart(context, step);
            } catch (RuntimeException e) {
                failed(l, "onStepStart", context, step, e);
            }
        }
    }

    @Override
    public void onInstanceEvaluated(long step, int orderIndex, InstancePath instance, long durationNanos) {
        for (EvaluationListener l : listeners) {
            try {
                l.onInstanceEvaluated(step, orderIndex, instance, durationNanos);
            } catch (RuntimeException e) {
                failed(l, "onInstanceEvaluated", instance, step, e);
            }
        }
    }

    @Override
    public void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error) {
        for (EvaluationListener l : listeners) {
            try {
                l.onInstanceError(step, orderIndex, instance, error);
            } catch (RuntimeException e) {
                failed(l, "onInstanceError", instance, step, e);
            }
        }
    }

    @Override
    public void onStepEnd(InstancePath context, long step, int evaluated, boolean completed) {
        for (EvaluationListener l : listeners) {
            try {
                l.onStepEnd(context, step, evaluated, completed);
            } catch (RuntimeException e) {
                failed(l, "onStepEnd", context, step, e);
            }
        }
    }

    private static void failed(EvaluationListener l, String callback, InstancePath at, long step, RuntimeException e) {
        log.warn("Listener {} failed in {} for {} at step {}", l.getClass().getName(), callback, at, step, e);
    }
}
