package com.controls.cdl.engine;

import com.controls.cdl.config.EngineOptions;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluates one instance against the signal table of the context that
 * schedules it.
 *
 * <ol>
 * <li>Pull: copy the value behind every connection that feeds the instance's
 * inputs. An unbound source is a {@link MissingSignalException}; the engine
 * never substitutes a default.</li>
 * <li>Check: every declared input must now hold a value. Inputs of a root
 * instance are set by the caller or seeded from their start value.</li>
 * <li>Compute: an elementary instance runs its function, which writes outputs
 * directly into the table. A composite instance hands its inputs to its
 * nested context, steps that context once, and copies the nested boundary
 * outputs back.</li>
 * </ol>
 *
 * An exception thrown by an implementation is wrapped exactly once in an
 * {@link EvaluationException} carrying the instance path and step, with the
 * original as cause. An {@code EvaluationException} raised inside a nested
 * context passes through untouched, so the innermost failing instance is the
 * one reported.
 */
@Log4j2
final class BlockEvaluator {

    void evaluate(InstanceRuntime rt, ExecutionContext ctx, long step) {
        SignalTable signals = ctx.signals();

        // 1. Pull wired inputs
        for (SignalTransfer t : rt.inbound()) {
            Object v = signals.get(t.source());
            if (v == null)
                throw new MissingSignalException(rt.path(), step, t.source());
            signals.put(t.destination(), t.transfer(v), step);
        }

        // 2. All inputs bound
        for (Connector c : rt.block().inputs()) {
            SignalKey key = SignalKey.of(rt.path(), c.name());
            if (!signals.isBound(key))
                throw new MissingSignalException(rt.path(), step, key);
        }

        // 3. Compute
        if (rt.isComposite())
            evaluateComposite(rt, signals, step);
        else
            evaluateElementary(rt, ctx, step);

        if (log.isTraceEnabled())
            log.trace("Step {}: evaluated {}", step, rt);
    }

    private void evaluateElementary(InstanceRuntime rt, ExecutionContext ctx, long step) {
        try {
            rt.function().evaluate(new ElementaryInvocation(rt, ctx, step));
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(rt.path(), step,
                    rt.block().typeName() + " raised " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private void evaluateComposite(InstanceRuntime rt, SignalTable signals, long step) {
        ExecutionContext nested = rt.nested();
        SignalTable inner = nested.signals();
        for (Connector c : rt.block().inputs()) {
            SignalKey key = SignalKey.of(rt.path(), c.name());
            inner.put(key, signals.get(key), step);
        }
        try {
            nested.runStep();
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(rt.path(), step, "Nested evaluation failed: " + e.getMessage(), e);
        }
        for (Connector c : rt.block().outputs()) {
            SignalKey key = SignalKey.of(rt.path(), c.name());
            Object v = inner.get(key);
            if (v == null)
                throw new MissingSignalException(rt.path(), step, key);
            signals.put(key, v, step);
        }
    }

    /** Copies child outputs to the outputs of the composite that owns them. */
    void publishOutputs(InstancePath owner, List<SignalTransfer> transfers, SignalTable signals, long step) {
        for (SignalTransfer t : transfers) {
            Object v = signals.get(t.source());
            if (v == null)
                throw new MissingSignalException(owner, step, t.source());
            signals.put(t.destination(), t.transfer(v), step);
        }
    }

    /**
     * Checks a canonical value against the connector's constraints that are
     * enforced at runtime.
     *
     * @return null if admissible, otherwise the reason it is not
     */
    static String admissionProblem(Connector c, Object canonical, EngineOptions options) {
        if (canonical instanceof Double d && !Double.isFinite(d) && !options.isAllowNonFiniteReals())
            return "non-finite value " + d + " is not allowed";
        if (!c.allowedValues().isEmpty() && !c.allowedValues().contains(canonical))
            return "'" + canonical + "' is not one of " + c.allowedValues();
        return null;
    }
}
