package com.controls.cdl.api;

/**
 * The behavior of one elementary block type.
 *
 * <p>
 * Called once per step for each instance, in evaluation order. The function
 * reads bound parameters and current input values from the invocation and
 * writes every output it is responsible for through
 * {@link BlockInvocation#setOutput(String, Object)}.
 *
 * <p>
 * Any exception thrown aborts the current step and faults the context; the
 * engine never substitutes defaults on the function's behalf.
 */
@FunctionalInterface
public interface ElementaryFunction {
    void evaluate(BlockInvocation invocation);
}
