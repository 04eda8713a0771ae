package com.controls.cdl.engine;

/**
 * One recorded value of a signal.
 *
 * @param step  the step that wrote it; inputs set between steps carry the
 *              number of the upcoming step, start values carry 0
 * @param value canonical value
 */
public record SignalSample(long step, Object value) {
}
