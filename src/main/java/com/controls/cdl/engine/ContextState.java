package com.controls.cdl.engine;

/**
 * Lifecycle of an {@link ExecutionContext}.
 *
 * <pre>
 * UNVALIDATED --initialize()--> INITIALIZED --step()--> STEPPING --step()--> STEPPING
 *                                    |                     |
 *                                    +------ failure ------+--> FAULTED --reset()--> INITIALIZED
 * </pre>
 */
public enum ContextState {
    /** Constructed; nothing validated, bound or scheduled yet. */
    UNVALIDATED,
    /** Validated, scheduled, parameters bound, start values seeded. */
    INITIALIZED,
    /** At least one step completed. */
    STEPPING,
    /** A step failed; stepping is refused until reset. */
    FAULTED
}
