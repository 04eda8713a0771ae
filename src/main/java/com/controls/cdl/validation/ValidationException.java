package com.controls.cdl.validation;

/** Thrown when a model with validation errors is asked to initialize. */
public class ValidationException extends RuntimeException {
    private final ValidationReport report;

    public ValidationException(ValidationReport report) {
        super("Model validation failed with " + report);
        this.report = report;
    }

    /** The complete report, warnings included. */
    public ValidationReport report() {
        return report;
    }
}
