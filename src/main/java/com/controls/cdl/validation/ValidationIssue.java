package com.controls.cdl.validation;

/**
 * One finding of the validator.
 *
 * @param severity whether it blocks initialization
 * @param message  what is wrong, naming the offending elements
 * @param location qualified instance path, optionally followed by a connector,
 *                 or the members of a cycle
 * @param rule     the rule that produced it
 */
public record ValidationIssue(Severity severity, String message, String location, ValidationRule rule) {

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + rule + "] " + location + ": " + message;
    }
}
