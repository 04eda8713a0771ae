package com.controls.cdl.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Every finding of one validation run, in the order the validator found them.
 * A model is valid when the report holds no errors; warnings do not count.
 */
public final class ValidationReport {
    private final List<ValidationIssue> issues;

    private ValidationReport(List<ValidationIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).collect(Collectors.toList());
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).collect(Collectors.toList());
    }

    /** Findings of one rule. */
    public List<ValidationIssue> issues(ValidationRule rule) {
        return issues.stream().filter(i -> i.rule() == rule).collect(Collectors.toList());
    }

    public boolean has(ValidationRule rule) {
        return issues.stream().anyMatch(i -> i.rule() == rule);
    }

    @Override
    public String toString() {
        if (issues.isEmpty())
            return "Validation passed";
        StringBuilder sb = new StringBuilder(64 * issues.size());
        sb.append(errors().size()).append(" error(s), ").append(warnings().size()).append(" warning(s)");
        for (ValidationIssue i : issues)
            sb.append("\n  ").append(i);
        return sb.toString();
    }

    /** Collects findings; the validator never stops at the first one. */
    public static final class Builder {
        private final List<ValidationIssue> issues = new ArrayList<>();

        private Builder() {
        }

        public Builder error(ValidationRule rule, String location, String message) {
            issues.add(new ValidationIssue(Severity.ERROR, message, location, rule));
            return this;
        }

        public Builder warning(ValidationRule rule, String location, String message) {
            issues.add(new ValidationIssue(Severity.WARNING, message, location, rule));
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(issues);
        }
    }
}
