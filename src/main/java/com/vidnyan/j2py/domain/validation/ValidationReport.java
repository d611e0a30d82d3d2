package com.vidnyan.j2py.domain.validation;

import lombok.Value;

import java.util.List;

/**
 * Outcome of validating generated text against the mapped IR.
 * Passed iff no issue has ERROR severity.
 */
@Value
public class ValidationReport {
    boolean passed;
    List<Issue> issues;

    public static ValidationReport of(List<Issue> issues) {
        return new ValidationReport(issues.stream().noneMatch(Issue::isError), List.copyOf(issues));
    }

    public List<Issue> errors() {
        return issues.stream().filter(Issue::isError).toList();
    }

    public List<Issue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }
}
