package com.vidnyan.j2py.domain.plan;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Ordered plan steps plus the unit summary.
 */
@Value(staticConstructor = "of")
public class MigrationPlan {
    List<PlanStep> steps;
    PlanSummary summary;

    public List<PlanStep> stepsFor(String className) {
        return steps.stream().filter(s -> s.getTargetClass().equals(className)).toList();
    }

    public Optional<PlanStep> step(String className, StepComponent component) {
        return steps.stream()
                .filter(s -> s.getTargetClass().equals(className) && s.getComponent() == component)
                .findFirst();
    }

    public List<String> allWarnings() {
        return steps.stream().flatMap(s -> s.getWarnings().stream()).toList();
    }
}
