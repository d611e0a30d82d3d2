package com.vidnyan.j2py.domain.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One ordered unit of migration work.
 * Immutable value object.
 */
@Value
@Builder
public class PlanStep {
    int id;
    String targetClass;
    StepComponent component;
    String description;
    Complexity complexity;
    int score;
    @Singular("dependency")
    Set<Integer> dependsOn;
    @Singular
    List<String> warnings;
}
