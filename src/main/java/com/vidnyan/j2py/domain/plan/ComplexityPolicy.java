package com.vidnyan.j2py.domain.plan;

import lombok.Builder;
import lombok.Value;

/**
 * Weights and thresholds used to score plan steps. Policy data, not algorithm:
 * bound from configuration, with {@link #defaults()} as the baseline.
 */
@Value
@Builder(toBuilder = true)
public class ComplexityPolicy {
    @Builder.Default
    int methodWeight = 1;
    @Builder.Default
    int fieldWeight = 1;
    @Builder.Default
    int constructorWeight = 2;
    @Builder.Default
    int inheritanceWeight = 2;
    @Builder.Default
    int genericWeight = 1;
    @Builder.Default
    int capabilityWeight = 1;

    // score <= lowMax is LOW, score <= mediumMax is MEDIUM, anything above is HIGH
    @Builder.Default
    int lowMax = 3;
    @Builder.Default
    int mediumMax = 7;

    public static ComplexityPolicy defaults() {
        return ComplexityPolicy.builder().build();
    }

    public Complexity classify(int score) {
        if (lowMax > mediumMax) {
            throw new IllegalStateException("lowMax " + lowMax + " exceeds mediumMax " + mediumMax);
        }
        if (score <= lowMax) {
            return Complexity.LOW;
        }
        return score <= mediumMax ? Complexity.MEDIUM : Complexity.HIGH;
    }
}
