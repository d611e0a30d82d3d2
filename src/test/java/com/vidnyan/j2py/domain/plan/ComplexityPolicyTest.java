package com.vidnyan.j2py.domain.plan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityPolicyTest {

    @Test
    void classify_ShouldBucketByThresholds() {
        ComplexityPolicy policy = ComplexityPolicy.defaults();

        assertEquals(Complexity.LOW, policy.classify(0));
        assertEquals(Complexity.LOW, policy.classify(3));
        assertEquals(Complexity.MEDIUM, policy.classify(4));
        assertEquals(Complexity.MEDIUM, policy.classify(7));
        assertEquals(Complexity.HIGH, policy.classify(8));
    }

    @Test
    void classify_ShouldHonourConfiguredThresholds() {
        ComplexityPolicy policy = ComplexityPolicy.defaults().toBuilder().lowMax(1).mediumMax(2).build();

        assertEquals(Complexity.MEDIUM, policy.classify(2));
        assertEquals(Complexity.HIGH, policy.classify(3));
    }

    @Test
    void classify_ShouldRejectInvertedThresholds() {
        ComplexityPolicy policy = ComplexityPolicy.builder().lowMax(9).mediumMax(2).build();

        assertThrows(IllegalStateException.class, () -> policy.classify(1));
    }
}
