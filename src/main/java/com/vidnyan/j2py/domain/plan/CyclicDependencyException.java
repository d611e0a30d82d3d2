package com.vidnyan.j2py.domain.plan;

import lombok.Getter;

import java.util.List;

/**
 * Raised when class inheritance edges form a cycle. Fatal for the unit being planned.
 */
@Getter
public class CyclicDependencyException extends RuntimeException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Inheritance cycle detected: " + String.join(" → ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
