package com.vidnyan.j2py.domain.plan;

/**
 * Component a plan step migrates. Declaration order is the per-class emission order.
 */
public enum StepComponent {
    CLASS,
    FIELDS,
    CONSTRUCTOR,
    METHODS
}
