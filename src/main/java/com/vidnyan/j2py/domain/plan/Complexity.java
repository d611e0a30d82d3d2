package com.vidnyan.j2py.domain.plan;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}
