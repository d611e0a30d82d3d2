package com.vidnyan.j2py.domain.plan;

/**
 * Overall difficulty estimate of a whole unit.
 */
public enum Difficulty {
    EASY,
    MODERATE,
    COMPLEX
}
