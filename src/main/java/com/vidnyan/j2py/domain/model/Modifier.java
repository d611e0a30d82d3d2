package com.vidnyan.j2py.domain.model;

/**
 * Java modifiers as a closed enum so every mapping over them is an exhaustive switch.
 */
public enum Modifier {
    PUBLIC,
    PRIVATE,
    PROTECTED,
    STATIC,
    FINAL,
    ABSTRACT,
    SYNCHRONIZED,
    VOLATILE,
    TRANSIENT,
    NATIVE,
    STRICTFP,
    DEFAULT,
    SEALED,
    NON_SEALED
}
