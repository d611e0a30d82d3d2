package com.vidnyan.j2py.domain.mapped;

/**
 * Target-side markers produced from source modifier combinations.
 */
public enum TargetMarker {
    /** Static method, emitted with {@code @staticmethod}. */
    STATIC_METHOD,
    /** Method without implementation, emitted with {@code @abstractmethod}. */
    ABSTRACT_METHOD,
    /** Static final field, emitted as an upper-case class attribute. */
    CLASS_CONSTANT,
    /** Static mutable field, emitted as a class attribute. */
    CLASS_VARIABLE,
    /** Per-instance field, initialised in {@code __init__}. */
    INSTANCE_ATTRIBUTE,
    /** Final instance field. */
    READ_ONLY,
    /** Private member, underscore-prefixed name. */
    PRIVATE,
    /** Abstract class or interface, emitted with an {@code ABC} base. */
    ABSTRACT_CLASS
}
