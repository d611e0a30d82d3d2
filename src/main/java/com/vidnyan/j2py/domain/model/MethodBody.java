package com.vidnyan.j2py.domain.model;

import java.util.Objects;

/**
 * Body of a method or constructor. The core never interprets its contents.
 */
public sealed interface MethodBody permits MethodBody.Absent, MethodBody.OpaqueToken {

    static MethodBody absent() {
        return new Absent();
    }

    static MethodBody opaque(String rawText) {
        return new OpaqueToken(rawText);
    }

    default boolean isPresent() {
        return this instanceof OpaqueToken;
    }

    /**
     * No body in source (abstract or interface method).
     */
    record Absent() implements MethodBody {}

    /**
     * Verbatim source span of the body, braces included.
     */
    record OpaqueToken(String rawText) implements MethodBody {
        public OpaqueToken {
            Objects.requireNonNull(rawText, "rawText");
        }
    }
}
