package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * A field as declared in source. One instance per declarator, so {@code int a, b;} yields two.
 */
@Value
@Builder
public class FieldDecl {
    String name;
    TypeRef type;
    @Singular
    Set<Modifier> modifiers;
    String initializer; // verbatim expression text, may be null

    public Optional<String> getInitializer() {
        return Optional.ofNullable(initializer);
    }

    public boolean isConstant() {
        return modifiers.contains(Modifier.STATIC) && modifiers.contains(Modifier.FINAL);
    }

    public boolean isStatic() {
        return modifiers.contains(Modifier.STATIC);
    }
}
