package com.vidnyan.j2py.domain.naming;

import com.vidnyan.j2py.domain.model.Modifier;

import java.util.Set;

/**
 * Kind of identifier, which decides the target naming convention.
 */
public enum IdentifierKind {
    METHOD,
    FIELD,
    PARAM,
    CONSTANT_FIELD,
    PRIVATE_METHOD,
    PRIVATE_FIELD;

    public static IdentifierKind forField(Set<Modifier> modifiers) {
        if (modifiers.contains(Modifier.STATIC) && modifiers.contains(Modifier.FINAL)) {
            return CONSTANT_FIELD;
        }
        return modifiers.contains(Modifier.PRIVATE) ? PRIVATE_FIELD : FIELD;
    }

    public static IdentifierKind forMethod(Set<Modifier> modifiers) {
        return modifiers.contains(Modifier.PRIVATE) ? PRIVATE_METHOD : METHOD;
    }

    public boolean isPrivate() {
        return this == PRIVATE_METHOD || this == PRIVATE_FIELD;
    }
}
