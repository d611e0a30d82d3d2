package com.vidnyan.j2py.domain.model;

import lombok.Value;

/**
 * A method or constructor parameter.
 * Immutable value object.
 */
@Value(staticConstructor = "of")
public class ParamDecl {
    String name;
    TypeRef type;
}
